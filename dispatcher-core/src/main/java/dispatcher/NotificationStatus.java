package dispatcher;

/**
 * Outcome of a dispatch call. {@link #FAILURE} as soon as one subscriber threw.
 */
public enum NotificationStatus {
  SUCCESS("success"),
  FAILURE("failure");

  private final String value;

  NotificationStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
