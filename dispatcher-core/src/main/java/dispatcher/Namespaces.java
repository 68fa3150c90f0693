package dispatcher;

/**
 * Predefined namespace names. Any non-null string is a valid namespace.
 */
public final class Namespaces {

  /**
   * Namespace for subscriptions shared across the whole application.
   */
  public static final String GLOBAL = "global";

  /**
   * Namespace for subscriptions scoped to the current component.
   */
  public static final String LOCAL = "local";

  private Namespaces() {
  }
}
