package dispatcher;

/**
 * Thrown on an attempt to write to {@link Notification} content after it was built.
 */
public final class ImmutableContentException extends DispatcherException {

    public ImmutableContentException(String key) {
        super("Notification content is immutable; cannot set '" + key + "'");
    }
}
