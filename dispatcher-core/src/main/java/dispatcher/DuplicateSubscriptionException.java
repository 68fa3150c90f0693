package dispatcher;

/**
 * Thrown when the same {@link Subscriber} instance is subscribed twice to one namespace
 * of the same event.
 */
public final class DuplicateSubscriptionException extends SubscriptionException {

    private final String namespace;

    public DuplicateSubscriptionException(String subscriberName, String namespace) {
        super("Subscriber '" + subscriberName + "' is already subscribed to namespace '" + namespace + "'");
        this.namespace = namespace;
    }

    public String namespace() {
        return namespace;
    }
}
