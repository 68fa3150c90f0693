package dispatcher;

/**
 * Thrown when an unsubscribe target (function id, namespace, event or subscriber) does not exist.
 */
public final class SubscriptionNotFoundException extends DispatcherException {

    public SubscriptionNotFoundException(String message) {
        super(message);
    }
}
