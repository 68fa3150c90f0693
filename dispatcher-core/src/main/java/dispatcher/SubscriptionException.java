package dispatcher;

/**
 * Thrown when a subscription cannot be registered.
 */
public class SubscriptionException extends DispatcherException {

    public SubscriptionException(String message) {
        super(message);
    }
}
