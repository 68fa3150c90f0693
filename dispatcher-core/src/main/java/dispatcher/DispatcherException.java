package dispatcher;

/**
 * Base class for all errors raised by the dispatcher.
 *
 * <p>Subscriber failures during {@link Dispatcher#dispatch} are never thrown as this type;
 * they are recorded on the resulting {@link Notification} instead.
 */
public class DispatcherException extends RuntimeException {

    public DispatcherException(String message) {
        super(message);
    }

    public DispatcherException(String message, Throwable cause) {
        super(message, cause);
    }
}
