package dispatcher;

/**
 * Thrown when the outcome of a dispatch cannot be consumed as requested.
 */
public class DispatchException extends DispatcherException {

    public DispatchException(String message) {
        super(message);
    }
}
