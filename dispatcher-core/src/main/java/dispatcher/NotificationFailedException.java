package dispatcher;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown by {@link Notification#handle()} when at least one subscriber failed.
 *
 * <p>The first recorded subscriber exception, if any, is attached as the cause.
 */
public final class NotificationFailedException extends DispatchException {

    private final List<SubscriberError> errors;

    public NotificationFailedException(List<SubscriberError> errors) {
        super("Notification has " + errors.size() + " error(s): " + errors.stream()
                .map(e -> e.subscriberName() + ": " + e.message())
                .collect(Collectors.joining(", ")));
        this.errors = List.copyOf(errors);
        Throwable first = this.errors.get(0).cause();
        if (first != null) {
            initCause(first);
        }
    }

    public List<SubscriberError> errors() {
        return errors;
    }
}
