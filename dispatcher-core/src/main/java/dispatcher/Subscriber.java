package dispatcher;

import java.util.Objects;

/**
 * Callback invoked when an event is dispatched to the namespace it is subscribed to.
 *
 * <p>Subscribers run <b>synchronously</b> on the thread that calls
 * {@link Dispatcher#dispatch}, in ascending priority order. The value returned is stored
 * in the {@link Notification} content under {@link #name()}. A thrown exception is
 * recorded as a {@link SubscriberError} and does not stop the remaining subscribers.
 *
 * <h2>Identity</h2>
 * <p>A subscription is bound to the subscriber <em>instance</em>. Keep the reference you
 * subscribed with if you want to unsubscribe by subscriber later; a second lambda with the
 * same body is a different subscriber.
 *
 * <pre>{@code
 * Subscriber audit = Subscriber.named("audit", (event, args) -> log(event));
 * String functionId = dispatcher.subscribe("OrderPlaced", audit, Namespaces.GLOBAL);
 * ...
 * dispatcher.unsubscribeBySubscriber(audit);
 * }</pre>
 */
@FunctionalInterface
public interface Subscriber {

  /**
   * Handles a dispatched event.
   *
   * @param event the event being dispatched
   * @param args extra arguments passed to {@code dispatch}, possibly empty
   * @return the result to record in the notification, may be null
   * @throws Exception if handling fails; recorded on the notification
   */
  Object onEvent(Event event, Object... args) throws Exception;

  /**
   * Key under which this subscriber's result is recorded in notification content.
   *
   * <p>Defaults to the simple class name, or {@code "lambda"} for lambdas and method
   * references. Two subscribers sharing a name overwrite each other's result.
   *
   * @return the subscriber name, never null
   */
  default String name() {
    Class<?> type = getClass();
    if (type.isSynthetic() || type.getName().contains("$$Lambda")) {
      return "lambda";
    }
    String simpleName = type.getSimpleName();
    return simpleName.isEmpty() ? type.getName() : simpleName;
  }

  /**
   * Wraps a subscriber with an explicit name.
   *
   * @param name the name used as notification content key
   * @param delegate the callback
   * @return a new subscriber; unsubscribe with this instance, not the delegate
   */
  static Subscriber named(String name, Subscriber delegate) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(delegate, "delegate");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("name cannot be empty");
    }
    return new Subscriber() {
      @Override
      public Object onEvent(Event event, Object... args) throws Exception {
        return delegate.onEvent(event, args);
      }

      @Override
      public String name() {
        return name;
      }

      @Override
      public String toString() {
        return "Subscriber{" + name + "}";
      }
    };
  }
}
