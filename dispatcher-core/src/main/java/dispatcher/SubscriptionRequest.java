package dispatcher;

import java.util.Objects;

/**
 * A subscription to perform through {@link Dispatcher#subscribeAll}.
 *
 * @param eventName name of the event to subscribe to
 * @param subscriber the callback
 * @param namespace the namespace, {@link Namespaces#GLOBAL} if null
 * @param persistent {@code false} for a one-shot subscription
 * @param priority invocation order key, lower runs first
 */
public record SubscriptionRequest(
    String eventName,
    Subscriber subscriber,
    String namespace,
    boolean persistent,
    int priority) {

  public SubscriptionRequest {
    Objects.requireNonNull(eventName, "eventName");
    Objects.requireNonNull(subscriber, "subscriber");
    if (namespace == null) {
      namespace = Namespaces.GLOBAL;
    }
  }

  /**
   * A one-shot subscription in the global namespace with priority 0.
   */
  public static SubscriptionRequest of(String eventName, Subscriber subscriber) {
    return new SubscriptionRequest(eventName, subscriber, Namespaces.GLOBAL, false, 0);
  }

  public static SubscriptionRequest of(String eventName, Subscriber subscriber, String namespace) {
    return new SubscriptionRequest(eventName, subscriber, namespace, false, 0);
  }
}
