package dispatcher.registry;

import dispatcher.Event;
import dispatcher.Notification;
import dispatcher.Subscriber;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Subscriptions of a single event name, grouped by namespace.
 *
 * <p>A {@link dispatcher.Dispatcher} owns one registry per event name and routes
 * subscribe, dispatch and unsubscribe calls to it.
 *
 * @see DefaultSubscriptionRegistry
 */
public interface SubscriptionRegistry {

  /**
   * Returns the numeric id assigned when this registry was created.
   *
   * @return the registry id
   */
  long id();

  /**
   * Subscribes a one-shot subscriber with priority 0.
   *
   * @param namespace the namespace
   * @param subscriber the callback
   * @return the new function id
   * @throws dispatcher.DuplicateSubscriptionException if the subscriber is already in the namespace
   */
  default String subscribe(String namespace, Subscriber subscriber) {
    return subscribe(namespace, subscriber, false, 0);
  }

  /**
   * Registers a subscriber under a namespace.
   *
   * @param namespace the namespace
   * @param subscriber the callback, compared by identity
   * @param persistent {@code false} to remove the subscription after its first invocation
   * @param priority invocation order key, lower runs first
   * @return the new function id
   * @throws dispatcher.DuplicateSubscriptionException if the subscriber is already in the namespace
   */
  String subscribe(String namespace, Subscriber subscriber, boolean persistent, int priority);

  /**
   * Invokes every subscriber of {@code namespace} in priority order and records the outcome
   * on {@code builder}.
   *
   * <p>Subscriber exceptions are recorded, never thrown. One-shot subscriptions are removed
   * after the pass. The builder is returned untouched if the namespace has no subscriptions.
   *
   * @param event the dispatched event
   * @param builder the notification being assembled
   * @param namespace the namespace to dispatch
   * @param args extra arguments handed to each subscriber
   * @return {@code builder}
   */
  Notification.Builder dispatch(Event event, Notification.Builder builder, String namespace, Object... args);

  /**
   * Removes subscriptions by the first non-null selector, in the order function id,
   * namespace, subscriber.
   *
   * @return {@code true} when something was removed
   * @throws IllegalArgumentException if all selectors are null
   * @throws dispatcher.SubscriptionNotFoundException if the selected target does not exist
   */
  boolean unsubscribe(String functionId, String namespace, Subscriber subscriber);

  /**
   * @throws dispatcher.SubscriptionNotFoundException if the function id is unknown
   */
  boolean unsubscribeByFunctionId(String functionId);

  /**
   * Removes every subscription of a namespace.
   *
   * @throws dispatcher.SubscriptionNotFoundException if the namespace has no subscriptions
   */
  boolean unsubscribeByNamespace(String namespace);

  /**
   * Removes every subscription of a subscriber instance, across all namespaces.
   *
   * @throws dispatcher.SubscriptionNotFoundException if the subscriber is not registered
   */
  boolean unsubscribeBySubscriber(Subscriber subscriber);

  /**
   * Removes the subscription with the given function id if it is present.
   *
   * @return {@code true} when a subscription was removed
   */
  boolean removeByFunctionId(String functionId);

  /**
   * Removes every subscription of a namespace if it has any.
   *
   * @return {@code true} when at least one subscription was removed
   */
  boolean removeByNamespace(String namespace);

  /**
   * Removes every subscription of a subscriber instance if it is registered.
   *
   * @return {@code true} when at least one subscription was removed
   */
  boolean removeBySubscriber(Subscriber subscriber);

  void unsubscribeAll();

  /**
   * Same as {@link #unsubscribeAll()}.
   */
  void clear();

  /**
   * Returns the subscriptions of a namespace in registration order.
   *
   * @param namespace the namespace
   * @return immutable list, empty if the namespace is unknown
   */
  List<Subscription> subscribersFor(String namespace);

  Optional<Subscription> status(String functionId);

  /**
   * Tests membership by function id, or by namespace when {@code functionId} is null.
   *
   * @throws IllegalArgumentException if both arguments are null
   */
  boolean contains(String functionId, String namespace);

  /**
   * Tests whether a subscriber instance is registered under any namespace.
   *
   * @param subscriber the callback, compared by identity
   * @return whether at least one subscription uses it
   */
  boolean containsSubscriber(Subscriber subscriber);

  Set<String> namespaces();

  /**
   * Returns the number of subscriptions across all namespaces.
   *
   * @return the subscription count
   */
  int size();
}
