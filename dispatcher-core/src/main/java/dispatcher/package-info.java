/**
 * In-process publish/subscribe event dispatcher.
 *
 * <p>{@link dispatcher.Dispatcher} keeps one {@link dispatcher.registry.SubscriptionRegistry}
 * per event name. Subscribers register a callback for an event name within a namespace;
 * dispatching an {@link dispatcher.Event} to a namespace invokes every matching subscriber
 * synchronously and returns a {@link dispatcher.Notification} that aggregates the results
 * and failures.
 *
 * @see dispatcher.Dispatcher
 * @see dispatcher.Event
 * @see dispatcher.Notification
 * @see dispatcher.Subscriber
 */
package dispatcher;
