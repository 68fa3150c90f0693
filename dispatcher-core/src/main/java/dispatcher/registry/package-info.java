/**
 * Per-event subscription storage and the dispatch pass over one namespace.
 *
 * <p>{@link dispatcher.registry.DefaultSubscriptionRegistry} indexes subscriptions twice:
 * by function id for removal, and by namespace (in registration order) for dispatch.
 *
 * @see dispatcher.registry.SubscriptionRegistry
 * @see dispatcher.registry.DefaultSubscriptionRegistry
 */
package dispatcher.registry;
