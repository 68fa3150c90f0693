package dispatcher.registry;

import dispatcher.Subscriber;

import java.util.Objects;

/**
 * One subscriber entry held by a {@link SubscriptionRegistry}.
 *
 * @param functionId unique handle of this subscription, used for removal
 * @param subscriber the callback, compared by identity
 * @param namespace namespace the subscriber listens on
 * @param persistent {@code false} if the entry is removed after its first invocation
 * @param priority invocation order key, lower runs first
 */
public record Subscription(
    String functionId,
    Subscriber subscriber,
    String namespace,
    boolean persistent,
    int priority) {

  public Subscription {
    Objects.requireNonNull(functionId, "functionId");
    Objects.requireNonNull(subscriber, "subscriber");
    Objects.requireNonNull(namespace, "namespace");
  }
}
