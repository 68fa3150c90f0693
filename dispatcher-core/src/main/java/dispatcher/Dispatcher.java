package dispatcher;

import dispatcher.registry.DefaultSubscriptionRegistry;
import dispatcher.registry.Subscription;
import dispatcher.registry.SubscriptionRegistry;
import dispatcher.spi.IdGenerator;
import dispatcher.spi.MetricsExporter;
import dispatcher.util.DefaultIdGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the library: routes subscriptions and dispatches to one
 * {@link SubscriptionRegistry} per event name.
 *
 * <p>Registries are created lazily by the first subscribe for an event name and are only
 * dropped by {@link #unsubscribeByEvent}, {@link #unsubscribeByEventName} or
 * {@link #unsubscribeAll()}.
 *
 * <p>Dispatch is synchronous: every subscriber runs on the calling thread before
 * {@link #dispatch} returns. Subscriber failures never escape {@code dispatch}; they are
 * collected on the returned {@link Notification}. Every other operation fails fast.
 *
 * <pre>{@code
 * Dispatcher dispatcher = Dispatcher.builder().build();
 *
 * String functionId = dispatcher.subscribe("Ping", Subscriber.named("f", (event, args) -> 42),
 *     "test", false, 0);
 *
 * Notification first = dispatcher.dispatch(dispatcher.newEvent("Ping"), "test");
 * first.get("f");        // 42
 * Notification second = dispatcher.dispatch(dispatcher.newEvent("Ping"), "test");
 * second.content();      // {} - the one-shot subscription was retired
 * }</pre>
 *
 * <p>This class is thread-safe.
 *
 * @see Dispatcher.Builder
 * @see SubscriptionRegistry
 * @see Notification
 */
public final class Dispatcher {
  private static final Logger logger = Logger.getLogger(Dispatcher.class.getName());

  private final Map<String, SubscriptionRegistry> registries = new ConcurrentHashMap<>();

  private final IdGenerator idGenerator;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final List<DispatchInterceptor> interceptors;
  private final EventFactory eventFactory;
  private final NotificationFactory notificationFactory;

  private Dispatcher(Builder builder) {
    this.idGenerator = builder.idGenerator != null ? builder.idGenerator : DefaultIdGenerator.shared();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
    this.eventFactory = new EventFactory(idGenerator);
    this.notificationFactory = new NotificationFactory(idGenerator);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a dispatcher with default settings.
   *
   * @return a new dispatcher
   */
  public static Dispatcher create() {
    return builder().build();
  }

  public EventFactory eventFactory() {
    return eventFactory;
  }

  /**
   * Creates an event using this dispatcher's id generator.
   *
   * @param name the event name
   * @return a new event with an empty payload
   */
  public Event newEvent(String name) {
    return eventFactory.create(name);
  }

  // ── Subscribe ───────────────────────────────────────────────────

  public String subscribe(Event event, Subscriber subscriber, String namespace) {
    return subscribe(event, subscriber, namespace, false, 0);
  }

  /**
   * Subscribes a callback to an event within a namespace.
   *
   * @param event the event, only its name is used for routing
   * @param subscriber the callback, compared by identity
   * @param namespace the namespace
   * @param persistent {@code false} to remove the subscription after its first invocation
   * @param priority invocation order key, lower runs first
   * @return the function id of the new subscription
   * @throws DuplicateSubscriptionException if the subscriber is already in this event's namespace
   */
  public String subscribe(Event event, Subscriber subscriber, String namespace, boolean persistent, int priority) {
    Objects.requireNonNull(event, "event");
    String[] functionId = new String[1];
    // Runs under the map entry: the registry stays mapped until the subscription is in it.
    registries.compute(event.name(), (eventName, existing) -> {
      SubscriptionRegistry registry = existing != null ? existing : newRegistry(eventName);
      functionId[0] = registry.subscribe(namespace, subscriber, persistent, priority);
      return registry;
    });
    metrics.recordActiveSubscriptions(subscriptionCount());
    return functionId[0];
  }

  public String subscribe(String eventName, Subscriber subscriber, String namespace) {
    return subscribe(eventName, subscriber, namespace, false, 0);
  }

  /**
   * Subscribes a callback to an event name. The name is first resolved into a new {@link Event}.
   *
   * @return the function id of the new subscription
   * @see #subscribe(Event, Subscriber, String, boolean, int)
   */
  public String subscribe(String eventName, Subscriber subscriber, String namespace, boolean persistent, int priority) {
    return subscribe(eventFactory.create(eventName), subscriber, namespace, persistent, priority);
  }

  public String subscribe(SubscriptionRequest request) {
    return subscribe(request.eventName(), request.subscriber(), request.namespace(),
        request.persistent(), request.priority());
  }

  /**
   * Performs each request in order. Stops at the first failure; earlier requests stay subscribed.
   *
   * @param requests the subscriptions to perform
   * @return the function ids, in request order
   */
  public List<String> subscribeAll(Collection<SubscriptionRequest> requests) {
    List<String> functionIds = new ArrayList<>(requests.size());
    for (SubscriptionRequest request : requests) {
      functionIds.add(subscribe(request));
    }
    return functionIds;
  }

  public List<String> bulkSubscribe(Iterable<Event> events, Subscriber subscriber, String namespace,
      boolean persistent, int priority) {
    List<String> functionIds = new ArrayList<>();
    for (Event event : events) {
      functionIds.add(subscribe(event, subscriber, namespace, persistent, priority));
    }
    return functionIds;
  }

  public List<String> bulkSubscribeNames(Iterable<String> eventNames, Subscriber subscriber, String namespace,
      boolean persistent, int priority) {
    List<String> functionIds = new ArrayList<>();
    for (String eventName : eventNames) {
      functionIds.add(subscribe(eventName, subscriber, namespace, persistent, priority));
    }
    return functionIds;
  }

  private SubscriptionRegistry newRegistry(String eventName) {
    SubscriptionRegistry registry = DefaultSubscriptionRegistry.builder()
        .idGenerator(idGenerator)
        .metrics(metrics)
        .clock(clock)
        .build();
    logger.fine(() -> "Created registry " + registry.id() + " for event " + eventName);
    return registry;
  }

  // ── Dispatch ────────────────────────────────────────────────────

  /**
   * Invokes every subscriber of {@code event.name()} in {@code namespace}.
   *
   * <p>When nothing is subscribed, the notification has empty content, no errors and
   * status {@link NotificationStatus#SUCCESS}.
   *
   * @param event the event to dispatch
   * @param namespace the namespace to dispatch
   * @param args extra arguments handed to each subscriber
   * @return the completed notification, never null
   */
  public Notification dispatch(Event event, String namespace, Object... args) {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(namespace, "namespace");

    for (DispatchInterceptor interceptor : interceptors) {
      interceptor.beforeDispatch(event, namespace);
    }

    Instant start = clock.instant();
    Notification.Builder builder = notificationFactory.builder()
        .start(start)
        .event(event)
        .namespace(namespace);

    SubscriptionRegistry registry = registries.get(event.name());
    if (registry != null) {
      registry.dispatch(event, builder, namespace, args);
    }

    Instant end = clock.instant();
    Notification notification = builder.end(end.isBefore(start) ? start : end).build();

    metrics.incrementDispatched();
    metrics.recordDispatchDurationMs(notification.duration().toMillis());
    if (registry != null) {
      metrics.recordActiveSubscriptions(subscriptionCount());
    }
    logger.fine(() -> "Dispatched " + event.name() + " to namespace=" + namespace
        + ": status=" + notification.status() + ", results=" + notification.content().size()
        + ", errors=" + notification.errors().size());

    runAfterDispatch(notification);
    return notification;
  }

  private void runAfterDispatch(Notification notification) {
    for (int i = interceptors.size() - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterDispatch(notification);
      } catch (RuntimeException ex) {
        logger.log(Level.WARNING, "Interceptor afterDispatch failed", ex);
      }
    }
  }

  /**
   * Dispatches each event in order. Each dispatch is independent; subscriber failures in one
   * do not affect the others.
   *
   * @return one notification per event, in order
   */
  public List<Notification> bulkDispatch(Iterable<Event> events, String namespace, Object... args) {
    List<Notification> notifications = new ArrayList<>();
    for (Event event : events) {
      notifications.add(dispatch(event, namespace, args));
    }
    return notifications;
  }

  // ── Unsubscribe ─────────────────────────────────────────────────

  /**
   * Removes subscriptions by the first non-null selector, in the order function id, event,
   * subscriber, namespace.
   *
   * @return the result of the selected removal
   * @throws IllegalArgumentException if all selectors are null
   */
  public boolean unsubscribe(String functionId, Event event, Subscriber subscriber, String namespace) {
    if (functionId != null) {
      return unsubscribeByFunctionId(functionId);
    } else if (event != null) {
      return unsubscribeByEvent(event);
    } else if (subscriber != null) {
      return unsubscribeBySubscriber(subscriber);
    } else if (namespace != null) {
      return unsubscribeByNamespace(namespace);
    }
    throw new IllegalArgumentException("One of functionId, event, subscriber or namespace must be provided");
  }

  /**
   * Applies the removals category by category: function ids, events, subscribers, namespaces.
   * The first failure propagates; removals already applied are kept.
   *
   * @param functionIds function ids to remove, may be null
   * @param events events whose registries are dropped, may be null
   * @param subscribers subscribers to remove everywhere, may be null
   * @param namespaces namespaces to clear in every registry, may be null
   * @return one result per removal, in the order applied
   */
  public List<Boolean> bulkUnsubscribe(Collection<String> functionIds, Collection<Event> events,
      Collection<Subscriber> subscribers, Collection<String> namespaces) {
    List<Boolean> results = new ArrayList<>();
    for (String functionId : orEmpty(functionIds)) {
      results.add(unsubscribeByFunctionId(functionId));
    }
    for (Event event : orEmpty(events)) {
      results.add(unsubscribeByEvent(event));
    }
    for (Subscriber subscriber : orEmpty(subscribers)) {
      results.add(unsubscribeBySubscriber(subscriber));
    }
    for (String namespace : orEmpty(namespaces)) {
      results.add(unsubscribeByNamespace(namespace));
    }
    return results;
  }

  private static <T> Collection<T> orEmpty(Collection<T> values) {
    return values == null ? List.of() : values;
  }

  /**
   * @throws SubscriptionNotFoundException if no registry holds the function id
   */
  public boolean unsubscribeByFunctionId(String functionId) {
    Objects.requireNonNull(functionId, "functionId");
    for (SubscriptionRegistry registry : registries.values()) {
      if (registry.removeByFunctionId(functionId)) {
        metrics.recordActiveSubscriptions(subscriptionCount());
        return true;
      }
    }
    throw new SubscriptionNotFoundException("No subscription found with function ID '" + functionId + "'");
  }

  public boolean unsubscribeByEvent(Event event) {
    Objects.requireNonNull(event, "event");
    return unsubscribeByEventName(event.name());
  }

  /**
   * Drops the registry of an event name together with all its subscriptions.
   *
   * @throws SubscriptionNotFoundException if nothing was ever subscribed to the event name
   */
  public boolean unsubscribeByEventName(String eventName) {
    Objects.requireNonNull(eventName, "eventName");
    if (registries.remove(eventName) == null) {
      throw new SubscriptionNotFoundException("Event '" + eventName + "' does not exist");
    }
    logger.fine(() -> "Removed registry for event " + eventName);
    metrics.recordActiveSubscriptions(subscriptionCount());
    return true;
  }

  /**
   * Removes a subscriber instance from every registry and namespace.
   *
   * @return {@code true}
   * @throws SubscriptionNotFoundException if no registry holds the subscriber
   */
  public boolean unsubscribeBySubscriber(Subscriber subscriber) {
    Objects.requireNonNull(subscriber, "subscriber");
    boolean found = false;
    for (SubscriptionRegistry registry : registries.values()) {
      found |= registry.removeBySubscriber(subscriber);
    }
    if (!found) {
      throw new SubscriptionNotFoundException("No subscription found for subscriber '" + subscriber.name() + "'");
    }
    metrics.recordActiveSubscriptions(subscriptionCount());
    return true;
  }

  /**
   * Removes a namespace from every registry that has it. Registries without it are left alone.
   *
   * @return whether at least one registry held the namespace
   */
  public boolean unsubscribeByNamespace(String namespace) {
    Objects.requireNonNull(namespace, "namespace");
    boolean found = false;
    for (SubscriptionRegistry registry : registries.values()) {
      found |= registry.removeByNamespace(namespace);
    }
    if (found) {
      metrics.recordActiveSubscriptions(subscriptionCount());
    }
    return found;
  }

  /**
   * Drops every registry.
   */
  public void unsubscribeAll() {
    registries.clear();
    metrics.recordActiveSubscriptions(0);
  }

  /**
   * Removes each function id, then clears {@code functionIds}.
   *
   * @param functionIds mutable collection of function ids
   * @throws SubscriptionNotFoundException at the first unknown id; the collection is then left untouched
   */
  public void unsubscribeAll(Collection<String> functionIds) {
    for (String functionId : functionIds) {
      unsubscribeByFunctionId(functionId);
    }
    functionIds.clear();
  }

  // ── Lookup ──────────────────────────────────────────────────────

  public Optional<SubscriptionRegistry> registry(String eventName) {
    return Optional.ofNullable(registries.get(eventName));
  }

  /**
   * Returns the event names that currently have a registry, sorted.
   *
   * @return the event names
   */
  public Set<String> eventNames() {
    return Collections.unmodifiableSet(new TreeSet<>(registries.keySet()));
  }

  /**
   * Returns the subscriptions of a namespace across all event registries.
   *
   * @param namespace the namespace
   * @return the subscriptions, grouped by event name in sorted order
   */
  public List<Subscription> subscribersFor(String namespace) {
    List<Subscription> result = new ArrayList<>();
    for (String eventName : eventNames()) {
      SubscriptionRegistry registry = registries.get(eventName);
      if (registry != null) {
        result.addAll(registry.subscribersFor(namespace));
      }
    }
    return Collections.unmodifiableList(result);
  }

  public int subscriptionCount() {
    int count = 0;
    for (SubscriptionRegistry registry : registries.values()) {
      count += registry.size();
    }
    return count;
  }

  @Override
  public String toString() {
    return "Dispatcher{events=" + eventNames() + ", subscriptions=" + subscriptionCount() + '}';
  }

  /** Builder for {@link Dispatcher}. */
  public static final class Builder {
    private IdGenerator idGenerator;
    private Clock clock;
    private MetricsExporter metrics;
    private final List<DispatchInterceptor> interceptors = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the generator for event, notification, registry and subscription ids.
     *
     * <p>Optional. Defaults to {@link DefaultIdGenerator#shared()}.
     *
     * @param idGenerator the id generator
     * @return this builder
     */
    public Builder idGenerator(IdGenerator idGenerator) {
      this.idGenerator = idGenerator;
      return this;
    }

    /**
     * Sets the clock for notification timestamps and {@link Event#lastNotified()}.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Appends a dispatch interceptor.
     *
     * <p>Optional. Interceptors are invoked in registration order before dispatch,
     * and in reverse order after dispatch.
     *
     * @param interceptor the interceptor to add
     * @return this builder
     */
    public Builder interceptor(DispatchInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public Builder interceptors(List<DispatchInterceptor> interceptors) {
      interceptors.forEach(this::interceptor);
      return this;
    }

    public Dispatcher build() {
      return new Dispatcher(this);
    }
  }
}
