package dispatcher.registry;

import dispatcher.DuplicateSubscriptionException;
import dispatcher.Event;
import dispatcher.Notification;
import dispatcher.NotificationStatus;
import dispatcher.Subscriber;
import dispatcher.SubscriberError;
import dispatcher.SubscriptionNotFoundException;
import dispatcher.spi.IdGenerator;
import dispatcher.spi.MetricsExporter;
import dispatcher.util.DefaultIdGenerator;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe registry for the subscriptions of one event name.
 *
 * <p>Subscriptions are indexed by function id and, per namespace, kept in registration
 * order. A namespace disappears as soon as its last subscription is removed.
 *
 * <h2>Dispatch</h2>
 * <p>{@link #dispatch} takes a snapshot of the namespace, sorts it by priority (stable, so
 * equal priorities keep registration order) and invokes each subscriber outside the lock.
 * Subscribers may therefore subscribe or unsubscribe while being dispatched:
 * <ul>
 *   <li>subscriptions added during the pass are not invoked by it</li>
 *   <li>subscriptions removed during the pass are skipped if not yet invoked</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SubscriptionRegistry registry = DefaultSubscriptionRegistry.builder().build();
 * String id = registry.subscribe("local", (event, args) -> event.get("total"), true, 10);
 * registry.dispatch(event, notificationFactory.builder(), "local");
 * registry.unsubscribeByFunctionId(id);
 * }</pre>
 *
 * @see SubscriptionRegistry
 */
public final class DefaultSubscriptionRegistry implements SubscriptionRegistry {
  private static final Logger logger = Logger.getLogger(DefaultSubscriptionRegistry.class.getName());

  private static final Comparator<Subscription> BY_PRIORITY = Comparator.comparingInt(Subscription::priority);

  private final long id;
  private final IdGenerator idGenerator;
  private final MetricsExporter metrics;
  private final Clock clock;

  private final Object lock = new Object();
  private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();
  private final Map<String, List<String>> namespaces = new LinkedHashMap<>();

  private DefaultSubscriptionRegistry(Builder builder) {
    this.idGenerator = builder.idGenerator != null ? builder.idGenerator : DefaultIdGenerator.shared();
    this.id = builder.id != null ? builder.id : idGenerator.nextId();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    for (Subscription subscription : builder.initial) {
      add(subscription);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public long id() {
    return id;
  }

  @Override
  public String subscribe(String namespace, Subscriber subscriber, boolean persistent, int priority) {
    Objects.requireNonNull(namespace, "namespace");
    Objects.requireNonNull(subscriber, "subscriber");
    Subscription subscription = new Subscription(idGenerator.nextCode(), subscriber, namespace, persistent, priority);
    add(subscription);
    logger.fine(() -> "Subscribed " + subscriber.name() + " to namespace=" + namespace
        + " (functionId=" + subscription.functionId() + ", persistent=" + persistent
        + ", priority=" + priority + ")");
    return subscription.functionId();
  }

  private void add(Subscription subscription) {
    synchronized (lock) {
      List<String> ids = namespaces.get(subscription.namespace());
      if (ids != null) {
        for (String functionId : ids) {
          if (subscriptions.get(functionId).subscriber() == subscription.subscriber()) {
            throw new DuplicateSubscriptionException(subscription.subscriber().name(), subscription.namespace());
          }
        }
      }
      if (subscriptions.containsKey(subscription.functionId())) {
        throw new IllegalArgumentException("Duplicate functionId: " + subscription.functionId());
      }
      namespaces.computeIfAbsent(subscription.namespace(), ignored -> new ArrayList<>()).add(subscription.functionId());
      subscriptions.put(subscription.functionId(), subscription);
    }
  }

  @Override
  public Notification.Builder dispatch(Event event, Notification.Builder builder, String namespace, Object... args) {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(builder, "builder");
    Objects.requireNonNull(namespace, "namespace");
    Object[] arguments = args == null ? new Object[0] : args;

    List<Subscription> snapshot;
    synchronized (lock) {
      List<String> ids = namespaces.get(namespace);
      if (ids == null) {
        return builder;
      }
      snapshot = new ArrayList<>(ids.size());
      for (String functionId : ids) {
        Subscription subscription = subscriptions.get(functionId);
        if (subscription != null) {
          snapshot.add(subscription);
        }
      }
    }
    snapshot.sort(BY_PRIORITY);

    List<String> retired = new ArrayList<>();
    for (Subscription subscription : snapshot) {
      if (!isRegistered(subscription.functionId())) {
        continue;
      }
      invoke(subscription, event, builder, namespace, arguments);
      if (!subscription.persistent()) {
        retired.add(subscription.functionId());
      }
    }

    int removed = 0;
    synchronized (lock) {
      for (String functionId : retired) {
        if (remove(functionId)) {
          removed++;
        }
      }
    }
    if (removed > 0) {
      metrics.incrementSubscriptionsRetired(removed);
    }
    event.markNotified(clock.instant());
    return builder;
  }

  private void invoke(Subscription subscription, Event event, Notification.Builder builder,
      String namespace, Object[] args) {
    Subscriber subscriber = subscription.subscriber();
    long startNanos = System.nanoTime();
    try {
      Object result = subscriber.onEvent(event, args);
      builder.content(subscriber.name(), result);
      if (builder.status() != NotificationStatus.FAILURE) {
        builder.status(NotificationStatus.SUCCESS);
      }
      metrics.incrementSubscriberSuccess();
    } catch (Throwable e) {
      logger.log(Level.WARNING, "Subscriber " + subscriber.name() + " failed for event=" + event.name()
          + ", namespace=" + namespace + ", functionId=" + subscription.functionId(), e);
      builder.error(SubscriberError.of(subscription.functionId(), subscriber.name(), namespace, e));
      builder.status(NotificationStatus.FAILURE);
      metrics.incrementSubscriberFailure();
    } finally {
      metrics.recordSubscriberDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }
  }

  private boolean isRegistered(String functionId) {
    synchronized (lock) {
      return subscriptions.containsKey(functionId);
    }
  }

  // Caller holds the lock.
  private boolean remove(String functionId) {
    Subscription subscription = subscriptions.remove(functionId);
    if (subscription == null) {
      return false;
    }
    List<String> ids = namespaces.get(subscription.namespace());
    if (ids != null) {
      ids.remove(functionId);
      if (ids.isEmpty()) {
        namespaces.remove(subscription.namespace());
      }
    }
    return true;
  }

  @Override
  public boolean unsubscribe(String functionId, String namespace, Subscriber subscriber) {
    if (functionId != null) {
      return unsubscribeByFunctionId(functionId);
    } else if (namespace != null) {
      return unsubscribeByNamespace(namespace);
    } else if (subscriber != null) {
      return unsubscribeBySubscriber(subscriber);
    }
    throw new IllegalArgumentException("One of functionId, namespace or subscriber must be provided");
  }

  @Override
  public boolean unsubscribeByFunctionId(String functionId) {
    if (!removeByFunctionId(functionId)) {
      throw new SubscriptionNotFoundException("Function ID '" + functionId + "' not found");
    }
    return true;
  }

  @Override
  public boolean removeByFunctionId(String functionId) {
    Objects.requireNonNull(functionId, "functionId");
    boolean removed;
    synchronized (lock) {
      removed = remove(functionId);
    }
    if (removed) {
      logger.fine(() -> "Unsubscribed functionId=" + functionId);
    }
    return removed;
  }

  @Override
  public boolean unsubscribeByNamespace(String namespace) {
    if (!removeByNamespace(namespace)) {
      throw new SubscriptionNotFoundException("Namespace '" + namespace + "' not found");
    }
    return true;
  }

  @Override
  public boolean removeByNamespace(String namespace) {
    Objects.requireNonNull(namespace, "namespace");
    synchronized (lock) {
      List<String> ids = namespaces.remove(namespace);
      if (ids == null) {
        return false;
      }
      for (String functionId : ids) {
        subscriptions.remove(functionId);
      }
    }
    logger.fine(() -> "Unsubscribed namespace=" + namespace);
    return true;
  }

  @Override
  public boolean unsubscribeBySubscriber(Subscriber subscriber) {
    if (!removeBySubscriber(subscriber)) {
      throw new SubscriptionNotFoundException("Subscriber '" + subscriber.name() + "' not found in any subscription");
    }
    return true;
  }

  @Override
  public boolean removeBySubscriber(Subscriber subscriber) {
    Objects.requireNonNull(subscriber, "subscriber");
    synchronized (lock) {
      List<String> matches = new ArrayList<>();
      for (Subscription subscription : subscriptions.values()) {
        if (subscription.subscriber() == subscriber) {
          matches.add(subscription.functionId());
        }
      }
      if (matches.isEmpty()) {
        return false;
      }
      for (String functionId : matches) {
        remove(functionId);
      }
    }
    logger.fine(() -> "Unsubscribed subscriber " + subscriber.name());
    return true;
  }

  @Override
  public void unsubscribeAll() {
    synchronized (lock) {
      subscriptions.clear();
      namespaces.clear();
    }
  }

  @Override
  public void clear() {
    unsubscribeAll();
  }

  @Override
  public List<Subscription> subscribersFor(String namespace) {
    synchronized (lock) {
      List<String> ids = namespaces.get(namespace);
      if (ids == null) {
        return List.of();
      }
      List<Subscription> result = new ArrayList<>(ids.size());
      for (String functionId : ids) {
        Subscription subscription = subscriptions.get(functionId);
        if (subscription != null) {
          result.add(subscription);
        }
      }
      return Collections.unmodifiableList(result);
    }
  }

  @Override
  public Optional<Subscription> status(String functionId) {
    synchronized (lock) {
      return Optional.ofNullable(subscriptions.get(functionId));
    }
  }

  @Override
  public boolean contains(String functionId, String namespace) {
    synchronized (lock) {
      if (functionId != null) {
        return subscriptions.containsKey(functionId);
      } else if (namespace != null) {
        return namespaces.containsKey(namespace);
      }
    }
    throw new IllegalArgumentException("At least one of functionId or namespace must be provided");
  }

  @Override
  public boolean containsSubscriber(Subscriber subscriber) {
    synchronized (lock) {
      for (Subscription subscription : subscriptions.values()) {
        if (subscription.subscriber() == subscriber) {
          return true;
        }
      }
      return false;
    }
  }

  @Override
  public Set<String> namespaces() {
    synchronized (lock) {
      return Collections.unmodifiableSet(new LinkedHashSet<>(namespaces.keySet()));
    }
  }

  @Override
  public int size() {
    synchronized (lock) {
      return subscriptions.size();
    }
  }

  @Override
  public String toString() {
    synchronized (lock) {
      return "DefaultSubscriptionRegistry{id=" + id
          + ", namespaces=" + namespaces.keySet()
          + ", subscriptions=" + subscriptions.size() + '}';
    }
  }

  /** Builder for {@link DefaultSubscriptionRegistry}. */
  public static final class Builder {
    private Long id;
    private IdGenerator idGenerator;
    private MetricsExporter metrics;
    private Clock clock;
    private final List<Subscription> initial = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the registry id.
     *
     * <p>Optional. Defaults to the next id of the configured {@link IdGenerator}.
     *
     * @param id the registry id
     * @return this builder
     */
    public Builder id(long id) {
      this.id = id;
      return this;
    }

    /**
     * Sets the generator for the registry id and subscription function ids.
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
     * Sets the metrics exporter for subscriber outcomes and retired subscriptions.
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
     * Sets the clock used to stamp {@link Event#lastNotified()}.
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
     * Pre-registers an existing subscription, keeping its function id.
     *
     * @param subscription the subscription to register
     * @return this builder
     */
    public Builder subscription(Subscription subscription) {
      this.initial.add(Objects.requireNonNull(subscription, "subscription"));
      return this;
    }

    /**
     * Builds the registry.
     *
     * @return a new registry
     * @throws DuplicateSubscriptionException if pre-registered subscriptions repeat a
     *     subscriber within one namespace
     */
    public DefaultSubscriptionRegistry build() {
      return new DefaultSubscriptionRegistry(this);
    }
  }
}
