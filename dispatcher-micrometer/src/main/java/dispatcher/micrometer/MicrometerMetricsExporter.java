package dispatcher.micrometer;

import dispatcher.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code dispatcher.dispatch.count} - completed dispatch calls</li>
 *   <li>{@code dispatcher.subscriber.success} - subscriber invocations that returned</li>
 *   <li>{@code dispatcher.subscriber.failure} - subscriber invocations that threw</li>
 *   <li>{@code dispatcher.subscription.retired} - one-shot subscriptions removed after firing</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code dispatcher.subscription.active} - subscriptions currently registered</li>
 * </ul>
 *
 * <h3>Distribution summaries</h3>
 * <ul>
 *   <li>{@code dispatcher.dispatch.duration.ms} - time spent in one dispatch call</li>
 *   <li>{@code dispatcher.subscriber.duration.ms} - time spent in one subscriber</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  public static final String DEFAULT_PREFIX = "dispatcher";

  private final MeterRegistry registry;
  private final Counter dispatched;
  private final Counter subscriberSuccess;
  private final Counter subscriberFailure;
  private final Counter retired;
  private final Gauge activeGauge;
  private final DistributionSummary dispatchDuration;
  private final DistributionSummary subscriberDuration;

  private final AtomicInteger active = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@value #DEFAULT_PREFIX}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several dispatchers
   * against one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.dispatcher"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.dispatched = Counter.builder(namePrefix + ".dispatch.count")
        .description("Completed dispatch calls")
        .register(registry);
    this.subscriberSuccess = Counter.builder(namePrefix + ".subscriber.success")
        .description("Subscriber invocations that returned normally")
        .register(registry);
    this.subscriberFailure = Counter.builder(namePrefix + ".subscriber.failure")
        .description("Subscriber invocations that threw")
        .register(registry);
    this.retired = Counter.builder(namePrefix + ".subscription.retired")
        .description("One-shot subscriptions removed after firing")
        .register(registry);

    this.activeGauge = Gauge.builder(namePrefix + ".subscription.active", active, AtomicInteger::get)
        .description("Subscriptions currently registered")
        .register(registry);

    this.dispatchDuration = DistributionSummary.builder(namePrefix + ".dispatch.duration.ms")
        .description("Dispatch call duration")
        .baseUnit("milliseconds")
        .register(registry);
    this.subscriberDuration = DistributionSummary.builder(namePrefix + ".subscriber.duration.ms")
        .description("Single subscriber execution time")
        .baseUnit("milliseconds")
        .register(registry);
  }

  @Override
  public void incrementDispatched() {
    if (closed) return;
    dispatched.increment();
  }

  @Override
  public void incrementSubscriberSuccess() {
    if (closed) return;
    subscriberSuccess.increment();
  }

  @Override
  public void incrementSubscriberFailure() {
    if (closed) return;
    subscriberFailure.increment();
  }

  @Override
  public void incrementSubscriptionsRetired(int count) {
    if (closed) return;
    retired.increment(count);
  }

  @Override
  public void recordActiveSubscriptions(int count) {
    if (closed) return;
    active.set(count);
  }

  @Override
  public void recordDispatchDurationMs(long durationMs) {
    if (closed) return;
    dispatchDuration.record(durationMs);
  }

  @Override
  public void recordSubscriberDurationMs(long durationMs) {
    if (closed) return;
    subscriberDuration.record(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry. Later calls
   * are ignored.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(dispatched, subscriberSuccess, subscriberFailure, retired,
        activeGauge, dispatchDuration, subscriberDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
