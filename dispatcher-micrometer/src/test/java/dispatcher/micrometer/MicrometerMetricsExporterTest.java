package dispatcher.micrometer;

import dispatcher.Dispatcher;
import dispatcher.Subscriber;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void incrementDispatched() {
    exporter.incrementDispatched();
    exporter.incrementDispatched();
    assertEquals(2.0, counter("dispatcher.dispatch.count").count());
  }

  @Test
  void incrementSubscriberOutcomes() {
    exporter.incrementSubscriberSuccess();
    exporter.incrementSubscriberSuccess();
    exporter.incrementSubscriberFailure();
    assertEquals(2.0, counter("dispatcher.subscriber.success").count());
    assertEquals(1.0, counter("dispatcher.subscriber.failure").count());
  }

  @Test
  void incrementSubscriptionsRetiredAddsCount() {
    exporter.incrementSubscriptionsRetired(3);
    exporter.incrementSubscriptionsRetired(1);
    assertEquals(4.0, counter("dispatcher.subscription.retired").count());
  }

  @Test
  void recordActiveSubscriptions() {
    exporter.recordActiveSubscriptions(12);
    assertEquals(12.0, gauge("dispatcher.subscription.active").value());

    exporter.recordActiveSubscriptions(0);
    assertEquals(0.0, gauge("dispatcher.subscription.active").value());
  }

  @Test
  void recordDurations() {
    exporter.recordDispatchDurationMs(40L);
    exporter.recordDispatchDurationMs(60L);
    exporter.recordSubscriberDurationMs(5L);

    DistributionSummary dispatch = summary("dispatcher.dispatch.duration.ms");
    assertEquals(2, dispatch.count());
    assertEquals(100.0, dispatch.totalAmount());
    assertEquals(1, summary("dispatcher.subscriber.duration.ms").count());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "orders.dispatcher");
    custom.incrementDispatched();
    custom.recordActiveSubscriptions(3);

    assertEquals(1.0, counter("orders.dispatcher.dispatch.count").count());
    assertEquals(3.0, gauge("orders.dispatcher.subscription.active").value());
    assertEquals(0.0, counter("dispatcher.dispatch.count").count());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterCalls() {
    exporter.close();

    assertNull(registry.find("dispatcher.dispatch.count").counter());
    assertNull(registry.find("dispatcher.subscription.active").gauge());
    assertNull(registry.find("dispatcher.dispatch.duration.ms").summary());
    assertDoesNotThrow(() -> exporter.incrementDispatched());
  }

  @Test
  void dispatcherReportsThroughExporter() {
    Dispatcher dispatcher = Dispatcher.builder().metrics(exporter).build();
    dispatcher.subscribe("Ping", Subscriber.named("ok", (event, args) -> 1), "test", false, 0);
    dispatcher.subscribe("Ping", Subscriber.named("bad", (event, args) -> {
      throw new IllegalStateException("boom");
    }), "test", true, 1);

    dispatcher.dispatch(dispatcher.newEvent("Ping"), "test");

    assertEquals(1.0, counter("dispatcher.dispatch.count").count());
    assertEquals(1.0, counter("dispatcher.subscriber.success").count());
    assertEquals(1.0, counter("dispatcher.subscriber.failure").count());
    assertEquals(1.0, counter("dispatcher.subscription.retired").count());
    assertEquals(1.0, gauge("dispatcher.subscription.active").value());
    assertEquals(2, summary("dispatcher.subscriber.duration.ms").count());
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "app."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }

  private DistributionSummary summary(String name) {
    DistributionSummary s = registry.find(name).summary();
    assertNotNull(s, "Summary not found: " + name);
    return s;
  }
}
