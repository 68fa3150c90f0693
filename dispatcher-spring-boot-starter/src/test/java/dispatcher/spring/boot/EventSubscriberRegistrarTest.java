package dispatcher.spring.boot;

import dispatcher.Dispatcher;
import dispatcher.Event;
import dispatcher.Namespaces;
import dispatcher.Notification;
import dispatcher.Subscriber;
import dispatcher.registry.Subscription;

import org.junit.jupiter.api.Test;
import org.springframework.aop.framework.ProxyFactory;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventSubscriberRegistrarTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner();

  @Test
  void registersWithDefaults() {
    runner.withUserConfiguration(DefaultsConfig.class).run(ctx -> {
      Dispatcher dispatcher = ctx.getBean(Dispatcher.class);
      List<Subscription> subscriptions = dispatcher.subscribersFor(Namespaces.GLOBAL);

      assertEquals(1, subscriptions.size());
      Subscription subscription = subscriptions.get(0);
      assertTrue(subscription.persistent());
      assertEquals(0, subscription.priority());
      assertSame(ctx.getBean(DefaultsSubscriber.class), subscription.subscriber());
    });
  }

  @Test
  void appliesAnnotationAttributes() {
    runner.withUserConfiguration(AttributesConfig.class).run(ctx -> {
      Dispatcher dispatcher = ctx.getBean(Dispatcher.class);
      Subscription subscription = dispatcher.subscribersFor("billing").get(0);

      assertFalse(subscription.persistent());
      assertEquals(3, subscription.priority());
      assertEquals("invoice", subscription.subscriber().name());

      Notification notification = dispatcher.dispatch(dispatcher.newEvent("OrderPlaced"), "billing");
      assertEquals("invoiced", notification.get("invoice"));
    });
  }

  @Test
  void usesConfiguredDefaultNamespace() {
    runner.withUserConfiguration(DefaultNamespaceConfig.class).run(ctx -> {
      Dispatcher dispatcher = ctx.getBean(Dispatcher.class);

      assertEquals(1, dispatcher.subscribersFor("local").size());
      assertTrue(dispatcher.subscribersFor(Namespaces.GLOBAL).isEmpty());
    });
  }

  @Test
  void proxiedBeanIsNamedAfterTargetClass() {
    runner.withUserConfiguration(ProxiedConfig.class).run(ctx -> {
      Dispatcher dispatcher = ctx.getBean(Dispatcher.class);
      List<Subscription> subscriptions = dispatcher.subscribersFor(Namespaces.GLOBAL);

      assertEquals(1, subscriptions.size());
      assertTrue(AopUtils.isCglibProxy(ctx.getBean(PlainSubscriber.class)));
      assertEquals("PlainSubscriber", subscriptions.get(0).subscriber().name());

      Notification notification = dispatcher.dispatch(dispatcher.newEvent("Plain"), Namespaces.GLOBAL);
      assertEquals(List.of("PlainSubscriber"), notification.functionNames());
      assertEquals("plain", notification.get("PlainSubscriber"));
    });
  }

  @Test
  void failsWhenBeanDoesNotImplementSubscriber() {
    runner.withUserConfiguration(NotASubscriberConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsWhenEventIsBlank() {
    runner.withUserConfiguration(BlankEventConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  // ── Test support ─────────────────────────────────────────────

  @EventSubscriber(event = "UserCreated")
  static class DefaultsSubscriber implements Subscriber {
    @Override
    public Object onEvent(Event event, Object... args) {
      return null;
    }
  }

  @EventSubscriber(event = "OrderPlaced", namespace = "billing", persistent = false, priority = 3, name = "invoice")
  static class InvoiceSubscriber implements Subscriber {
    @Override
    public Object onEvent(Event event, Object... args) {
      return "invoiced";
    }
  }

  @EventSubscriber(event = "Plain")
  static class PlainSubscriber implements Subscriber {
    @Override
    public Object onEvent(Event event, Object... args) {
      return "plain";
    }
  }

  @EventSubscriber(event = "SomeEvent")
  static class NotASubscriberBean {
    // Does NOT implement Subscriber
  }

  @EventSubscriber(event = "")
  static class BlankEventSubscriber implements Subscriber {
    @Override
    public Object onEvent(Event event, Object... args) {
      return null;
    }
  }

  @Configuration
  static class BaseConfig {
    @Bean
    Dispatcher dispatcher() {
      return Dispatcher.create();
    }

    @Bean
    EventSubscriberRegistrar registrar(ListableBeanFactory bf, Dispatcher dispatcher) {
      return new EventSubscriberRegistrar(bf, dispatcher, defaultNamespace());
    }

    String defaultNamespace() {
      return Namespaces.GLOBAL;
    }
  }

  @Configuration
  static class DefaultsConfig extends BaseConfig {
    @Bean
    DefaultsSubscriber defaultsSubscriber() {
      return new DefaultsSubscriber();
    }
  }

  @Configuration
  static class AttributesConfig extends BaseConfig {
    @Bean
    InvoiceSubscriber invoiceSubscriber() {
      return new InvoiceSubscriber();
    }
  }

  @Configuration
  static class DefaultNamespaceConfig extends BaseConfig {
    @Bean
    DefaultsSubscriber defaultsSubscriber() {
      return new DefaultsSubscriber();
    }

    @Override
    String defaultNamespace() {
      return Namespaces.LOCAL;
    }
  }

  @Configuration
  static class ProxiedConfig extends BaseConfig {
    @Bean
    PlainSubscriber plainSubscriber() {
      ProxyFactory factory = new ProxyFactory(new PlainSubscriber());
      factory.setProxyTargetClass(true);
      return (PlainSubscriber) factory.getProxy();
    }
  }

  @Configuration
  static class NotASubscriberConfig extends BaseConfig {
    @Bean
    NotASubscriberBean notASubscriberBean() {
      return new NotASubscriberBean();
    }
  }

  @Configuration
  static class BlankEventConfig extends BaseConfig {
    @Bean
    BlankEventSubscriber blankEventSubscriber() {
      return new BlankEventSubscriber();
    }
  }
}
