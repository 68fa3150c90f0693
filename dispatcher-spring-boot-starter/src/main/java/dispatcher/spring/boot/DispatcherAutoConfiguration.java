package dispatcher.spring.boot;

import dispatcher.DispatchInterceptor;
import dispatcher.Dispatcher;
import dispatcher.spi.IdGenerator;
import dispatcher.spi.MetricsExporter;
import dispatcher.util.DefaultIdGenerator;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Auto-configuration for the dispatcher.
 *
 * <p>Creates a {@link Dispatcher} wired with any {@link MetricsExporter},
 * {@link DispatchInterceptor} and {@link Clock} beans in the context, and subscribes
 * every {@link EventSubscriber} bean to it.
 *
 * @see DispatcherProperties
 * @see DispatcherMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Dispatcher.class)
@EnableConfigurationProperties(DispatcherProperties.class)
public class DispatcherAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(IdGenerator.class)
  public DefaultIdGenerator dispatcherIdGenerator(DispatcherProperties props) {
    return new DefaultIdGenerator(props.getIdSeed());
  }

  @Bean(destroyMethod = "unsubscribeAll")
  @ConditionalOnMissingBean
  public Dispatcher dispatcher(IdGenerator idGenerator,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<DispatchInterceptor> interceptorProvider,
      ObjectProvider<Clock> clockProvider) {
    Dispatcher.Builder builder = Dispatcher.builder().idGenerator(idGenerator);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    Clock clock = clockProvider.getIfAvailable();
    if (clock != null) {
      builder.clock(clock);
    }
    interceptorProvider.orderedStream().forEach(builder::interceptor);
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventSubscriberRegistrar eventSubscriberRegistrar(ListableBeanFactory beanFactory,
      Dispatcher dispatcher, DispatcherProperties props) {
    return new EventSubscriberRegistrar(beanFactory, dispatcher, props.getDefaultNamespace());
  }
}
