/**
 * Spring Boot auto-configuration for the dispatcher.
 *
 * <p>Add the starter to the classpath to get a {@link dispatcher.Dispatcher} bean configured
 * from {@code dispatcher.*} properties, Micrometer metrics when a {@code MeterRegistry} is
 * present, and automatic subscription of {@link dispatcher.spring.boot.EventSubscriber} beans.
 *
 * @see dispatcher.spring.boot.DispatcherAutoConfiguration
 * @see dispatcher.spring.boot.DispatcherProperties
 */
package dispatcher.spring.boot;
