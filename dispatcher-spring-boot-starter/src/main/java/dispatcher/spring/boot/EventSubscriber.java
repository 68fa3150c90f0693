package dispatcher.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a dispatcher subscriber.
 *
 * <p>The annotated bean must implement {@link dispatcher.Subscriber}. It is subscribed
 * to the {@link dispatcher.Dispatcher} bean once all singletons are created.
 *
 * <pre>{@code
 * @Component
 * @EventSubscriber(event = "OrderPlaced", namespace = "billing", persistent = true)
 * public class InvoiceSubscriber implements Subscriber {
 *   public Object onEvent(Event event, Object... args) { ... }
 * }
 * }</pre>
 *
 * @see dispatcher.Subscriber
 * @see EventSubscriberRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EventSubscriber {

    /**
     * Event name to subscribe to. Required.
     */
    String event();

    /**
     * Namespace. Defaults to {@code dispatcher.default-namespace}.
     */
    String namespace() default "";

    /**
     * Whether the subscription survives its first invocation. Defaults to true, since a
     * bean is normally meant to receive every event.
     */
    boolean persistent() default true;

    /**
     * Invocation order key, lower runs first.
     */
    int priority() default 0;

    /**
     * Notification content key. Defaults to {@link dispatcher.Subscriber#name()}.
     */
    String name() default "";
}
