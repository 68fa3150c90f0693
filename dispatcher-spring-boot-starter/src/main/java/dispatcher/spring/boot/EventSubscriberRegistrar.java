package dispatcher.spring.boot;

import dispatcher.Dispatcher;
import dispatcher.Subscriber;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Scans for beans annotated with {@link EventSubscriber} and subscribes them to the
 * {@link Dispatcher}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see EventSubscriber
 */
public class EventSubscriberRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(EventSubscriberRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final Dispatcher dispatcher;
    private final String defaultNamespace;

    public EventSubscriberRegistrar(ListableBeanFactory beanFactory, Dispatcher dispatcher, String defaultNamespace) {
        this.beanFactory = beanFactory;
        this.dispatcher = dispatcher;
        this.defaultNamespace = defaultNamespace;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(EventSubscriber.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof Subscriber subscriber)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @EventSubscriber must implement Subscriber, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // Proxies may hide the annotation on the target class
            Class<?> targetClass = AopUtils.getTargetClass(bean);
            EventSubscriber annotation = AnnotationUtils.findAnnotation(targetClass, EventSubscriber.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @EventSubscriber annotation on " + targetClass.getName());
            }
            if (annotation.event().isEmpty()) {
                throw new BeanCreationException(beanName, "@EventSubscriber must specify an event");
            }

            String namespace = annotation.namespace().isEmpty() ? defaultNamespace : annotation.namespace();
            Subscriber registered = annotation.name().isEmpty()
                    ? nameAfterTarget(subscriber, bean.getClass(), targetClass)
                    : Subscriber.named(annotation.name(), subscriber);

            String functionId = dispatcher.subscribe(annotation.event(), registered, namespace,
                    annotation.persistent(), annotation.priority());
            logger.fine(() -> "Subscribed bean " + beanName + " to " + annotation.event()
                    + " (namespace=" + namespace + ", functionId=" + functionId + ")");
        }
    }

    // A proxy class must not leak into content keys through the default Subscriber#name().
    private static Subscriber nameAfterTarget(Subscriber subscriber, Class<?> beanClass, Class<?> targetClass) {
        if (targetClass != beanClass && subscriber.name().equals(beanClass.getSimpleName())) {
            return Subscriber.named(targetClass.getSimpleName(), subscriber);
        }
        return subscriber;
    }
}
