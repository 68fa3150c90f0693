package dispatcher.spring.boot;

import dispatcher.Namespaces;
import dispatcher.util.DefaultIdGenerator;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the dispatcher.
 *
 * @see DispatcherAutoConfiguration
 */
@ConfigurationProperties(prefix = "dispatcher")
public class DispatcherProperties {

    /**
     * First numeric id handed out for events, notifications and registries.
     */
    private long idSeed = DefaultIdGenerator.DEFAULT_SEED;

    /**
     * Namespace used by {@link EventSubscriber} beans that do not name one.
     */
    private String defaultNamespace = Namespaces.GLOBAL;

    private final Metrics metrics = new Metrics();

    public long getIdSeed() {
        return idSeed;
    }

    public void setIdSeed(long idSeed) {
        this.idSeed = idSeed;
    }

    public String getDefaultNamespace() {
        return defaultNamespace;
    }

    public void setDefaultNamespace(String defaultNamespace) {
        this.defaultNamespace = defaultNamespace;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "dispatcher";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
