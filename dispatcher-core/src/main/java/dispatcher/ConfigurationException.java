package dispatcher;

/**
 * Thrown by a builder when a required attribute was not set before {@code build()}.
 */
public final class ConfigurationException extends DispatcherException {

    public ConfigurationException(String message) {
        super(message);
    }
}
