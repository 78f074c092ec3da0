package hle.remote.client;

/**
 * Thrown when a connection descriptor, target signature or transport security
 * setting is invalid. Always raised before any network I/O takes place.
 */
public class ConfigurationException extends RemoteClientException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
