package in.ashwanthkumar.akbot.config;

import in.ashwanthkumar.akbot.TradingException;

/**
 * Invalid or unreadable configuration. Raised before any instance starts.
 */
public class ConfigurationException extends TradingException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
