package org.cardiocore.exceptions;

/**
 * Fatal start-up error: unreadable settings, out-of-range values or malformed
 * static rule tables. Unchecked because nothing downstream can recover from it.
 */
public class ConfigurationException extends RuntimeException {

    private final String settingKey;

    public ConfigurationException(String message) {
        super(message);
        this.settingKey = null;
    }

    public ConfigurationException(String settingKey, String message) {
        super(message);
        this.settingKey = settingKey;
    }

    public ConfigurationException(String settingKey, String message, Throwable cause) {
        super(message, cause);
        this.settingKey = settingKey;
    }

    public String getSettingKey() {
        return settingKey;
    }

    @Override
    public String toString() {
        if (settingKey == null) {
            return "ConfigurationException: " + getMessage();
        }
        return "ConfigurationException [" + settingKey + "]: " + getMessage();
    }
}
