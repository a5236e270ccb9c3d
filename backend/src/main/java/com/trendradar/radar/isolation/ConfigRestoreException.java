package com.trendradar.radar.isolation;

/**
 * The backup could not be written back; the shared configuration still holds a task override.
 */
public class ConfigRestoreException extends RuntimeException {
    public ConfigRestoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
