package com.trendradar.radar.isolation;

public class ConfigWriteException extends RuntimeException {
    private final String stage;

    public ConfigWriteException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
