package com.trendradar.radar.fetch;

public class FetchException extends RuntimeException {
    private final String platformId;

    public FetchException(String platformId, String message) {
        super(message);
        this.platformId = platformId;
    }

    public FetchException(String platformId, String message, Throwable cause) {
        super(message, cause);
        this.platformId = platformId;
    }

    public String getPlatformId() {
        return platformId;
    }
}
