package com.trendradar.radar.isolation;

public class IsolatedExecutionException extends RuntimeException {
    public IsolatedExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
