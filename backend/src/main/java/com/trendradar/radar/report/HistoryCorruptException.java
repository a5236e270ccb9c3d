package com.trendradar.radar.report;

public class HistoryCorruptException extends RuntimeException {
    public HistoryCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
