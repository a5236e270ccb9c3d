package com.trendradar.radar.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class RunValidationException extends RuntimeException {
    public RunValidationException(String message) {
        super(message);
    }
}
