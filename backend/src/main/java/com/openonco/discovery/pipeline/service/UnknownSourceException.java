package com.openonco.discovery.pipeline.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class UnknownSourceException extends RuntimeException {
    public UnknownSourceException(String source) {
        super("Unknown crawler source: " + source);
    }
}
