package com.openonco.discovery.pipeline.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class DiscoveryNotFoundException extends RuntimeException {
    public DiscoveryNotFoundException(String id) {
        super("Discovery not found: " + id);
    }
}
