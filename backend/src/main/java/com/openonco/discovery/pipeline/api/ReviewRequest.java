package com.openonco.discovery.pipeline.api;

public record ReviewRequest(String notes) {
}
