package com.openonco.discovery.pipeline.model;

public record DigestContent(String subject, String html, String text) {
}
