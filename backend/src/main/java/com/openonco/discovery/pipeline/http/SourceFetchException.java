package com.openonco.discovery.pipeline.http;

/**
 * One upstream request failed or returned a payload that could not be read.
 */
public class SourceFetchException extends RuntimeException {
    private final String reasonCode;
    private final String url;

    public SourceFetchException(String reasonCode, String url, String message) {
        super(message);
        this.reasonCode = reasonCode;
        this.url = url;
    }

    public SourceFetchException(String reasonCode, String url, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
        this.url = url;
    }

    public String getReasonCode() {
        return reasonCode;
    }

    public String getUrl() {
        return url;
    }
}
