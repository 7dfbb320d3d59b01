package com.openonco.discovery.pipeline.model;

public record DigestResult(boolean success, String messageId, int pendingCount, String error) {
    public static DigestResult sent(String messageId, int pendingCount) {
        return new DigestResult(true, messageId, pendingCount, null);
    }

    public static DigestResult skipped(int pendingCount, String reason) {
        return new DigestResult(true, null, pendingCount, reason);
    }

    public static DigestResult failed(int pendingCount, String error) {
        return new DigestResult(false, null, pendingCount, error);
    }
}
