package com.openonco.discovery.pipeline.model;

import java.util.Locale;

public enum PipelineStage {
    CRAWL,
    TRIAGE,
    DIGEST,
    EXPORT;

    public String flag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PipelineStage fromFlag(String flag) {
        for (PipelineStage stage : values()) {
            if (stage.flag().equals(flag)) {
                return stage;
            }
        }
        return null;
    }
}
