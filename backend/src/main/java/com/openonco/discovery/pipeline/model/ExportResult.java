package com.openonco.discovery.pipeline.model;

import java.nio.file.Path;

public record ExportResult(Path path, int discoveries) {
}
