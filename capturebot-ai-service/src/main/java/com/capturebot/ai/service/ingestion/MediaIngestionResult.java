package com.capturebot.ai.service.ingestion;

import java.util.UUID;

public record MediaIngestionResult(UUID recordId, int mediaCount) {
}
