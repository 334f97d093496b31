package com.capturebot.ai.service.ingestion;

import java.util.UUID;

public record NoteIngestionResult(UUID recordId) {
}
