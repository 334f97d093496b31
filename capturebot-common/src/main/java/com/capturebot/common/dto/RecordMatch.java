package com.capturebot.common.dto;

import com.capturebot.common.entity.CapturedRecord;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One similarity-search hit. Not persisted.
 */
public record RecordMatch(
        UUID recordId,
        CapturedRecord.RecordType recordType,
        LocalDateTime createdAt,
        double similarity,
        String text) {

    public static RecordMatch of(CapturedRecord record, double similarity) {
        return new RecordMatch(record.getId(), record.getRecordType(), record.getCreatedAt(),
                similarity, record.getContent());
    }
}
