package com.capturebot.ai.service;

import java.util.Map;
import java.util.UUID;

/**
 * What one {@code process(jobId)} call did.
 *
 * @param replyDelivered false when the job completed but its reply could not be
 *                       sent or logged; the job stays COMPLETED either way
 */
public record JobOutcome(UUID jobId, boolean success, Map<String, Object> result, Exception error,
        boolean replyDelivered) {

    public static JobOutcome completed(UUID jobId, Map<String, Object> result, boolean replyDelivered) {
        return new JobOutcome(jobId, true, result, null, replyDelivered);
    }

    public static JobOutcome failed(UUID jobId, Exception error) {
        return new JobOutcome(jobId, false, null, error, false);
    }
}
