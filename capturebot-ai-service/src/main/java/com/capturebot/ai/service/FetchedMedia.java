package com.capturebot.ai.service;

/**
 * Bytes of one inbound media file plus what we know about it.
 */
public record FetchedMedia(byte[] content, String contentType, String fileName) {
}
