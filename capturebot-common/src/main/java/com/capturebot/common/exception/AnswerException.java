package com.capturebot.common.exception;

/** The retrieval agent could not produce an answer (completion or retrieval failure). */
public class AnswerException extends RuntimeException {

    public AnswerException(String message) {
        super(message);
    }

    public AnswerException(String message, Throwable cause) {
        super(message, cause);
    }
}
