package com.capturebot.common.exception;

/** Media could not be downloaded from the messaging provider. */
public class FetchException extends RuntimeException {

    private final String url;

    public FetchException(String url, String message) {
        super(message);
        this.url = url;
    }

    public FetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
