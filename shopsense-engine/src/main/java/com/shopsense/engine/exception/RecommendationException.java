package com.shopsense.engine.exception;

import org.springframework.http.HttpStatus;

public class RecommendationException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public RecommendationException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public RecommendationException(String message, HttpStatus status, String errorCode, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public static RecommendationException modelNotReady() {
        return new RecommendationException("No model generation has been published yet",
                HttpStatus.SERVICE_UNAVAILABLE, "MODEL_NOT_READY");
    }

    public static RecommendationException lookupFailed(String what, Throwable cause) {
        return new RecommendationException("Lookup failed: " + what,
                HttpStatus.SERVICE_UNAVAILABLE, "LOOKUP_FAILED", cause);
    }
}
