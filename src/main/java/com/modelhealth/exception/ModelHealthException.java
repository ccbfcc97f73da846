package com.modelhealth.exception;

import lombok.Getter;

@Getter
public abstract class ModelHealthException extends RuntimeException {

    private final String errorCode;
    private final boolean retryable;

    protected ModelHealthException(String errorCode, boolean retryable, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
}
