package com.modelhealth.exception;

public class MlApiException extends ModelHealthException {
    public MlApiException(String message) {
        super("ML_API_ERROR", false, message, null);
    }
}
