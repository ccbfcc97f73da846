package com.modelhealth.exception;

public class MlApiUnavailableException extends ModelHealthException {
    public MlApiUnavailableException(Throwable cause) {
        super("ML_API_UNAVAILABLE", true,
              "The ML training service is currently unavailable.",
              cause);
    }
}
