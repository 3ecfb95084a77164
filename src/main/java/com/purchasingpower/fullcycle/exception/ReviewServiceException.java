package com.purchasingpower.fullcycle.exception;

public class ReviewServiceException extends PipelineException {

    public ReviewServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
