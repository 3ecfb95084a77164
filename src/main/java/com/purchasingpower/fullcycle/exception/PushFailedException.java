package com.purchasingpower.fullcycle.exception;

public class PushFailedException extends VersionControlException {

    public PushFailedException(String message) {
        super(message);
    }

    public PushFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
