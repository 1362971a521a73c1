package com.example.webhook_handler.action;

public class ActionLaunchException extends RuntimeException {

    public ActionLaunchException(String message) {
        super(message);
    }

    public ActionLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
