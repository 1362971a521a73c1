package com.example.webhook_handler.config;

public class WebhookConfigurationException extends RuntimeException {
    private final String property;

    public WebhookConfigurationException(String property) {
        super("required property is not configured: " + property);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
