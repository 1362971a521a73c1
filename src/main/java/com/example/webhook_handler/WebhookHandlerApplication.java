package com.example.webhook_handler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class WebhookHandlerApplication {
    public static void main(String[] args) {
        SpringApplication.run(WebhookHandlerApplication.class, args);
    }
}
