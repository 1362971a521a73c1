package com.example.webhook_handler.webhook;

import java.util.Optional;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Pulls the claimed signature out of the request headers.
 */
@Component
public class SignatureHeaderExtractor {

    public static final String HEADER = "X-Hub-Signature-256";

    /**
     * @return the header value, or empty if the header is absent
     */
    public Optional<String> extract(HttpHeaders headers) {
        if (headers == null) {
            return Optional.empty();
        }
        // HttpHeaders lookups are case-insensitive
        return Optional.ofNullable(headers.getFirst(HEADER));
    }
}
