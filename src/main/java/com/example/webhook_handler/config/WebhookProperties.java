package com.example.webhook_handler.config;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.ToString;

/**
 * Webhook 設定。
 * 環境変数 WEBHOOK_SECRET / WEBHOOK_SCRIPT は relaxed binding で
 * webhook.secret / webhook.script に入る。
 */
@Data
@ConfigurationProperties(prefix = "webhook")
public class WebhookProperties {

    private static final Logger log = LoggerFactory.getLogger(WebhookProperties.class);

    /** Shared secret the sender signs payloads with. Never logged. */
    @ToString.Exclude
    private String secret;

    /** Script launched after a verified delivery. */
    private String script;

    /** Program the script is handed to; blank runs the script directly. */
    private String interpreter = "bash";

    private DataSize maxPayloadSize = DataSize.ofKilobytes(32);

    @PostConstruct
    public void init() {
        if (!isSecretConfigured()) {
            log.warn("webhook.secret (WEBHOOK_SECRET) is not set; every delivery will be answered with 500");
        }
        if (!isScriptConfigured()) {
            log.warn("webhook.script (WEBHOOK_SCRIPT) is not set; every delivery will be answered with 500");
        }
    }

    public boolean isSecretConfigured() {
        return secret != null && !secret.isEmpty();
    }

    public boolean isScriptConfigured() {
        return script != null && !script.isBlank();
    }

    /**
     * Resolve the values a delivery needs.
     *
     * @throws WebhookConfigurationException if the secret or the script path is missing
     */
    public Resolved resolve() {
        if (!isScriptConfigured()) {
            throw new WebhookConfigurationException("webhook.script");
        }
        if (!isSecretConfigured()) {
            throw new WebhookConfigurationException("webhook.secret");
        }
        return new Resolved(secret.getBytes(StandardCharsets.UTF_8), Path.of(script.trim()));
    }

    public long maxPayloadBytes() {
        return maxPayloadSize == null ? Long.MAX_VALUE : maxPayloadSize.toBytes();
    }

    public static final class Resolved {
        private final byte[] secret;
        private final Path script;

        Resolved(byte[] secret, Path script) {
            this.secret = secret;
            this.script = script;
        }

        public byte[] getSecret() {
            return secret.clone();
        }

        public Path getScript() {
            return script;
        }

        @Override
        public String toString() {
            return "Resolved(script=" + script + ")";
        }
    }
}
