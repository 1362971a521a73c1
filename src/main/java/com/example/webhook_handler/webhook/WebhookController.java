package com.example.webhook_handler.webhook;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import com.example.webhook_handler.action.ActionLaunchException;
import com.example.webhook_handler.action.ActionLauncher;
import com.example.webhook_handler.config.WebhookConfigurationException;
import com.example.webhook_handler.config.WebhookProperties;

import jakarta.servlet.http.HttpServletRequest;

@RestController
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    static final String GREETING =
            "Urm, hi?\nHow did you get here?\nThis is an api for computers 'n' stuff, not for humans :P";

    private static final String DELIVERY_HEADER = "X-GitHub-Delivery";
    private static final String EVENT_HEADER = "X-GitHub-Event";
    private static final int MAX_BUFFER_BYTES = Integer.MAX_VALUE - 8;

    private final WebhookProperties properties;
    private final SignatureHeaderExtractor signatureExtractor;
    private final WebhookSignatureVerifier signatureVerifier;
    private final ActionLauncher actionLauncher;

    public WebhookController(
            WebhookProperties properties,
            SignatureHeaderExtractor signatureExtractor,
            WebhookSignatureVerifier signatureVerifier,
            ActionLauncher actionLauncher) {
        this.properties = properties;
        this.signatureExtractor = signatureExtractor;
        this.signatureVerifier = signatureVerifier;
        this.actionLauncher = actionLauncher;
    }

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    public String listen() {
        return GREETING;
    }

    /**
     * The body is hashed exactly as it arrives on the servlet stream, whatever the content type.
     */
    @PostMapping("/")
    public ResponseEntity<String> receiveWebhook(
            @RequestHeader HttpHeaders headers,
            HttpServletRequest request) {

        String delivery = Optional.ofNullable(headers.getFirst(DELIVERY_HEADER)).orElse("-");
        String event = Optional.ofNullable(headers.getFirst(EVENT_HEADER)).orElse("-");

        // 1. 署名ヘッダー
        Optional<String> signature = signatureExtractor.extract(headers);
        if (signature.isEmpty()) {
            log.warn("Webhook rejected: missing {} header (delivery={})", SignatureHeaderExtractor.HEADER, delivery);
            return ResponseEntity.badRequest().body("missing signature");
        }

        long maxBytes = properties.maxPayloadBytes();
        long declaredLength = headers.getContentLength();
        if (declaredLength > maxBytes) {
            log.warn("Webhook rejected: Content-Length {} exceeds {} (delivery={})",
                    declaredLength, properties.getMaxPayloadSize(), delivery);
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body("payload too large");
        }

        byte[] payload;
        try {
            payload = readPayload(request, maxBytes);
        } catch (IOException e) {
            log.warn("Webhook rejected: body could not be read (delivery={})", delivery, e);
            return ResponseEntity.badRequest().body("unreadable body");
        }
        if (payload.length > maxBytes) {
            log.warn("Webhook rejected: payload exceeds {} (delivery={})", properties.getMaxPayloadSize(), delivery);
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body("payload too large");
        }

        // 2. 設定
        WebhookProperties.Resolved config;
        try {
            config = properties.resolve();
        } catch (WebhookConfigurationException e) {
            log.error("Could not handle webhook: {}", e.getMessage());
            return ResponseEntity.internalServerError().build();
        }

        // 3. 署名検証
        try {
            signatureVerifier.verify(config.getSecret(), payload, signature.get());
        } catch (SignatureVerificationException e) {
            log.warn("Webhook rejected: {} - {} (delivery={})", e.getReason(), e.getMessage(), delivery);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("unauthorized");
        }

        // 4. スクリプト実行（終了は待たない）
        try {
            actionLauncher.launch(config.getScript());
        } catch (ActionLaunchException e) {
            log.error("Could not launch {} for delivery={}", config.getScript(), delivery, e);
            return ResponseEntity.internalServerError().build();
        }

        log.info("Webhook accepted: event={} delivery={} bytes={}", event, delivery, payload.length);
        return ResponseEntity.ok().build();
    }

    /** Reads at most {@code maxBytes + 1} bytes. */
    private static byte[] readPayload(HttpServletRequest request, long maxBytes) throws IOException {
        int limit = maxBytes >= MAX_BUFFER_BYTES ? MAX_BUFFER_BYTES : (int) maxBytes + 1;
        try (InputStream in = request.getInputStream()) {
            return in.readNBytes(limit);
        }
    }
}
