package com.example.webhook_handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.server.LocalServerPort;

import com.example.webhook_handler.action.ActionLauncher;
import com.example.webhook_handler.webhook.WebhookSignatures;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT, properties = {
        "webhook.secret=VerySecure",
        "webhook.script=/webhook/script/script.sh"
})
class WebhookHandlerApplicationTest {

    private static final String TEST_BODY = "\"{\\\"test\\\": 1}\"";
    private static final String TEST_SIGNATURE =
            "sha256=f5cf34a2c036452fd80ced7508e5c231b1afa5c05713eaf87610499ee23f471a";

    @LocalServerPort
    private int port;

    @MockBean
    private ActionLauncher actionLauncher;

    private HttpClient client;
    private String baseUrl;

    @BeforeEach
    void setup() {
        client = HttpClient.newHttpClient();
        baseUrl = "http://localhost:" + port;
    }

    @Test
    void signedDelivery_passesFilterChainAndLaunchesScriptOnce() throws Exception {
        HttpResponse<String> res = client.send(webhook(TEST_SIGNATURE), HttpResponse.BodyHandlers.ofString());

        assertThat(res.statusCode()).isEqualTo(200);
        verify(actionLauncher, times(1)).launch(Path.of("/webhook/script/script.sh"));
    }

    @Test
    void wronglySignedDelivery_isUnauthorized() throws Exception {
        HttpResponse<String> res = client.send(webhook("sha256=0123acd"), HttpResponse.BodyHandlers.ofString());

        assertThat(res.statusCode()).isEqualTo(401);
        verify(actionLauncher, never()).launch(any());
    }

    @Test
    void formEncodedDelivery_isVerifiedOverRawBody() throws Exception {
        String body = "payload=%7b%22zen%22%3a%22Keep+it+simple%2A%22%7d";
        HttpRequest req = HttpRequest.newBuilder(URI.create(baseUrl + "/"))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("X-Hub-Signature-256", WebhookSignatures.sign("VerySecure", body))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> res = client.send(req, HttpResponse.BodyHandlers.ofString());

        assertThat(res.statusCode()).isEqualTo(200);
        verify(actionLauncher, times(1)).launch(Path.of("/webhook/script/script.sh"));
    }

    @Test
    void binaryDelivery_isVerifiedOverRawBody() throws Exception {
        byte[] body = {0x00, (byte) 0xff, 0x0d, 0x0a, (byte) 0x80, 0x26, 0x3d};
        HttpRequest req = HttpRequest.newBuilder(URI.create(baseUrl + "/"))
                .header("Content-Type", "application/octet-stream")
                .header("X-Hub-Signature-256", WebhookSignatures.sign("VerySecure", body))
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();

        HttpResponse<String> res = client.send(req, HttpResponse.BodyHandlers.ofString());

        assertThat(res.statusCode()).isEqualTo(200);
        verify(actionLauncher, times(1)).launch(Path.of("/webhook/script/script.sh"));
    }

    @Test
    void oversizedDelivery_isRejectedWith413() throws Exception {
        byte[] body = new byte[64 * 1024];
        Arrays.fill(body, (byte) 'a');
        HttpRequest req = HttpRequest.newBuilder(URI.create(baseUrl + "/"))
                .header("Content-Type", "application/json")
                .header("X-Hub-Signature-256", WebhookSignatures.sign("VerySecure", body))
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();

        HttpResponse<String> res = client.send(req, HttpResponse.BodyHandlers.ofString());

        assertThat(res.statusCode()).isEqualTo(413);
        verify(actionLauncher, never()).launch(any());
    }

    @Test
    void unsignedDelivery_isBadRequest() throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create(baseUrl + "/"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(TEST_BODY))
                .build();

        HttpResponse<String> res = client.send(req, HttpResponse.BodyHandlers.ofString());

        assertThat(res.statusCode()).isEqualTo(400);
    }

    @Test
    void rootAndHealth_arePublic() throws Exception {
        HttpResponse<String> root = client.send(
                HttpRequest.newBuilder(URI.create(baseUrl + "/")).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        assertThat(root.statusCode()).isEqualTo(200);
        assertThat(root.body()).contains("not for humans");

        HttpResponse<String> health = client.send(
                HttpRequest.newBuilder(URI.create(baseUrl + "/health")).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        assertThat(health.statusCode()).isEqualTo(200);
        assertThat(health.body()).contains("\"status\":\"UP\"").doesNotContain("VerySecure");
    }

    @Test
    void unknownPaths_areDenied() throws Exception {
        HttpResponse<String> res = client.send(
                HttpRequest.newBuilder(URI.create(baseUrl + "/admin")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(res.statusCode()).isEqualTo(403);
    }

    private HttpRequest webhook(String signature) {
        return HttpRequest.newBuilder(URI.create(baseUrl + "/"))
                .header("Content-Type", "application/json")
                .header("X-GitHub-Event", "push")
                .header("X-Hub-Signature-256", signature)
                .POST(HttpRequest.BodyPublishers.ofString(TEST_BODY))
                .build();
    }
}
