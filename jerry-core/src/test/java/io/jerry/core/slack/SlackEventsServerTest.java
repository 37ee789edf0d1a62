package io.jerry.core.slack;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jerry.core.agent.InboundEvent;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SlackEventsServerTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final SlackSignatureVerifier verifier = new SlackSignatureVerifier("test-secret", Clock.systemUTC());
    private final List<InboundEvent> submitted = new CopyOnWriteArrayList<>();
    private final HttpClient http = HttpClient.newHttpClient();
    private SlackEventsServer server;

    @BeforeEach
    void setUp() {
        SlackMessageRouter router = new SlackMessageRouter(
            new EventDeduplicator(),
            (event, sink) -> submitted.add(event),
            (event, reply) -> { }
        );
        server = new SlackEventsServer("127.0.0.1", 0, verifier, router);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void shouldAnswerUrlVerificationChallenge() throws Exception {
        HttpResponse<String> response = post("{\"type\":\"url_verification\",\"challenge\":\"abc123\"}", true);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(JSON.readTree(response.body()).path("challenge").asText()).isEqualTo("abc123");
    }

    @Test
    void shouldAcknowledgeAndRouteSignedEvent() throws Exception {
        HttpResponse<String> response = post("""
            {"type":"event_callback","event_id":"Ev1",
             "event":{"type":"app_mention","channel":"C1","user":"U1","text":"<@U0BOT> hi","ts":"1.1"}}""", true);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(JSON.readTree(response.body()).path("ok").asBoolean()).isTrue();
        assertThat(submitted).singleElement().satisfies(event -> assertThat(event.text()).isEqualTo("hi"));
    }

    @Test
    void shouldRejectUnsignedRequest() throws Exception {
        HttpResponse<String> response = post("{\"type\":\"url_verification\",\"challenge\":\"abc123\"}", false);

        assertThat(response.statusCode()).isEqualTo(401);
        assertThat(response.body()).contains("invalid_signature");
    }

    @Test
    void shouldRejectMalformedJson() throws Exception {
        HttpResponse<String> response = post("{not json", true);

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(response.body()).contains("invalid_json");
    }

    @Test
    void shouldServeHealthAndRejectWrongMethods() throws Exception {
        HttpResponse<String> health = http.send(
            HttpRequest.newBuilder(uri("/healthz")).GET().build(), HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> getEvents = http.send(
            HttpRequest.newBuilder(uri(SlackEventsServer.EVENTS_PATH)).GET().build(), HttpResponse.BodyHandlers.ofString());

        assertThat(health.statusCode()).isEqualTo(200);
        assertThat(health.body()).contains("healthy");
        assertThat(getEvents.statusCode()).isEqualTo(405);
    }

    private HttpResponse<String> post(String body, boolean signed) throws Exception {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        HttpRequest.Builder request = HttpRequest.newBuilder(uri(SlackEventsServer.EVENTS_PATH))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofByteArray(bytes));
        if (signed) {
            String timestamp = String.valueOf(Clock.systemUTC().instant().getEpochSecond());
            request.header(SlackEventsServer.TIMESTAMP_HEADER, timestamp)
                .header(SlackEventsServer.SIGNATURE_HEADER, verifier.sign(timestamp, bytes));
        }
        return http.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.port() + path);
    }
}
