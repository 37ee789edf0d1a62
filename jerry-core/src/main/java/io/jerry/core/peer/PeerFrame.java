package io.jerry.core.peer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PeerFrame(
    String type,
    @JsonProperty("correlation_id") String correlationId,
    @JsonProperty("agent_id") String agentId,
    String target,
    String tool,
    Map<String, Object> payload,
    String text,
    String error,
    List<Map<String, Object>> tools
) {
    public static final String HELLO = "hello";
    public static final String WELCOME = "welcome";
    public static final String CALL = "call";
    public static final String RESULT = "result";
    public static final String ERROR = "error";
    public static final String REQUEST = "request";
    public static final String RESPONSE = "response";
    public static final String PING = "ping";
    public static final String PONG = "pong";
    public static final String UNAUTHORIZED = "unauthorized";

    public static PeerFrame hello(String agentId, List<Map<String, Object>> tools) {
        return new PeerFrame(HELLO, null, agentId, null, null, null, null, null, tools);
    }

    public static PeerFrame call(String correlationId, String target, String tool, Map<String, Object> payload) {
        return new PeerFrame(CALL, correlationId, null, target, tool, payload, null, null, null);
    }

    public static PeerFrame response(String correlationId, String text) {
        return new PeerFrame(RESPONSE, correlationId, null, null, null, null, text, null, null);
    }

    public static PeerFrame pong() {
        return new PeerFrame(PONG, null, null, null, null, null, null, null, null);
    }
}
