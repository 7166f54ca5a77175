package org.teamelites.swarm.rpc;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.teamelites.swarm.spi.CollaboratorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * JSON-RPC 2.0 over HTTP POST for a single MCP tool.
 * <p>
 * Every operation is sent as {@code tools/call} with
 * {@code {"name": <tool>, "arguments": {"operation": ..., "args": {...}}}}. The server's
 * {@value #SESSION_HEADER} response header is captured and sent back on every later request.
 * When {@code handshake} is set, an {@code initialize} request is sent once before the first
 * tool call.
 * <p>
 * Result unwrapping: if {@code result.content[0].text} exists it is parsed as JSON, falling back
 * to the raw text as a string primitive; otherwise {@code result} itself is returned. Responses
 * framed as server-sent events are accepted; the last {@code data:} line carries the payload.
 * <p>
 * <strong>Thread Safety:</strong> calls are serialized so the session header and request ids
 * stay consistent.
 */
public class McpTransport {

    private static final Logger log = LoggerFactory.getLogger(McpTransport.class);

    public static final String SESSION_HEADER = "mcp-session-id";
    static final String PROTOCOL_VERSION = "2025-03-26";
    private static final String CLIENT_NAME = "team-elites";
    private static final String CLIENT_VERSION = "1.0.0";

    private final URI endpoint;
    private final String toolName;
    private final Duration requestTimeout;
    private final boolean handshake;
    private final HttpClient httpClient;

    private String sessionId;
    private long requestId;
    private boolean initialized;

    /**
     * @param endpoint       MCP endpoint, e.g. {@code http://localhost:1731/mcp}.
     * @param toolName       tool addressed by every call, e.g. {@code thoughtbox_hub}.
     * @param requestTimeout per-request timeout.
     * @param handshake      whether to send {@code initialize} before the first call.
     */
    public McpTransport(URI endpoint, String toolName, Duration requestTimeout, boolean handshake) {
        this(endpoint, toolName, requestTimeout, handshake,
                HttpClient.newBuilder().connectTimeout(requestTimeout).build());
    }

    McpTransport(URI endpoint, String toolName, Duration requestTimeout, boolean handshake, HttpClient httpClient) {
        this.endpoint = endpoint;
        this.toolName = toolName;
        this.requestTimeout = requestTimeout;
        this.handshake = handshake;
        this.httpClient = httpClient;
    }

    /**
     * Invokes one tool operation.
     *
     * @param operation operation name, e.g. {@code create_problem}.
     * @param args      operation arguments; null members are omitted.
     * @return the unwrapped result, never null ({@link JsonNull} when the server sent none).
     * @throws CollaboratorException on transport failure, non-2xx status, unparsable body or a
     *                               JSON-RPC error.
     */
    public synchronized JsonElement call(String operation, JsonObject args) throws CollaboratorException {
        if (handshake && !initialized) {
            initialize(operation);
        }

        JsonObject arguments = new JsonObject();
        arguments.addProperty("operation", operation);
        arguments.add("args", args == null ? new JsonObject() : args);

        JsonObject params = new JsonObject();
        params.addProperty("name", toolName);
        params.add("arguments", arguments);

        JsonObject response = post(operation, envelope("tools/call", params));
        if (response.has("error") && !response.get("error").isJsonNull()) {
            throw new CollaboratorException(operation, "RPC error: " + response.get("error"));
        }
        return unwrap(response.get("result"));
    }

    private void initialize(String operation) throws CollaboratorException {
        JsonObject clientInfo = new JsonObject();
        clientInfo.addProperty("name", CLIENT_NAME);
        clientInfo.addProperty("version", CLIENT_VERSION);

        JsonObject params = new JsonObject();
        params.addProperty("protocolVersion", PROTOCOL_VERSION);
        params.add("capabilities", new JsonObject());
        params.add("clientInfo", clientInfo);

        JsonObject response = post(operation, envelope("initialize", params));
        if (response.has("error") && !response.get("error").isJsonNull()) {
            throw new CollaboratorException("initialize", "RPC error: " + response.get("error"));
        }
        initialized = true;
        log.debug("MCP session initialized at {} (session {})", endpoint, sessionId);
    }

    private JsonObject envelope(String method, JsonObject params) {
        JsonObject body = new JsonObject();
        body.addProperty("jsonrpc", "2.0");
        body.addProperty("method", method);
        body.add("params", params);
        body.addProperty("id", ++requestId);
        return body;
    }

    private JsonObject post(String operation, JsonObject body) throws CollaboratorException {
        HttpRequest.Builder request = HttpRequest.newBuilder(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json, text/event-stream")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8));
        if (sessionId != null) {
            request.header(SESSION_HEADER, sessionId);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CollaboratorException(operation, "request to " + endpoint + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException(operation, "interrupted", e);
        }

        response.headers().firstValue(SESSION_HEADER).ifPresent(id -> sessionId = id);

        if (response.statusCode() / 100 != 2) {
            throw new CollaboratorException(operation, "HTTP " + response.statusCode() + " from " + endpoint);
        }

        try {
            JsonElement parsed = JsonParser.parseString(stripEventStream(response.body()));
            if (!parsed.isJsonObject()) {
                throw new CollaboratorException(operation, "response is not a JSON-RPC object");
            }
            return parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new CollaboratorException(operation, "unparsable response: " + e.getMessage(), e);
        }
    }

    static String stripEventStream(String body) {
        String trimmed = body.strip();
        if (!trimmed.startsWith("event:") && !trimmed.startsWith("data:")) {
            return trimmed;
        }
        String payload = "";
        for (String line : trimmed.split("\\R")) {
            if (line.startsWith("data:")) {
                payload = line.substring("data:".length()).strip();
            }
        }
        return payload;
    }

    static JsonElement unwrap(JsonElement result) {
        if (result == null || result.isJsonNull()) {
            return JsonNull.INSTANCE;
        }
        if (result.isJsonObject()) {
            JsonElement content = result.getAsJsonObject().get("content");
            if (content != null && content.isJsonArray()) {
                JsonArray items = content.getAsJsonArray();
                if (!items.isEmpty() && items.get(0).isJsonObject()) {
                    JsonElement text = items.get(0).getAsJsonObject().get("text");
                    if (text != null && text.isJsonPrimitive() && !text.getAsString().isEmpty()) {
                        return parseTextContent(text.getAsString());
                    }
                }
            }
        }
        return result;
    }

    private static JsonElement parseTextContent(String text) {
        try {
            return JsonParser.parseString(text);
        } catch (JsonParseException e) {
            return new JsonPrimitive(text);
        }
    }

    /**
     * @return the session id captured from the server, or null before the first response carrying one.
     */
    public synchronized String getSessionId() {
        return sessionId;
    }

    public URI getEndpoint() {
        return endpoint;
    }
}
