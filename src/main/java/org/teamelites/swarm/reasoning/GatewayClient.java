package org.teamelites.swarm.reasoning;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.teamelites.swarm.rpc.McpTransport;
import org.teamelites.swarm.rpc.RpcResults;
import org.teamelites.swarm.spi.CollaboratorException;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.typesafe.config.Config;

/**
 * {@link IReasoningGateway} speaking to the gateway's {@value #TOOL_NAME} MCP tool. The MCP
 * {@code initialize} handshake is sent before the first operation.
 */
public class GatewayClient implements IReasoningGateway {

    static final String TOOL_NAME = "thoughtbox_gateway";

    private final McpTransport transport;
    private final Gson gson = new Gson();

    /**
     * Options: {@code url} (MCP endpoint), {@code request-timeout} (duration).
     *
     * @param options the gateway configuration.
     */
    public GatewayClient(Config options) {
        this(new McpTransport(URI.create(options.getString("url")), TOOL_NAME,
                options.getDuration("request-timeout"), true));
    }

    public GatewayClient(URI endpoint, Duration requestTimeout) {
        this(new McpTransport(endpoint, TOOL_NAME, requestTimeout, true));
    }

    GatewayClient(McpTransport transport) {
        this.transport = transport;
    }

    @Override
    public String startNew(String title, List<String> tags) throws CollaboratorException {
        JsonObject args = new JsonObject();
        args.addProperty("title", title);
        if (tags != null) {
            args.add("tags", gson.toJsonTree(tags));
        }
        return RpcResults.requireString(transport.call("start_new", args), "sessionId", "start_new");
    }

    @Override
    public void loadContext(String sessionId) throws CollaboratorException {
        JsonObject args = new JsonObject();
        args.addProperty("sessionId", sessionId);
        transport.call("load_context", args);
    }

    @Override
    public void cipher() throws CollaboratorException {
        transport.call("cipher", new JsonObject());
    }

    @Override
    public ThoughtResult thought(ThoughtInput input) throws CollaboratorException {
        JsonObject args = new JsonObject();
        args.addProperty("thought", input.thought());
        args.addProperty("thoughtType", input.thoughtType());
        args.addProperty("branchId", input.branchId());
        args.addProperty("branchFromThought", input.branchFromThought());
        args.addProperty("agentId", input.agentId());
        stripNulls(args);

        JsonElement result = transport.call("thought", args);
        Integer number = RpcResults.optionalInt(result, "thoughtNumber");
        if (number == null) {
            throw new CollaboratorException("thought", "result has no 'thoughtNumber': " + result);
        }
        return new ThoughtResult(number,
                RpcResults.optionalString(result, "branchId"),
                RpcResults.optionalString(result, "sessionId"));
    }

    @Override
    public List<ThoughtEntry> readThoughts(String branchId, int last) throws CollaboratorException {
        JsonObject args = new JsonObject();
        args.addProperty("operation", "read");
        args.addProperty("branchId", branchId);
        args.addProperty("last", last);
        stripNulls(args);

        JsonElement result = transport.call("session", args);
        JsonArray thoughts;
        if (result.isJsonArray()) {
            thoughts = result.getAsJsonArray();
        } else if (result.isJsonObject() && result.getAsJsonObject().has("thoughts")
                && result.getAsJsonObject().get("thoughts").isJsonArray()) {
            thoughts = result.getAsJsonObject().getAsJsonArray("thoughts");
        } else {
            return List.of();
        }

        List<ThoughtEntry> entries = new ArrayList<>(thoughts.size());
        try {
            for (JsonElement thought : thoughts) {
                entries.add(gson.fromJson(thought, ThoughtEntry.class));
            }
        } catch (JsonParseException e) {
            throw new CollaboratorException("session", "unreadable thought: " + e.getMessage(), e);
        }
        return entries;
    }

    private static void stripNulls(JsonObject args) {
        List<String> nullKeys = new ArrayList<>();
        for (var entry : args.entrySet()) {
            if (entry.getValue().isJsonNull()) {
                nullKeys.add(entry.getKey());
            }
        }
        nullKeys.forEach(args::remove);
    }
}
