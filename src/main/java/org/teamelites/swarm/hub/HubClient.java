package org.teamelites.swarm.hub;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.teamelites.swarm.api.ReviewVerdict;
import org.teamelites.swarm.rpc.McpTransport;
import org.teamelites.swarm.rpc.RpcResults;
import org.teamelites.swarm.spi.CollaboratorException;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.typesafe.config.Config;

/**
 * {@link IHubClient} speaking to the hub's {@value #TOOL_NAME} MCP tool.
 */
public class HubClient implements IHubClient {

    static final String TOOL_NAME = "thoughtbox_hub";

    private final McpTransport transport;

    /**
     * Creates a client from configuration.
     * <p>
     * Options: {@code url} (MCP endpoint), {@code request-timeout} (duration).
     *
     * @param options the hub configuration.
     */
    public HubClient(Config options) {
        this(new McpTransport(URI.create(options.getString("url")), TOOL_NAME,
                options.getDuration("request-timeout"), false));
    }

    public HubClient(URI endpoint, Duration requestTimeout) {
        this(new McpTransport(endpoint, TOOL_NAME, requestTimeout, false));
    }

    HubClient(McpTransport transport) {
        this.transport = transport;
    }

    @Override
    public String register(String name, String role) throws CollaboratorException {
        JsonObject args = new JsonObject();
        args.addProperty("name", name);
        args.addProperty("role", role);
        return RpcResults.requireString(transport.call("register", args), "agentId", "register");
    }

    @Override
    public String createWorkspace(String name, String description) throws CollaboratorException {
        JsonObject args = new JsonObject();
        args.addProperty("name", name);
        args.addProperty("description", description);
        return RpcResults.requireString(transport.call("create_workspace", args), "workspaceId", "create_workspace");
    }

    @Override
    public String createProblem(String workspaceId, String title, String description) throws CollaboratorException {
        JsonObject args = new JsonObject();
        args.addProperty("workspaceId", workspaceId);
        args.addProperty("title", title);
        args.addProperty("description", description);
        return RpcResults.requireString(transport.call("create_problem", args), "problemId", "create_problem");
    }

    @Override
    public Integer claimProblem(String problemId, String branchId) throws CollaboratorException {
        JsonObject args = new JsonObject();
        args.addProperty("problemId", problemId);
        args.addProperty("branchId", branchId);
        return RpcResults.optionalInt(transport.call("claim_problem", args), "branchFromThought");
    }

    @Override
    public String createProposal(String problemId, String title, String sourceBranch, String description)
            throws CollaboratorException {
        JsonObject args = new JsonObject();
        args.addProperty("problemId", problemId);
        args.addProperty("title", title);
        args.addProperty("sourceBranch", sourceBranch);
        args.addProperty("description", description);
        return RpcResults.requireString(transport.call("create_proposal", args), "proposalId", "create_proposal");
    }

    @Override
    public String reviewProposal(String proposalId, ReviewVerdict verdict, String comment)
            throws CollaboratorException {
        JsonObject args = new JsonObject();
        args.addProperty("proposalId", proposalId);
        args.addProperty("verdict", verdict.wireName());
        args.addProperty("comment", comment);
        return RpcResults.optionalString(transport.call("review_proposal", args), "reviewId");
    }

    @Override
    public boolean mergeProposal(String proposalId) throws CollaboratorException {
        JsonObject args = new JsonObject();
        args.addProperty("proposalId", proposalId);
        JsonElement result = transport.call("merge_proposal", args);
        String merged = RpcResults.optionalString(result, "merged");
        // Hubs that acknowledge without a flag have merged.
        return merged == null || Boolean.parseBoolean(merged);
    }

    @Override
    public String markConsensus(String name, int thoughtRef) throws CollaboratorException {
        JsonObject args = new JsonObject();
        args.addProperty("name", name);
        args.addProperty("thoughtRef", thoughtRef);
        return RpcResults.requireString(transport.call("mark_consensus", args), "consensusId", "mark_consensus");
    }

    @Override
    public String postMessage(String workspaceId, String problemId, String content) throws CollaboratorException {
        JsonObject args = new JsonObject();
        args.addProperty("workspaceId", workspaceId);
        args.addProperty("channel", problemId);
        args.addProperty("content", content);
        return RpcResults.optionalString(transport.call("post_message", args), "messageId");
    }

    @Override
    public List<String> readChannel(String workspaceId, String problemId) throws CollaboratorException {
        JsonObject args = new JsonObject();
        args.addProperty("workspaceId", workspaceId);
        args.addProperty("channel", problemId);
        JsonElement result = transport.call("read_channel", args);

        JsonArray messages;
        if (result.isJsonArray()) {
            messages = result.getAsJsonArray();
        } else if (result.isJsonObject() && result.getAsJsonObject().has("messages")
                && result.getAsJsonObject().get("messages").isJsonArray()) {
            messages = result.getAsJsonObject().getAsJsonArray("messages");
        } else {
            return List.of();
        }

        List<String> contents = new ArrayList<>(messages.size());
        for (JsonElement message : messages) {
            if (message.isJsonPrimitive()) {
                contents.add(message.getAsString());
            } else {
                String content = RpcResults.optionalString(message, "content");
                contents.add(content != null ? content : message.toString());
            }
        }
        return contents;
    }

    /**
     * @return the current hub session id, or null.
     */
    public String getSessionId() {
        return transport.getSessionId();
    }
}
