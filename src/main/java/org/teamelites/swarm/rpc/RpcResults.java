package org.teamelites.swarm.rpc;

import org.teamelites.swarm.spi.CollaboratorException;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Field extraction from unwrapped tool results.
 */
public final class RpcResults {

    private RpcResults() {
    }

    /**
     * @return the string member {@code field} of an object result.
     * @throws CollaboratorException if the result is not an object or the member is missing.
     */
    public static String requireString(JsonElement result, String field, String operation)
            throws CollaboratorException {
        String value = optionalString(result, field);
        if (value == null || value.isEmpty()) {
            throw new CollaboratorException(operation, "result has no '" + field + "': " + result);
        }
        return value;
    }

    /**
     * @return the string member {@code field}, or null if absent.
     */
    public static String optionalString(JsonElement result, String field) {
        JsonElement member = member(result, field);
        return member == null || !member.isJsonPrimitive() ? null : member.getAsString();
    }

    /**
     * @return the integer member {@code field}, or null if absent or not numeric.
     */
    public static Integer optionalInt(JsonElement result, String field) {
        JsonElement member = member(result, field);
        if (member == null || !member.isJsonPrimitive() || !member.getAsJsonPrimitive().isNumber()) {
            return null;
        }
        return member.getAsInt();
    }

    static JsonElement member(JsonElement result, String field) {
        if (result == null || !result.isJsonObject()) {
            return null;
        }
        JsonObject object = result.getAsJsonObject();
        JsonElement member = object.get(field);
        return member == null || member.isJsonNull() ? null : member;
    }
}
