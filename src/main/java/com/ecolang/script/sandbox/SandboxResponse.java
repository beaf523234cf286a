package com.ecolang.script.sandbox;

import java.io.IOException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The worker's single reply line: {@code {"result": <value-or-null>, "error": <string-or-null>}}.
 */
public final class SandboxResponse {
    private final JsonNode result;
    private final String error;

    private SandboxResponse(JsonNode result, String error) {
        this.result = result;
        this.error = error;
    }

    public static SandboxResponse ok(JsonNode result) {
        return new SandboxResponse(result, null);
    }

    public static SandboxResponse error(String error) {
        return new SandboxResponse(null, error);
    }

    /** @throws IOException when the line is not a JSON object */
    public static SandboxResponse parse(ObjectMapper om, String line) throws IOException {
        JsonNode node = om.readTree(line);
        if (node == null || !node.isObject()) {
            throw new IOException("expected a JSON object");
        }
        JsonNode err = node.get("error");
        String error = (err == null || err.isNull()) ? null : err.asText();
        JsonNode result = node.get("result");
        return new SandboxResponse((result == null || result.isNull()) ? null : result, error);
    }

    public String toJson(ObjectMapper om) {
        ObjectNode n = om.createObjectNode();
        if (result == null) n.putNull("result");
        else n.set("result", result);
        if (error == null) n.putNull("error");
        else n.put("error", error);
        return n.toString();
    }

    /** @return the result value, or null when none was produced */
    public JsonNode getResult() { return result; }

    public String getError() { return error; }

    public boolean isError() { return error != null; }
}
