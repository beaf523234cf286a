package com.ecolang.script.sandbox;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Child-process entry point. Reads one request {@code {"code": "..."}} from
 * stdin, writes one {@link SandboxResponse} line to stdout. A malformed request
 * is reported as {@code bad_payload} with exit status 1.
 */
public final class SandboxWorker {
    private static final ObjectMapper om = new ObjectMapper();

    private SandboxWorker() {
    }

    public static void main(String[] args) {
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        String code;
        try {
            code = readCode(System.in);
        } catch (IOException e) {
            out.println(SandboxResponse.error("bad_payload: " + e.getMessage()).toJson(om));
            System.exit(1);
            return;
        }
        out.println(new SandboxEvaluator(om).evaluate(code).toJson(om));
    }

    static String readCode(InputStream in) throws IOException {
        String raw = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        JsonNode payload = om.readTree(raw);
        if (payload == null || !payload.isObject()) {
            throw new IOException("expected a JSON object");
        }
        JsonNode code = payload.get("code");
        if (code == null || code.isNull()) return "";
        if (!code.isTextual()) throw new IOException("'code' must be a string");
        return code.asText();
    }
}
