package com.ecolang.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;

import com.ecolang.debug.Debug;
import com.ecolang.script.runtime.RunResult;
import com.ecolang.script.runtime.RunSettings;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Runs one script file and prints the result as JSON. Caller-supplied settings
 * are clamped to the built-in defaults.
 *
 * Exit status: 0 success, 1 script error, 2 usage, 3 unreadable input file.
 */
public final class EcoCli {
    private static final ObjectMapper om = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<Map<String, Object>>() {};

    public static void main(String[] args) {
        if (args.length < 1 || args.length > 3) {
            System.err.println("Usage: EcoCli <script-file> [inputs.json] [settings.json]");
            System.exit(2);
        }
        if (Boolean.getBoolean("ecolang.debug")) Debug.useSysOut();

        final String script;
        final Map<String, Object> inputs;
        final Map<String, Object> rawSettings;
        try {
            script = Files.readString(Path.of(args[0]), StandardCharsets.UTF_8);
            inputs = (args.length > 1) ? readJsonObject(args[1]) : Collections.<String, Object>emptyMap();
            rawSettings = (args.length > 2) ? readJsonObject(args[2]) : Collections.<String, Object>emptyMap();
        } catch (IOException e) {
            System.err.println("Failed to read input file: " + e.getMessage());
            System.exit(3);
            return;
        }

        final RunSettings settings;
        try {
            settings = RunSettings.fromMap(rawSettings).clampTo(RunSettings.defaults());
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid settings: " + e.getMessage());
            System.exit(2);
            return;
        }

        RunResult result = new EcoLang().execute(script, inputs, settings);
        try {
            System.out.println(om.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        } catch (IOException e) {
            System.err.println("Failed to serialize result: " + e.getMessage());
            System.exit(1);
        }
        System.exit(result.isSuccess() ? 0 : 1);
    }

    private static Map<String, Object> readJsonObject(String path) throws IOException {
        Map<String, Object> m = om.readValue(Files.readString(Path.of(path), StandardCharsets.UTF_8), MAP);
        return (m == null) ? Collections.<String, Object>emptyMap() : m;
    }

    private EcoCli() {}
}
