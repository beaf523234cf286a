package com.ecolang.script.sandbox;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.ecolang.debug.Debug;
import com.ecolang.script.parser.Value;
import com.ecolang.script.runtime.ErrorCode;
import com.ecolang.script.runtime.RunError;
import com.ecolang.script.runtime.RunResult;
import com.ecolang.script.runtime.RunSettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Runs {@link SandboxWorker} in a child JVM with a scrubbed environment, a
 * heap cap and, where {@code /bin/sh} exists, a CPU-time ulimit. The caller
 * blocks up to {@code timeout_s}; the child is killed on expiry.
 */
public final class ProcessSandboxRunner implements SandboxRunner {
    private static final String TAG = "Sandbox";
    private static final String SHELL = "/bin/sh";
    private static final long DRAIN_GRACE_MS = 1000;

    private static final ExecutorService DRAIN = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "ecolang-sandbox-drain");
        t.setDaemon(true);
        return t;
    });

    private final ObjectMapper om = new ObjectMapper();
    private final List<String> fixedCommand;

    /** Spawns the bundled worker with the current JVM and classpath. */
    public ProcessSandboxRunner() {
        this.fixedCommand = null;
    }

    /** Spawns {@code command} instead of the worker; it must speak the same protocol. */
    public ProcessSandboxRunner(List<String> command) {
        this.fixedCommand = Collections.unmodifiableList(new ArrayList<>(command));
    }

    @Override
    public RunResult run(String code, RunSettings settings) {
        List<String> command = (fixedCommand != null) ? fixedCommand : workerCommand(settings);
        ProcessBuilder pb = new ProcessBuilder(command);
        Map<String, String> env = pb.environment();
        String path = env.get("PATH");
        env.clear();
        if (path != null) env.put("PATH", path);

        Process proc;
        try {
            proc = pb.start();
        } catch (IOException e) {
            Debug.get().w(TAG, "spawn failed: " + e.getMessage());
            return failed(ErrorCode.SUBPROCESS_ERROR, String.valueOf(e.getMessage()), "");
        }
        Debug.get().i(TAG, "spawned pid=" + proc.pid());

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(proc.getInputStream()), DRAIN);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(proc.getErrorStream()), DRAIN);

        try {
            try (OutputStream stdin = proc.getOutputStream()) {
                ObjectNode request = om.createObjectNode();
                request.put("code", code == null ? "" : code);
                stdin.write((request.toString() + "\n").getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                // The child may exit before reading; its exit status tells the rest.
                Debug.get().d(TAG, "request write failed: " + e.getMessage());
            }

            long timeoutMs = (long) (settings.timeoutS() * 1000);
            if (!proc.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                proc.destroyForcibly();
                Debug.get().w(TAG, "killed pid=" + proc.pid() + " after " + timeoutMs + "ms");
                return failed(ErrorCode.TIMEOUT, "Sandbox time limit exceeded", "");
            }

            String out = stdout.get(DRAIN_GRACE_MS, TimeUnit.MILLISECONDS);
            String err = stderr.get(DRAIN_GRACE_MS, TimeUnit.MILLISECONDS);
            return interpret(proc.exitValue(), out, err);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            proc.destroyForcibly();
            return failed(ErrorCode.SUBPROCESS_ERROR, "Interrupted while waiting for sandbox", "");
        } catch (ExecutionException | TimeoutException e) {
            proc.destroyForcibly();
            return failed(ErrorCode.SUBPROCESS_ERROR, "Sandbox I/O failed: " + e.getMessage(), "");
        }
    }

    private RunResult interpret(int exitCode, String out, String err) {
        if (exitCode != 0) {
            String message = err.trim().isEmpty() ? "Sandbox exited with code " + exitCode : err.trim();
            return failed(ErrorCode.SUBPROCESS_FAILED, message, out);
        }
        SandboxResponse response;
        try {
            response = SandboxResponse.parse(om, out.trim());
        } catch (IOException e) {
            return failed(ErrorCode.SUBPROCESS_FAILED, "Sandbox returned invalid JSON", out);
        }
        if (response.isError()) {
            return failed(ErrorCode.RUNTIME_ERROR, response.getError(), "");
        }
        return RunResult.sandboxed(Collections.singletonList(display(response.getResult())), null);
    }

    private String display(JsonNode result) {
        if (result == null) return "none";
        try {
            return Value.fromJava(om.treeToValue(result, Object.class)).display();
        } catch (IOException | IllegalArgumentException e) {
            return result.toString();
        }
    }

    List<String> workerCommand(RunSettings settings) {
        String java = Paths.get(System.getProperty("java.home"), "bin", "java").toString();
        List<String> jvm = new ArrayList<>(Arrays.asList(
                java,
                "-Xmx" + settings.memLimitMb() + "m",
                "-cp", System.getProperty("java.class.path"),
                SandboxWorker.class.getName()));
        if (!new File(SHELL).canExecute()) return jvm;

        List<String> cmd = new ArrayList<>();
        cmd.add(SHELL);
        cmd.add("-c");
        cmd.add("ulimit -t " + settings.cpuSeconds() + " && exec \"$0\" \"$@\"");
        cmd.addAll(jvm);
        return cmd;
    }

    private static RunResult failed(ErrorCode code, String message, String out) {
        return RunResult.sandboxed(lines(out), RunError.of(code, message));
    }

    private static List<String> lines(String out) {
        if (out == null || out.isEmpty()) return Collections.emptyList();
        String trimmed = out.endsWith("\n") ? out.substring(0, out.length() - 1) : out;
        return Arrays.asList(trimmed.split("\n", -1));
    }

    private static String drain(InputStream in) {
        try (InputStream s = in) {
            ByteArrayOutputStream buf = new ByteArrayOutputStream();
            s.transferTo(buf);
            return buf.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
