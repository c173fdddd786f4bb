package com.tenantgate.sandbox;

import java.io.ByteArrayInputStream;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * In-memory sandbox for tests. Simulates an agent that becomes healthy once started,
 * an append-only agent log, and a file tree.
 */
public class FakeSandbox implements Sandbox {

    private final String name;

    public final Map<String, String> files = Collections.synchronizedMap(new LinkedHashMap<>());
    public final Set<String> dirs = Collections.synchronizedSet(new LinkedHashSet<>());
    public final List<String> startedCommands = Collections.synchronizedList(new ArrayList<>());
    public final List<Map<String, String>> startedEnvs = Collections.synchronizedList(new ArrayList<>());
    public final List<SandboxHttpRequest> httpRequests = Collections.synchronizedList(new ArrayList<>());
    public final List<String> execCommands = Collections.synchronizedList(new ArrayList<>());

    private volatile boolean healthy;
    private volatile boolean startMakesHealthy = true;
    private volatile boolean destroyed;
    private volatile boolean stopped;
    private volatile String agentLog = "";
    private volatile Function<SandboxHttpRequest, SandboxHttpResponse> agentHandler =
            request -> response(200, "{\"text\":\"hello\",\"usage\":{\"inputTokens\":3,\"outputTokens\":5}}");
    private volatile Function<String, WebSocket> wsHandler = path -> {
        throw new SandboxException("no websocket server");
    };

    public FakeSandbox(String name) {
        this.name = name;
    }

    // ── Test controls ──

    public FakeSandbox healthy(boolean healthy) {
        this.healthy = healthy;
        return this;
    }

    public FakeSandbox startMakesHealthy(boolean value) {
        this.startMakesHealthy = value;
        return this;
    }

    public FakeSandbox agentHandler(Function<SandboxHttpRequest, SandboxHttpResponse> handler) {
        this.agentHandler = handler;
        return this;
    }

    public FakeSandbox wsHandler(Function<String, WebSocket> handler) {
        this.wsHandler = handler;
        return this;
    }

    public void appendLog(String text) {
        agentLog = agentLog + text;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    /** Stops the environment as a daemon restart would; the agent inside dies. */
    public FakeSandbox stop() {
        stopped = true;
        healthy = false;
        return this;
    }

    public boolean isStopped() {
        return stopped;
    }

    void restart() {
        stopped = false;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public long healthCalls() {
        synchronized (httpRequests) {
            return httpRequests.stream().filter(r -> r.path().equals("/health")).count();
        }
    }

    public long agentCalls() {
        synchronized (httpRequests) {
            return httpRequests.stream().filter(r -> !r.path().equals("/health")).count();
        }
    }

    public static SandboxHttpResponse response(int status, String body) {
        return new SandboxHttpResponse(status, "application/json",
                new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
    }

    // ── Sandbox ──

    @Override
    public String name() {
        return name;
    }

    @Override
    public void mkdir(String path) {
        checkAlive();
        dirs.add(path);
    }

    @Override
    public void writeFile(String path, String content) {
        checkAlive();
        files.put(path, content);
    }

    @Override
    public long startProcess(String command, String workDir, Map<String, String> env) {
        checkAlive();
        startedCommands.add(command);
        startedEnvs.add(env);
        if (startMakesHealthy) {
            healthy = true;
        }
        return 42;
    }

    @Override
    public SandboxHttpResponse httpCall(SandboxHttpRequest request, int port) {
        checkAlive();
        httpRequests.add(request);
        if (request.path().equals("/health")) {
            if (!healthy) {
                throw new SandboxException("Connection refused");
            }
            return response(200, "{\"status\":\"ok\"}");
        }
        if (!healthy) {
            throw new SandboxException("Connection refused");
        }
        return agentHandler.apply(request);
    }

    @Override
    public WebSocket wsConnect(String path, Map<String, String> headers, int port, WebSocket.Listener listener) {
        checkAlive();
        if (!healthy) {
            throw new SandboxException("Connection refused");
        }
        return wsHandler.apply(path);
    }

    @Override
    public ExecResult exec(String shellCommand) {
        checkAlive();
        execCommands.add(shellCommand);
        if (shellCommand.startsWith("tail -n +")) {
            String rest = shellCommand.substring("tail -n +".length());
            int from = Integer.parseInt(rest.substring(0, rest.indexOf(' ')));
            return new ExecResult(0, linesFrom(from), "");
        }
        if (shellCommand.startsWith("tail -n ")) {
            return new ExecResult(0, agentLog.isEmpty() ? "" : agentLog, "");
        }
        return new ExecResult(0, "output of " + shellCommand, "");
    }

    @Override
    public void destroy() {
        destroyed = true;
        healthy = false;
    }

    // tail -n +N semantics: everything from line N (1-based) on, including a partial last line
    private String linesFrom(int from) {
        String log = agentLog;
        int index = 0;
        for (int line = 1; line < from; line++) {
            int next = log.indexOf('\n', index);
            if (next < 0) {
                return "";
            }
            index = next + 1;
        }
        return log.substring(index);
    }

    private void checkAlive() {
        if (destroyed) {
            throw new SandboxException("Sandbox " + name + " is gone");
        }
        if (stopped) {
            throw new SandboxException("Sandbox " + name + " is not running");
        }
    }
}
