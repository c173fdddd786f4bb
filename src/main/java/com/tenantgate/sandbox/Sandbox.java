package com.tenantgate.sandbox;

import java.net.http.WebSocket;
import java.util.Map;

/**
 * Handle to one tenant's isolated execution environment.
 * <p>
 * All primitives throw {@link SandboxException} when the environment cannot be reached.
 */
public interface Sandbox {

    /** Deterministic name of the environment, {@code tenant-<tenantId>}. */
    String name();

    /** Creates a directory and any missing parents. Succeeds if it already exists. */
    void mkdir(String path);

    /** Writes (or overwrites) a UTF-8 text file. The parent directory must exist. */
    void writeFile(String path, String content);

    /**
     * Launches a shell command in the background and returns without waiting for it.
     *
     * @return the process id inside the environment, or -1 when unknown
     */
    long startProcess(String command, String workDir, Map<String, String> env);

    /** Performs an HTTP call against a port listening inside the environment. */
    SandboxHttpResponse httpCall(SandboxHttpRequest request, int port);

    /** Opens a WebSocket to a port listening inside the environment. */
    WebSocket wsConnect(String path, Map<String, String> headers, int port, WebSocket.Listener listener);

    /** Runs a shell command to completion. Used for diagnostics and log pulls. */
    ExecResult exec(String shellCommand);

    /** Tears down the environment. Succeeds if it is already gone. */
    void destroy();
}
