package com.tenantgate.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.ContainerNetwork;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.NetworkSettings;
import com.github.dockerjava.api.model.StreamType;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A tenant sandbox backed by a running Docker container.
 * Files are copied in as tar archives, commands run through {@code docker exec},
 * and HTTP/WebSocket traffic goes straight to the container's network address.
 */
class DockerSandbox implements Sandbox {

    private static final Logger log = LoggerFactory.getLogger(DockerSandbox.class);

    private static final Duration WS_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final DockerClient dockerClient;
    private final HttpClient httpClient;
    private final String containerId;
    private final String name;
    private final int execTimeoutSeconds;
    private volatile String address;

    DockerSandbox(DockerClient dockerClient, HttpClient httpClient, String containerId,
                  String name, int execTimeoutSeconds) {
        this.dockerClient = dockerClient;
        this.httpClient = httpClient;
        this.containerId = containerId;
        this.name = name;
        this.execTimeoutSeconds = execTimeoutSeconds;
    }

    @Override
    public String name() {
        return name;
    }

    String containerId() {
        return containerId;
    }

    @Override
    public void mkdir(String path) {
        var result = exec("mkdir -p " + shellQuote(path));
        if (!result.succeeded()) {
            throw new SandboxException("mkdir " + path + " failed in " + name + ": " + result.stderr().trim());
        }
    }

    @Override
    public void writeFile(String path, String content) {
        int slash = path.lastIndexOf('/');
        String directory = slash > 0 ? path.substring(0, slash) : "/";
        String fileName = path.substring(slash + 1);
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);

        var buffer = new ByteArrayOutputStream();
        try (var tar = new TarArchiveOutputStream(buffer)) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            var entry = new TarArchiveEntry(fileName);
            entry.setSize(bytes.length);
            entry.setMode(0644);
            tar.putArchiveEntry(entry);
            tar.write(bytes);
            tar.closeArchiveEntry();
        } catch (IOException e) {
            throw new SandboxException("Failed to build archive for " + path, e);
        }

        try {
            dockerClient.copyArchiveToContainerCmd(containerId)
                    .withTarInputStream(new ByteArrayInputStream(buffer.toByteArray()))
                    .withRemotePath(directory)
                    .exec();
        } catch (RuntimeException e) {
            throw new SandboxException("writeFile " + path + " failed in " + name + ": " + e.getMessage(), e);
        }
        log.debug("Wrote {} ({} bytes) into {}", path, bytes.length, name);
    }

    @Override
    public long startProcess(String command, String workDir, Map<String, String> env) {
        var envList = new ArrayList<String>();
        env.forEach((k, v) -> envList.add(k + "=" + v));
        try {
            var execId = dockerClient.execCreateCmd(containerId)
                    .withCmd("bash", "-c", command)
                    .withEnv(envList)
                    .withWorkingDir(workDir)
                    .exec()
                    .getId();
            dockerClient.execStartCmd(execId)
                    .withDetach(true)
                    .exec(new ResultCallback.Adapter<Frame>());
            Long pid = dockerClient.inspectExecCmd(execId).exec().getPidLong();
            return pid != null ? pid : -1;
        } catch (RuntimeException e) {
            throw new SandboxException("startProcess failed in " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public SandboxHttpResponse httpCall(SandboxHttpRequest request, int port) {
        var builder = HttpRequest.newBuilder(URI.create("http://" + address() + ":" + port + request.path()))
                .timeout(request.timeout());
        request.headers().forEach(builder::header);
        builder.method(request.method(), request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body()));
        try {
            HttpResponse<java.io.InputStream> response =
                    httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
            return new SandboxHttpResponse(response.statusCode(),
                    response.headers().firstValue("Content-Type").orElse(null), response.body());
        } catch (IOException e) {
            throw new SandboxException(request.method() + " " + request.path() + " failed in " + name
                    + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted during " + request.method() + " " + request.path(), e);
        }
    }

    @Override
    public WebSocket wsConnect(String path, Map<String, String> headers, int port, WebSocket.Listener listener) {
        var builder = httpClient.newWebSocketBuilder().connectTimeout(WS_CONNECT_TIMEOUT);
        headers.forEach(builder::header);
        try {
            return builder.buildAsync(URI.create("ws://" + address() + ":" + port + path), listener)
                    .get(WS_CONNECT_TIMEOUT.toSeconds() + 1, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            throw new SandboxException("WebSocket " + path + " failed in " + name + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted opening WebSocket " + path, e);
        }
    }

    @Override
    public ExecResult exec(String shellCommand) {
        var stdout = new StringBuilder();
        var stderr = new StringBuilder();
        try {
            var execId = dockerClient.execCreateCmd(containerId)
                    .withCmd("bash", "-c", shellCommand)
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .exec()
                    .getId();
            boolean completed = dockerClient.execStartCmd(execId)
                    .exec(new ResultCallback.Adapter<Frame>() {
                        @Override
                        public void onNext(Frame frame) {
                            String chunk = new String(frame.getPayload(), StandardCharsets.UTF_8);
                            if (frame.getStreamType() == StreamType.STDERR) {
                                stderr.append(chunk);
                            } else {
                                stdout.append(chunk);
                            }
                        }
                    })
                    .awaitCompletion(execTimeoutSeconds, TimeUnit.SECONDS);
            if (!completed) {
                throw new SandboxException("Command timed out after " + execTimeoutSeconds + "s in " + name);
            }
            Long exitCode = dockerClient.inspectExecCmd(execId).exec().getExitCodeLong();
            return new ExecResult(exitCode != null ? exitCode.intValue() : -1, stdout.toString(), stderr.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted running command in " + name, e);
        } catch (SandboxException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SandboxException("exec failed in " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void destroy() {
        try {
            dockerClient.stopContainerCmd(containerId).exec();
        } catch (NotFoundException e) {
            log.debug("Container {} already gone", containerId);
            return;
        } catch (RuntimeException e) {
            log.debug("Container {} may already be stopped: {}", containerId, e.getMessage());
        }
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
            log.info("Sandbox {} destroyed (container {})", name, containerId);
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", containerId);
        } catch (RuntimeException e) {
            throw new SandboxException("Failed to destroy sandbox " + name + ": " + e.getMessage(), e);
        }
    }

    private String address() {
        if (address == null) {
            NetworkSettings settings;
            try {
                settings = dockerClient.inspectContainerCmd(containerId).exec().getNetworkSettings();
            } catch (RuntimeException e) {
                throw new SandboxException("Inspecting sandbox " + name + " failed: " + e.getMessage(), e);
            }
            if (settings == null || settings.getNetworks() == null) {
                throw new SandboxException("Sandbox " + name + " has no network settings");
            }
            address = settings.getNetworks().values().stream()
                    .map(ContainerNetwork::getIpAddress)
                    .filter(ip -> ip != null && !ip.isBlank())
                    .findFirst()
                    .orElseThrow(() -> new SandboxException("Sandbox " + name + " has no network address"));
        }
        return address;
    }

    static String shellQuote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }
}
