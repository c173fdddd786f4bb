package com.tenantgate.tenant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.tenantgate.agent.AgentReply;
import com.tenantgate.agent.ProcessSupervisor;
import com.tenantgate.agent.RequestProxy;
import com.tenantgate.config.ConfigCache;
import com.tenantgate.config.ConfigSnapshot;
import com.tenantgate.core.logging.MdcContext;
import com.tenantgate.logs.LogPipeline;
import com.tenantgate.sandbox.Sandbox;
import com.tenantgate.sandbox.SandboxException;
import com.tenantgate.sandbox.SandboxHttpResponse;
import com.tenantgate.sandbox.SandboxProvisionException;
import com.tenantgate.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.WebSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Owns one tenant's sandbox and agent.
 *
 * <p>Every entry point takes the controller's fair lock, records activity in the
 * durable marker, and re-derives whatever in-memory state was lost since the last
 * call: the sandbox is reconnected by name, the config hash is recomputed, and the
 * agent is health-probed before it is ever restarted. Bytes of an open stream or
 * WebSocket are relayed by the caller after the lock is released.
 *
 * <p>The only state that survives eviction is what lives in the {@link
 * com.tenantgate.storage.DurableStore} namespace named after the sandbox: the
 * {@link DurableMarker} and the session records.
 */
public class TenantController {

    private static final Logger log = LoggerFactory.getLogger(TenantController.class);

    static final String MARKER_KEY = "marker";
    static final String SESSION_PREFIX = "session:";
    static final String NAME_PREFIX = "tenant-";

    private final String name;
    private final TenantRuntime runtime;
    private final ConfigCache configCache;
    private final ProcessSupervisor supervisor;
    private final RequestProxy proxy;
    private final LogPipeline logs;
    private final ReentrantLock lock = new ReentrantLock(true);

    private String tenantId;
    private Sandbox sandbox;
    private ConfigSnapshot currentConfig;
    private String injectedHash;
    private TenantState state = TenantState.COLD;
    private boolean retired;

    public TenantController(String name, TenantRuntime runtime) {
        this.name = name;
        this.runtime = runtime;
        this.configCache = new ConfigCache(runtime.configFetcher(), runtime.configCacheTtl(), runtime.clock());
        this.supervisor = new ProcessSupervisor(runtime.sandboxProperties(), runtime.diagnostics(),
                runtime.objectMapper(), runtime.sleeper(), runtime.clock(), runtime.metrics());
        this.proxy = new RequestProxy(supervisor, runtime.diagnostics(), runtime.sandboxProperties(),
                runtime.objectMapper(), runtime.sleeper(), runtime.metrics());
        this.logs = new LogPipeline(runtime.blobStore(), runtime.logProperties(),
                runtime.sandboxProperties().getAgentLogFile(), runtime.objectMapper(), runtime.clock(),
                runtime.metrics());
    }

    public static String sandboxName(String tenantId) {
        return NAME_PREFIX + tenantId;
    }

    public String name() {
        return name;
    }

    // ── Request entry points ──────────────────────────────────────────

    public ChatResult chat(String tenantId, String userId, String message, String sessionId) {
        enter(tenantId, userId);
        try {
            String sid = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;
            var payload = new LinkedHashMap<String, Object>();
            payload.put("message", message);
            payload.put("sessionId", sid);
            return withReadySandbox(tenantId, userId, ready -> toChatResult(ready, userId, message, sid,
                    proxy.proxyChat(ready, currentConfig, "/chat", tenantId, userId, payload)));
        } finally {
            exit();
        }
    }

    /**
     * Opens the agent's NDJSON stream. The caller relays and closes the returned body.
     */
    public SandboxHttpResponse openStream(String tenantId, String userId, String message, String sessionId) {
        enter(tenantId, userId);
        try {
            String sid = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;
            var payload = new LinkedHashMap<String, Object>();
            payload.put("message", message);
            payload.put("sessionId", sid);
            return withReadySandbox(tenantId, userId,
                    ready -> proxy.proxyStream(ready, "/chat/stream", tenantId, userId, payload));
        } finally {
            exit();
        }
    }

    /**
     * Opens a WebSocket to the agent, retrying the full bring-up with backoff.
     *
     * @return the upstream socket, or empty when the agent stayed unreachable
     */
    public Optional<WebSocket> openWebSocket(String tenantId, String userId, String path,
                                             WebSocket.Listener listener) {
        enter(tenantId, userId);
        try {
            return proxy.proxyWebSocket(() -> ensureReady(tenantId, userId), path, tenantId, userId, listener);
        } finally {
            exit();
        }
    }

    public List<SessionRecord> listSessions(String tenantId, String userId) {
        enter(tenantId, userId);
        try {
            var sessions = new ArrayList<>(runtime.durableStore()
                    .list(name, SESSION_PREFIX + userId + ":", SessionRecord.class).values());
            sessions.sort(Comparator.comparingLong(SessionRecord::updatedAt).reversed());
            return sessions;
        } finally {
            exit();
        }
    }

    public Optional<SessionRecord> getSession(String tenantId, String userId, String sessionId) {
        enter(tenantId, userId);
        try {
            return runtime.durableStore().get(name, sessionKey(userId, sessionId), SessionRecord.class);
        } finally {
            exit();
        }
    }

    // ── Timer entry point ─────────────────────────────────────────────

    /**
     * Handles a timer wake-up: flushes logs while a sandbox exists and destroys it once
     * the tenant has been idle past the threshold.
     */
    public WakeUpOutcome onWakeUp() {
        lock.lock();
        try {
            if (retired) {
                return WakeUpOutcome.DORMANT;
            }
            Optional<DurableMarker> marker = readMarker();
            String tenant = recoverTenantId(marker);
            MdcContext.setTenant(tenant);

            if (sandbox == null) {
                sandbox = runtime.sandboxProvider().find(name).orElse(null);
                if (sandbox != null) {
                    log.info("Reconnected to existing sandbox {} on wake-up", name);
                }
            }
            if (sandbox != null) {
                pullAndFlush(tenant);
            }

            long lastActivity = marker.map(DurableMarker::lastActivity).orElse(0L);
            long idleMs = runtime.clock().millis() - lastActivity;
            if (idleMs > runtime.lifecycleProperties().getIdleThreshold().toMillis()) {
                if (sandbox == null) {
                    state = TenantState.IDLE;
                    return WakeUpOutcome.DORMANT;
                }
                log.info("Tenant {} idle for {} s, destroying sandbox {}", tenant, idleMs / 1000, name);
                destroySandbox(tenant);
                if (runtime.metrics() != null) runtime.metrics().recordIdleDestroy();
                return WakeUpOutcome.DESTROYED;
            }
            runtime.timer().arm(name, nextDelay());
            return WakeUpOutcome.RESCHEDULED;
        } finally {
            MdcContext.clear();
            lock.unlock();
        }
    }

    /**
     * Tears the sandbox down immediately, as an idle timeout would.
     *
     * @return true if a sandbox existed
     */
    public boolean reap() {
        lock.lock();
        try {
            String tenant = recoverTenantId(readMarker());
            MdcContext.setTenant(tenant);
            if (sandbox == null) {
                sandbox = runtime.sandboxProvider().find(name).orElse(null);
            }
            if (sandbox == null) {
                state = TenantState.IDLE;
                return false;
            }
            pullAndFlush(tenant);
            destroySandbox(tenant);
            runtime.timer().cancel(name);
            return true;
        } finally {
            MdcContext.clear();
            lock.unlock();
        }
    }

    public TenantStatus status() {
        lock.lock();
        try {
            Optional<DurableMarker> marker = readMarker();
            return new TenantStatus(name, recoverTenantId(marker), state, true, sandbox != null,
                    supervisor.isBelievedRunning(), injectedHash, logs.offset(), logs.buffered(),
                    marker.map(DurableMarker::lastActivity).orElse(null));
        } finally {
            lock.unlock();
        }
    }

    public TenantState state() {
        return state;
    }

    /**
     * Marks this instance unusable so that callers still holding it go back to the
     * registry. Refused while the controller is busy or has waiters.
     */
    boolean tryRetire() {
        if (!lock.tryLock()) {
            return false;
        }
        try {
            if (lock.hasQueuedThreads() || sandbox != null) {
                return false;
            }
            retired = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    ProcessSupervisor supervisor() {
        return supervisor;
    }

    LogPipeline logPipeline() {
        return logs;
    }

    // ── Bring-up ──────────────────────────────────────────────────────

    /**
     * Provisions, configures and starts the agent as needed. On the warm path (fresh
     * cached config, unchanged hash, agent believed running) no sandbox call is made.
     */
    Sandbox ensureReady(String tenantId, String userId) {
        try {
            if (sandbox == null) {
                state = TenantState.PROVISIONING;
                sandbox = runtime.sandboxProvider().open(name);
                if (runtime.metrics() != null) runtime.metrics().recordSandboxProvisioned();
            }

            var cached = configCache.current(tenantId, userId);
            currentConfig = cached.snapshot();
            if (!cached.hash().equals(injectedHash)) {
                state = TenantState.CONFIGURING;
                int skills = runtime.configInjector().inject(sandbox, cached.snapshot());
                injectedHash = cached.hash();
                if (runtime.metrics() != null) runtime.metrics().recordConfigInjection(skills);
            }

            if (!supervisor.isBelievedRunning()) {
                state = TenantState.STARTING_AGENT;
            }
            supervisor.ensureAgentRunning(sandbox, currentConfig);
            state = TenantState.READY;
            return sandbox;
        } catch (RuntimeException e) {
            log.error("Bring-up of {} failed in state {}: {}", name, state, e.getMessage());
            if (e instanceof SandboxException) {
                discardSandbox(tenantId);
            }
            if (sandbox == null) {
                state = TenantState.COLD;
            }
            throw e;
        }
    }

    /**
     * Runs {@code action} against a ready sandbox. When the sandbox itself fails, the
     * handle is dropped and the bring-up and action are repeated once, so a container
     * removed behind the controller's back is replaced within the same request.
     */
    private <T> T withReadySandbox(String tenantId, String userId, Function<Sandbox, T> action) {
        try {
            return readyThen(tenantId, userId, action);
        } catch (SandboxProvisionException e) {
            throw e;
        } catch (SandboxException e) {
            log.warn("Sandbox {} unusable ({}), reconnecting and retrying once", name, e.getMessage());
            return readyThen(tenantId, userId, action);
        }
    }

    private <T> T readyThen(String tenantId, String userId, Function<Sandbox, T> action) {
        Sandbox ready = ensureReady(tenantId, userId);
        try {
            return action.apply(ready);
        } catch (SandboxException e) {
            discardSandbox(tenantId);
            throw e;
        }
    }

    /**
     * Forgets a sandbox handle that stopped working. The environment is left alone: the
     * next bring-up reconnects to it by name or provisions a new one.
     */
    private void discardSandbox(String tenant) {
        if (sandbox == null) {
            return;
        }
        log.warn("Dropping handle to sandbox {}", name);
        logs.flush(tenant);
        sandbox = null;
        supervisor.markNotRunning();
        injectedHash = null;
        logs.reset();
        state = TenantState.COLD;
    }

    // ── Internals ─────────────────────────────────────────────────────

    private void enter(String tenantId, String userId) {
        lock.lock();
        if (retired) {
            lock.unlock();
            throw new ControllerRetiredException(name);
        }
        try {
            this.tenantId = tenantId;
            MdcContext.setRequest(tenantId, userId);
            if (state == TenantState.IDLE) {
                state = TenantState.COLD;
            }
            runtime.durableStore().put(name, MARKER_KEY, new DurableMarker(runtime.clock().millis(), tenantId));
        } catch (RuntimeException e) {
            MdcContext.clear();
            lock.unlock();
            throw e;
        }
    }

    private void exit() {
        try {
            runtime.timer().arm(name, nextDelay());
        } finally {
            MdcContext.clear();
            lock.unlock();
        }
    }

    private Duration nextDelay() {
        var lifecycle = runtime.lifecycleProperties();
        return sandbox != null ? lifecycle.getFlushInterval() : lifecycle.getIdleThreshold();
    }

    private void pullAndFlush(String tenant) {
        try {
            logs.pullAndBuffer(sandbox, tenant);
        } catch (SandboxException e) {
            log.warn("Log pull from {} failed: {}", name, e.getMessage());
        }
        logs.flush(tenant);
    }

    private void destroySandbox(String tenant) {
        try {
            sandbox.destroy();
        } catch (SandboxException e) {
            log.error("Destroying sandbox {} failed: {}", name, e.getMessage());
        }
        sandbox = null;
        supervisor.markNotRunning();
        injectedHash = null;
        configCache.invalidate();
        logs.reset();
        state = TenantState.IDLE;
        logs.cleanupOld(tenant);
    }

    private ChatResult toChatResult(Sandbox ready, String userId, String message, String sessionId,
                                    AgentReply reply) {
        var body = new LinkedHashMap<String, Object>();
        if (!reply.isSuccessful()) {
            log.error("Agent request failed with status {}: {}", reply.statusCode(), reply.body());
            body.put("error", "Agent execution failed");
            body.put("details", reply.body());
            body.put("sessionId", sessionId);
            return new ChatResult(500, body);
        }

        JsonNode response = parse(reply.body());
        JsonNode usage = response.has("usage") ? response.get("usage") : defaultUsage();

        if (response.hasNonNull("error")) {
            body.put("response", response);
            body.put("sessionId", sessionId);
            body.put("usage", usage);
            body.put("diagnostics", Map.of("agentLog", runtime.diagnostics().agentLogTail(ready)));
            return new ChatResult(200, body);
        }

        saveSession(userId, sessionId, message, response);

        JsonNode text = response.hasNonNull("text") ? response.get("text")
                : response.hasNonNull("response") ? response.get("response")
                : response;
        body.put("response", text);
        body.put("sessionId", sessionId);
        body.put("usage", usage);
        return new ChatResult(200, body);
    }

    private void saveSession(String userId, String sessionId, String message, JsonNode response) {
        try {
            runtime.durableStore().put(name, sessionKey(userId, sessionId),
                    new SessionRecord(sessionId, userId, message, response, runtime.clock().millis()));
        } catch (StorageException e) {
            log.error("Failed to store session {}: {}", sessionId, e.getMessage());
        }
    }

    private JsonNode parse(String body) {
        try {
            JsonNode node = runtime.objectMapper().readTree(body);
            return node != null ? node : TextNode.valueOf("");
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(body);
        }
    }

    private JsonNode defaultUsage() {
        var usage = runtime.objectMapper().createObjectNode();
        usage.put("inputTokens", 0);
        usage.put("outputTokens", 0);
        return usage;
    }

    private Optional<DurableMarker> readMarker() {
        try {
            return runtime.durableStore().get(name, MARKER_KEY, DurableMarker.class);
        } catch (StorageException e) {
            log.error("Could not read durable marker of {}: {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    private String recoverTenantId(Optional<DurableMarker> marker) {
        if (tenantId == null) {
            tenantId = marker.map(DurableMarker::tenantId)
                    .orElseGet(() -> name.startsWith(NAME_PREFIX) ? name.substring(NAME_PREFIX.length()) : name);
        }
        return tenantId;
    }

    private static String sessionKey(String userId, String sessionId) {
        return SESSION_PREFIX + userId + ":" + sessionId;
    }
}
