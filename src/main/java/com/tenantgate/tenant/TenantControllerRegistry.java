package com.tenantgate.tenant;

import com.tenantgate.sandbox.SandboxHttpResponse;
import com.tenantgate.storage.StorageException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.net.http.WebSocket;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Maps each tenant to its single live {@link TenantController}.
 *
 * <p>Controllers are created on first use and after eviction are rebuilt from their
 * name alone. A controller whose sandbox has been torn down is evicted; callers that
 * still hold the evicted instance are transparently redirected to its successor.
 */
@Service
public class TenantControllerRegistry {

    private static final Logger log = LoggerFactory.getLogger(TenantControllerRegistry.class);

    private final TenantRuntime runtime;
    private final Map<String, TenantController> controllers = new ConcurrentHashMap<>();

    public TenantControllerRegistry(TenantRuntime runtime) {
        this.runtime = runtime;
    }

    @PostConstruct
    void registerWakeUpHandler() {
        runtime.timer().setHandler(this::onWakeUp);
    }

    /**
     * Re-arms a wake-up for every tenant with persisted state, so sandboxes left behind
     * by a previous process are still flushed and reaped.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void rearmPersistedTenants() {
        List<String> names;
        try {
            names = runtime.durableStore().namespaces();
        } catch (StorageException e) {
            log.warn("Could not enumerate persisted tenants: {}", e.getMessage());
            return;
        }
        int armed = 0;
        for (String name : names) {
            if (name.startsWith(TenantController.NAME_PREFIX) && !runtime.timer().isArmed(name)) {
                runtime.timer().arm(name, runtime.lifecycleProperties().getFlushInterval());
                armed++;
            }
        }
        if (armed > 0) {
            log.info("Re-armed wake-ups for {} persisted tenants", armed);
        }
    }

    // ── Tenant operations ─────────────────────────────────────────────

    public ChatResult chat(String tenantId, String userId, String message, String sessionId) {
        return withController(tenantId, c -> c.chat(tenantId, userId, message, sessionId));
    }

    public SandboxHttpResponse openStream(String tenantId, String userId, String message, String sessionId) {
        return withController(tenantId, c -> c.openStream(tenantId, userId, message, sessionId));
    }

    public Optional<WebSocket> openWebSocket(String tenantId, String userId, String path, WebSocket.Listener listener) {
        return withController(tenantId, c -> c.openWebSocket(tenantId, userId, path, listener));
    }

    public List<SessionRecord> listSessions(String tenantId, String userId) {
        return withController(tenantId, c -> c.listSessions(tenantId, userId));
    }

    public Optional<SessionRecord> getSession(String tenantId, String userId, String sessionId) {
        return withController(tenantId, c -> c.getSession(tenantId, userId, sessionId));
    }

    /**
     * Destroys the tenant's sandbox now and evicts the controller.
     *
     * @return true if a sandbox existed
     */
    public boolean reap(String tenantId) {
        boolean destroyed = withController(tenantId, TenantController::reap);
        evict(TenantController.sandboxName(tenantId));
        return destroyed;
    }

    /**
     * Live status when the controller is resident, otherwise what the durable marker says.
     */
    public Optional<TenantStatus> status(String tenantId) {
        String name = TenantController.sandboxName(tenantId);
        TenantController controller = controllers.get(name);
        if (controller != null) {
            return Optional.of(controller.status());
        }
        return runtime.durableStore().get(name, TenantController.MARKER_KEY, DurableMarker.class)
                .map(m -> new TenantStatus(name, m.tenantId(), TenantState.COLD, false, false, false,
                        null, 0, 0, m.lastActivity()));
    }

    // ── Resolution ────────────────────────────────────────────────────

    <T> T withController(String tenantId, Function<TenantController, T> call) {
        String name = TenantController.sandboxName(tenantId);
        while (true) {
            TenantController controller = controllers.computeIfAbsent(name, this::create);
            try {
                return call.apply(controller);
            } catch (ControllerRetiredException e) {
                log.debug("{}; retrying on its successor", e.getMessage());
            }
        }
    }

    void onWakeUp(String name) {
        TenantController controller = controllers.computeIfAbsent(name, n -> {
            log.info("Rehydrating controller {} for wake-up", n);
            return create(n);
        });
        WakeUpOutcome outcome = controller.onWakeUp();
        if (outcome != WakeUpOutcome.RESCHEDULED) {
            evict(name);
        }
    }

    /**
     * Drops the controller from memory if it is idle. Its durable state is kept.
     */
    boolean evict(String name) {
        TenantController controller = controllers.get(name);
        if (controller == null) {
            return false;
        }
        if (controller.tryRetire() && controllers.remove(name, controller)) {
            log.debug("Evicted controller {}", name);
            return true;
        }
        return false;
    }

    Optional<TenantController> resident(String name) {
        return Optional.ofNullable(controllers.get(name));
    }

    private TenantController create(String name) {
        return new TenantController(name, runtime);
    }
}
