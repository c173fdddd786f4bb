package com.tenantgate.tenant;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * One pending wake-up per controller name. Arming replaces whatever was pending.
 * <p>
 * Alarms are addressed by name rather than by controller instance, so an alarm armed
 * by an instance that was evicted in the meantime still reaches its successor: the
 * handler looks the name up (and rehydrates it) when the alarm fires.
 */
@Component
public class LifecycleTimer {

    private static final Logger log = LoggerFactory.getLogger(LifecycleTimer.class);

    private final ScheduledExecutorService scheduler;
    private final Map<String, Alarm> alarms = new ConcurrentHashMap<>();
    private volatile Consumer<String> handler = name -> log.warn("No wake-up handler registered, dropping alarm for {}", name);

    public LifecycleTimer(LifecycleProperties properties) {
        var counter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(properties.getTimerThreads(), r -> {
            Thread t = new Thread(r, "tenant-timer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void setHandler(Consumer<String> handler) {
        this.handler = handler;
    }

    public void arm(String name, Duration delay) {
        var alarm = new Alarm();
        Alarm previous = alarms.put(name, alarm);
        if (previous != null) {
            previous.cancel();
        }
        alarm.future = scheduler.schedule(() -> fire(name, alarm), delay.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("Wake-up for {} armed in {} ms", name, delay.toMillis());
    }

    public void cancel(String name) {
        Alarm pending = alarms.remove(name);
        if (pending != null) {
            pending.cancel();
        }
    }

    public boolean isArmed(String name) {
        return alarms.containsKey(name);
    }

    private void fire(String name, Alarm alarm) {
        if (!alarms.remove(name, alarm)) {
            return;
        }
        try {
            handler.accept(name);
        } catch (RuntimeException e) {
            log.error("Wake-up handler for {} failed", name, e);
        }
    }

    private static final class Alarm {
        private volatile ScheduledFuture<?> future;

        void cancel() {
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }

    @PreDestroy
    void shutdown() {
        scheduler.shutdownNow();
    }
}
