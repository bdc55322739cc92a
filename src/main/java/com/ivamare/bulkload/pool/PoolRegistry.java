package com.ivamare.bulkload.pool;

import com.ivamare.bulkload.jdbc.ConnectionCapacityCheck;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts pools and keeps track of them by name.
 *
 * <p>Finished pools stay registered until a pool with the same name starts,
 * so their final signals remain visible to health checks. Running pools are
 * killed when the application context shuts down.
 */
public class PoolRegistry {

    private static final Logger log = LoggerFactory.getLogger(PoolRegistry.class);

    private final Map<String, PoolHandle<?>> pools = new ConcurrentHashMap<>();
    private final ConnectionCapacityCheck capacityCheck;

    public PoolRegistry() {
        this(null);
    }

    public PoolRegistry(ConnectionCapacityCheck capacityCheck) {
        this.capacityCheck = capacityCheck;
    }

    /**
     * Start a pool from a builder and register it.
     *
     * @param builder configured builder
     * @return handle onto the running pool
     * @throws IllegalStateException if a pool with the same name is still running
     */
    public synchronized <J extends Job> PoolHandle<J> start(PoolBuilder<J> builder) {
        String name = builder.name();
        PoolHandle<?> existing = name != null ? pools.get(name) : null;
        if (existing != null && !existing.isDone()) {
            throw new IllegalStateException("Pool " + name + " is already running");
        }
        if (capacityCheck != null) {
            capacityCheck.check(name, builder.workers());
        }
        PoolHandle<J> handle = builder.start();
        register(handle);
        return handle;
    }

    /**
     * Track a pool started elsewhere.
     *
     * @param handle the pool
     */
    public void register(PoolHandle<?> handle) {
        pools.put(handle.name(), handle);
        handle.completion().whenComplete((last, error) -> {
            if (error != null) {
                log.error("Pool {} terminated abnormally", handle.name(), error);
            } else {
                log.info("Pool {} {} in {}s: landed={}, failed={}, cancelled={}",
                    handle.name(), last.state(), last.elapsed().toSeconds(),
                    last.landed(), last.failCount(), last.cancelled().size());
            }
        });
    }

    public PoolHandle<?> get(String name) {
        return pools.get(name);
    }

    public List<PoolHandle<?>> all() {
        return new ArrayList<>(pools.values());
    }

    public List<PoolHandle<?>> running() {
        return pools.values().stream().filter(handle -> !handle.isDone()).toList();
    }

    /**
     * Close the kill signal of every running pool. In-flight statements are
     * left to finish.
     */
    @PreDestroy
    public void killAll() {
        List<PoolHandle<?>> running = running();
        if (!running.isEmpty()) {
            log.info("Killing {} running pools", running.size());
        }
        running.forEach(PoolHandle::kill);
    }
}
