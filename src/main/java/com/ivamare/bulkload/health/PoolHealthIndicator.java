package com.ivamare.bulkload.health;

import com.ivamare.bulkload.pool.PoolHandle;
import com.ivamare.bulkload.pool.PoolRegistry;
import com.ivamare.bulkload.pool.PoolState;
import com.ivamare.bulkload.pool.SignalsSnapshot;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Health indicator for bulk load pools.
 *
 * <p>Reports:
 * <ul>
 *   <li>State and progress of each registered pool</li>
 *   <li>Failed, cancelled and abandoned item counts</li>
 *   <li>DOWN when a pool aborted or has terminally failed items</li>
 * </ul>
 */
public class PoolHealthIndicator implements HealthIndicator {

    private final PoolRegistry registry;

    public PoolHealthIndicator(PoolRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        List<PoolHandle<?>> pools = registry.all();
        if (pools.isEmpty()) {
            return Health.unknown()
                .withDetail("message", "No pools registered")
                .build();
        }

        Map<String, PoolStatus> statuses = new LinkedHashMap<>();
        boolean healthy = true;
        int running = 0;
        for (PoolHandle<?> pool : pools) {
            SignalsSnapshot<?> signals = pool.signals();
            statuses.put(pool.name(), PoolStatus.of(signals));
            if (signals.state() == PoolState.ABORTED || signals.failCount() > 0) {
                healthy = false;
            }
            if (!signals.state().isTerminal()) {
                running++;
            }
        }

        Health.Builder builder = healthy ? Health.up() : Health.down();
        return builder
            .withDetail("pools", statuses)
            .withDetail("running", running)
            .build();
    }

    record PoolStatus(
        PoolState state,
        int pending,
        int inFlight,
        long landed,
        int failed,
        int cancelled,
        int abandoned,
        String progress
    ) {
        static PoolStatus of(SignalsSnapshot<?> signals) {
            return new PoolStatus(
                signals.state(),
                signals.pending().size(),
                signals.inFlight(),
                signals.landed(),
                signals.failCount(),
                signals.cancelled().size(),
                signals.abandoned().size(),
                String.format(Locale.ROOT, "%.1f%%", signals.progress().percent())
            );
        }
    }
}
