package com.ivamare.bulkload.pool;

import com.ivamare.bulkload.jdbc.ConnectionCapacityCheck;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PoolRegistry")
class PoolRegistryTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    @Mock
    private ConnectionCapacityCheck capacityCheck;

    private static PoolBuilder<Span> pool(String name, UnitOfWork<Span> unitOfWork) {
        return Pool.<Span>builder()
            .name(name)
            .workers(4)
            .pending(List.of(WorkItem.of(new Span(0, 1), 0, Duration.ofSeconds(5))))
            .unitOfWork(unitOfWork);
    }

    @Test
    @DisplayName("should check capacity and register started pools")
    void shouldCheckCapacityAndRegisterStartedPools() throws Exception {
        PoolRegistry registry = new PoolRegistry(capacityCheck);

        PoolHandle<Span> handle = registry.start(pool("copy", item -> null));
        handle.await(WAIT);

        verify(capacityCheck).check("copy", 4);
        assertSame(handle, registry.get("copy"));
        assertEquals(1, registry.all().size());
        assertTrue(registry.running().isEmpty());
    }

    @Test
    @DisplayName("should refuse a second running pool with the same name")
    void shouldRefuseSecondRunningPoolWithSameName() throws Exception {
        PoolRegistry registry = new PoolRegistry();
        CountDownLatch release = new CountDownLatch(1);
        PoolHandle<Span> first = registry.start(pool("dup", item -> release.await(5, TimeUnit.SECONDS)));

        assertThrows(IllegalStateException.class, () -> registry.start(pool("dup", item -> null)));

        release.countDown();
        first.await(WAIT);
        PoolHandle<Span> second = registry.start(pool("dup", item -> null));
        assertSame(second, registry.get("dup"));
        second.await(WAIT);
    }

    @Test
    @DisplayName("should kill running pools")
    void shouldKillRunningPools() throws Exception {
        PoolRegistry registry = new PoolRegistry();
        CountDownLatch release = new CountDownLatch(1);
        PoolHandle<Span> handle = registry.start(pool("long", item -> release.await(5, TimeUnit.SECONDS)));

        registry.killAll();
        release.countDown();

        assertTrue(handle.isKilled());
        assertEquals(PoolState.KILLED, handle.await(WAIT).state());
    }
}
