package com.policysync.cache;

import com.policysync.contract.JsonPolicyDecoder;
import com.policysync.contract.PolicyFetchResponse;
import com.policysync.contract.PolicyScope;
import com.policysync.notifier.PolicyNotifier;
import com.policysync.notifier.SubsystemState;
import com.policysync.support.MutableClock;
import com.policysync.support.QueuedExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.policysync.support.PolicyFixtures.DIRECT;
import static com.policysync.support.PolicyFixtures.MAPPER;
import static com.policysync.support.PolicyFixtures.response;
import static org.junit.jupiter.api.Assertions.*;

class PolicyCacheTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private MutableClock clock;
    private InMemoryPolicyCacheStore store;
    private PolicyNotifier notifier;
    private QueuedExecutor io;
    private RecordingObserver observer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new InMemoryPolicyCacheStore();
        notifier = new PolicyNotifier();
        io = new QueuedExecutor();
        observer = new RecordingObserver();
    }

    private PolicyCache newCache(boolean waitForPolicyFetch) {
        PolicyCache cache = new PolicyCache("user", new JsonPolicyDecoder(MAPPER, PolicyScope.USER),
            store, notifier, clock, waitForPolicyFetch, io, DIRECT);
        cache.addObserver(observer);
        return cache;
    }

    private PolicyCache loadedCache(boolean waitForPolicyFetch) {
        PolicyCache cache = newCache(waitForPolicyFetch);
        cache.load();
        io.runAll();
        return cache;
    }

    @Nested
    @DisplayName("Applying fetched policy")
    class SetPolicy {

        @Test
        void validPolicy_isApplied() {
            PolicyCache cache = loadedCache(false);
            observer.updates.clear();

            boolean accepted = cache.setPolicy(response(NOW.minusSeconds(60), Map.of("a", 1), Map.of(), 4));

            assertTrue(accepted);
            assertEquals(1, cache.policies().getValue("a").orElseThrow());
            assertEquals(Optional.of(NOW), cache.lastPolicyRefreshTime());
            assertEquals(Optional.of(4), cache.getPublicKeyVersion());
            assertFalse(cache.isUnmanaged());
            assertEquals(1, observer.updates.size());
            assertEquals(SubsystemState.SUCCESS, notifier.state());
        }

        @Test
        void futureTimestamp_isRejectedAndPreviousPolicyKept() {
            PolicyCache cache = loadedCache(false);
            cache.setPolicy(response(NOW, Map.of("a", 1)));
            Instant firstRefresh = cache.lastPolicyRefreshTime().orElseThrow();
            clock.advance(Duration.ofMinutes(1));

            boolean accepted = cache.setPolicy(response(clock.instant().plusSeconds(3600), Map.of("a", 2)));

            assertFalse(accepted);
            assertEquals(1, cache.policies().getValue("a").orElseThrow());
            assertEquals(Optional.of(firstRefresh), cache.lastPolicyRefreshTime());
            assertEquals(1, cache.rejectedResponseCount());
        }

        @Test
        void undecodableResponse_isRejected() {
            PolicyCache cache = loadedCache(false);

            assertFalse(cache.setPolicy(PolicyFetchResponse.of("garbage")));
            assertTrue(cache.policies().isEmpty());
            assertTrue(cache.lastPolicyRefreshTime().isEmpty());
            assertEquals(1, cache.rejectedResponseCount());
        }

        @Test
        void acceptedPolicy_isPersisted() {
            PolicyCache cache = loadedCache(false);
            cache.setPolicy(response(NOW, Map.of("a", 1)));
            io.runAll();

            CachedPolicy stored = store.load().orElseThrow();
            assertFalse(stored.unmanaged());
            assertEquals(NOW.toEpochMilli(), stored.timestamp());
        }
    }

    @Nested
    @DisplayName("Readiness")
    class Readiness {

        @Test
        void notReadyUntilStorageLoaded() {
            PolicyCache cache = newCache(false);
            cache.load();

            assertFalse(cache.isReady());
            io.runAll();
            assertTrue(cache.isReady());
            assertEquals(1, observer.updates.size());
        }

        @Test
        void waitingCache_becomesReadyOnFetchingDone() {
            PolicyCache cache = loadedCache(true);
            assertFalse(cache.isReady());
            assertTrue(observer.updates.isEmpty());

            cache.setFetchingDone();

            assertTrue(cache.isReady());
            assertEquals(1, observer.updates.size());
        }

        @Test
        void noNotificationsBeforeReady() {
            PolicyCache cache = newCache(false);
            cache.load();

            cache.setFetchingDone();
            assertTrue(observer.updates.isEmpty());

            io.runAll();
            assertEquals(1, observer.updates.size());
        }

        @Test
        void readinessIsLatched() {
            PolicyCache cache = loadedCache(false);
            cache.reset();
            cache.setUnmanaged(NOW);
            assertTrue(cache.isReady());
        }

        @Test
        void unreadableStore_stillBecomesReady() {
            PolicyCache cache = new PolicyCache("device", new JsonPolicyDecoder(MAPPER, PolicyScope.MACHINE),
                new FailingStore(), notifier, clock, false, DIRECT, DIRECT);

            cache.load();

            assertTrue(cache.isReady());
            assertTrue(cache.policies().isEmpty());
        }
    }

    @Nested
    @DisplayName("Stored policy")
    class StoredPolicy {

        @Test
        void storedPolicy_isLoadedWithItsTimestamp() {
            Instant storedAt = NOW.minus(Duration.ofHours(1));
            store.store(CachedPolicy.managed(response(storedAt, Map.of("a", 1), Map.of(), 3), storedAt.toEpochMilli()));

            PolicyCache cache = loadedCache(false);

            assertEquals(1, cache.policies().getValue("a").orElseThrow());
            assertEquals(Optional.of(storedAt), cache.lastPolicyRefreshTime());
            assertEquals(Optional.of(3), cache.getPublicKeyVersion());
        }

        @Test
        void storedUnmanagedMarker_isLoaded() {
            store.store(CachedPolicy.unmanaged(NOW.toEpochMilli()));

            PolicyCache cache = loadedCache(false);

            assertTrue(cache.isUnmanaged());
            assertTrue(cache.getPublicKeyVersion().isEmpty());
        }

        @Test
        void fetchCompletedDuringLoad_winsOverStoredPolicy() {
            store.store(CachedPolicy.managed(response(NOW.minusSeconds(600), Map.of("a", "old")),
                NOW.minusSeconds(600).toEpochMilli()));
            PolicyCache cache = newCache(false);
            cache.load();

            cache.setPolicy(response(NOW, Map.of("a", "new")));
            io.runAll();

            assertEquals("new", cache.policies().getValue("a").orElseThrow());
            assertEquals(Optional.of(NOW), cache.lastPolicyRefreshTime());
        }
    }

    @Nested
    @DisplayName("Management state")
    class ManagementState {

        @Test
        void setUnmanaged_dropsPolicyAndKeyVersion() {
            PolicyCache cache = loadedCache(false);
            cache.setPolicy(response(NOW, Map.of("a", 1), Map.of(), 2));

            cache.setUnmanaged(NOW.plusSeconds(5));

            assertTrue(cache.isUnmanaged());
            assertTrue(cache.policies().isEmpty());
            assertTrue(cache.getPublicKeyVersion().isEmpty());
            assertEquals(Optional.of(NOW.plusSeconds(5)), cache.lastPolicyRefreshTime());
        }

        @Test
        void reset_forgetsRefreshTimeButKeepsValues() {
            PolicyCache cache = loadedCache(false);
            cache.setPolicy(response(NOW, Map.of("a", 1), Map.of(), 2));

            cache.reset();

            assertTrue(cache.lastPolicyRefreshTime().isEmpty());
            assertTrue(cache.getPublicKeyVersion().isEmpty());
            assertEquals(1, cache.policies().getValue("a").orElseThrow());
            assertEquals(SubsystemState.UNENROLLED, notifier.state());
        }
    }

    @Nested
    @DisplayName("Observers")
    class Observers {

        @Test
        void close_announcesGoingAwayOnce() {
            PolicyCache cache = loadedCache(false);

            cache.close();
            cache.close();

            assertEquals(1, observer.goingAway.size());
        }

        @Test
        void throwingObserver_doesNotStopOthers() {
            PolicyCache cache = newCache(false);
            cache.removeObserver(observer);
            cache.addObserver(new PolicyCacheObserver() {
                @Override
                public void onCacheUpdate(PolicyCache c) {
                    throw new IllegalStateException("boom");
                }

                @Override
                public void onCacheGoingAway(PolicyCache c) {
                }
            });
            cache.addObserver(observer);

            cache.load();
            io.runAll();

            assertEquals(1, observer.updates.size());
        }

        @Test
        void throwingObserver_doesNotStopGoingAwayNotifications() {
            PolicyCache cache = loadedCache(false);
            cache.removeObserver(observer);
            cache.addObserver(new PolicyCacheObserver() {
                @Override
                public void onCacheUpdate(PolicyCache c) {
                }

                @Override
                public void onCacheGoingAway(PolicyCache c) {
                    throw new IllegalStateException("boom");
                }
            });
            cache.addObserver(observer);

            cache.close();

            assertEquals(1, observer.goingAway.size());
        }
    }

    @Nested
    @DisplayName("Persistence")
    class Persistence {

        @Test
        void supersededWrite_isSkipped() {
            RecordingStore recording = new RecordingStore();
            PolicyCache cache = new PolicyCache("user", new JsonPolicyDecoder(MAPPER, PolicyScope.USER),
                recording, notifier, clock, false, io, DIRECT);

            cache.setPolicy(response(NOW, Map.of("a", 1)));
            cache.setUnmanaged(NOW);
            io.runAll();

            assertEquals(1, recording.writes.size());
            assertTrue(recording.load().orElseThrow().unmanaged());
        }

        @Test
        void writesOnMultiThreadExecutor_landInOrder() throws InterruptedException {
            ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
            pool.setCorePoolSize(2);
            pool.setMaxPoolSize(2);
            pool.initialize();
            try {
                RecordingStore recording = new RecordingStore();
                recording.holdFirstWrite = true;
                PolicyCache cache = new PolicyCache("user", new JsonPolicyDecoder(MAPPER, PolicyScope.USER),
                    recording, notifier, clock, false, pool, DIRECT);

                cache.setPolicy(response(NOW, Map.of("a", 1)));
                assertTrue(recording.firstWriteStarted.await(5, TimeUnit.SECONDS));
                cache.setUnmanaged(NOW);
                recording.releaseFirstWrite.countDown();

                assertTrue(recording.unmanagedWritten.await(5, TimeUnit.SECONDS));
                assertEquals(2, recording.writes.size());
                assertEquals(1, recording.maxWritesInFlight.get());
                assertTrue(recording.load().orElseThrow().unmanaged());
            } finally {
                pool.shutdown();
            }
        }
    }

    /** Records writes; optionally holds the first one until released. */
    private static class RecordingStore extends InMemoryPolicyCacheStore {
        final List<CachedPolicy> writes = new CopyOnWriteArrayList<>();
        final CountDownLatch firstWriteStarted = new CountDownLatch(1);
        final CountDownLatch releaseFirstWrite = new CountDownLatch(1);
        final CountDownLatch unmanagedWritten = new CountDownLatch(1);
        final AtomicInteger writesInFlight = new AtomicInteger();
        final AtomicInteger maxWritesInFlight = new AtomicInteger();
        volatile boolean holdFirstWrite;

        @Override
        public void store(CachedPolicy policy) {
            maxWritesInFlight.accumulateAndGet(writesInFlight.incrementAndGet(), Math::max);
            try {
                if (holdFirstWrite && firstWriteStarted.getCount() > 0) {
                    firstWriteStarted.countDown();
                    releaseFirstWrite.await(5, TimeUnit.SECONDS);
                }
                super.store(policy);
                writes.add(policy);
                if (policy.unmanaged()) {
                    unmanagedWritten.countDown();
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new PolicyStoreException("interrupted", new IOException(ex));
            } finally {
                writesInFlight.decrementAndGet();
            }
        }
    }

    private static class RecordingObserver implements PolicyCacheObserver {
        final List<PolicyCache> updates = new ArrayList<>();
        final List<PolicyCache> goingAway = new ArrayList<>();

        @Override
        public void onCacheUpdate(PolicyCache cache) {
            updates.add(cache);
        }

        @Override
        public void onCacheGoingAway(PolicyCache cache) {
            goingAway.add(cache);
        }
    }

    private static class FailingStore implements PolicyCacheStore {
        @Override
        public Optional<CachedPolicy> load() {
            throw new PolicyStoreException("disk on fire", new IOException("io"));
        }

        @Override
        public void store(CachedPolicy policy) {
            throw new PolicyStoreException("disk on fire", new IOException("io"));
        }
    }
}
