package com.policysync.cache;

import com.policysync.contract.DecodedPolicy;
import com.policysync.contract.PolicyDecodeException;
import com.policysync.contract.PolicyDecoder;
import com.policysync.contract.PolicyFetchResponse;
import com.policysync.contract.PolicyMap;
import com.policysync.contract.PublicKeyVersion;
import com.policysync.notifier.ErrorDetails;
import com.policysync.notifier.NotifierSource;
import com.policysync.notifier.PolicyNotifier;
import com.policysync.notifier.SubsystemState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decoded policy of one source plus its freshness and readiness metadata.
 *
 * The cache becomes ready once its backing store has been read and either a
 * policy was applied, the source was found unmanaged, a fetch attempt finished,
 * or the cache was configured not to wait for a fetch. Readiness is latched:
 * nothing but a new cache makes it false again. Observers hear about changes
 * only while the cache is ready; earlier changes are not queued.
 *
 * All methods must be called on the policy sequence. {@link #load()} reads the
 * store on the I/O executor and resumes on the sequence. Writes also run on the
 * I/O executor, one at a time and in the order they were made; a write that a
 * newer one has superseded before it started is skipped.
 */
public class PolicyCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PolicyCache.class);

    private final String name;
    private final PolicyDecoder decoder;
    private final PolicyCacheStore store;
    private final PolicyNotifier notifier;
    private final Clock clock;
    private final Executor ioExecutor;
    private final Executor sequence;
    private final CopyOnWriteArrayList<PolicyCacheObserver> observers = new CopyOnWriteArrayList<>();
    private final AtomicLong latestWrite = new AtomicLong();
    private CompletableFuture<Void> pendingWrites = CompletableFuture.completedFuture(null);

    private PolicyMap policies = PolicyMap.empty();
    private Instant lastPolicyRefreshTime;
    private PublicKeyVersion publicKeyVersion = PublicKeyVersion.invalid();
    private boolean unmanaged;
    private boolean machineIdMissing;

    private boolean diskCacheReady;
    private boolean fetchReady;
    private boolean ready;
    private boolean loadRequested;
    private boolean closed;
    private long rejectedResponseCount;

    /**
     * @param waitForPolicyFetch when true, the cache is not ready until a fetch
     *                           attempt has an outcome, even if stored policy exists
     */
    public PolicyCache(String name,
                       PolicyDecoder decoder,
                       PolicyCacheStore store,
                       PolicyNotifier notifier,
                       Clock clock,
                       boolean waitForPolicyFetch,
                       Executor ioExecutor,
                       Executor sequence) {
        this.name = name;
        this.decoder = decoder;
        this.store = store;
        this.notifier = notifier;
        this.clock = clock;
        this.fetchReady = !waitForPolicyFetch;
        this.ioExecutor = ioExecutor;
        this.sequence = sequence;
    }

    /**
     * Reads the backing store. Always ends with the disk part of readiness
     * satisfied, also when the store cannot be read.
     */
    public void load() {
        if (loadRequested) {
            return;
        }
        loadRequested = true;
        ioExecutor.execute(() -> {
            Optional<CachedPolicy> stored;
            try {
                stored = store.load();
            } catch (PolicyStoreException ex) {
                log.warn("Policy cache {} could not be loaded, starting empty: {}", name, ex.getMessage());
                stored = Optional.empty();
            }
            Optional<CachedPolicy> result = stored;
            sequence.execute(() -> onDiskCacheLoaded(result));
        });
    }

    /**
     * Decodes and applies a fetched policy. Returns false and leaves the current
     * policy untouched if decoding fails or the policy claims to be from the future.
     */
    public boolean setPolicy(PolicyFetchResponse response) {
        Optional<DecodedPolicy> decoded = decodeAndValidate(response, true);
        if (decoded.isEmpty()) {
            return false;
        }
        apply(decoded.get());
        lastPolicyRefreshTime = clock.instant();
        persist(CachedPolicy.managed(response, lastPolicyRefreshTime.toEpochMilli()));
        notifier.inform(SubsystemState.SUCCESS, ErrorDetails.NO_DETAILS, NotifierSource.POLICY_CACHE);
        fetchReady = true;
        updateReadiness();
        notifyObservers();
        return true;
    }

    /** Records that the source is not managed: policy is dropped, the key version forgotten. */
    public void setUnmanaged(Instant timestamp) {
        markUnmanaged(timestamp);
        persist(CachedPolicy.unmanaged(timestamp.toEpochMilli()));
        fetchReady = true;
        updateReadiness();
        notifyObservers();
    }

    /**
     * Signals that a fetch attempt has a definitive outcome, successful or not.
     * Releases consumers waiting on readiness without changing any policy.
     */
    public void setFetchingDone() {
        if (!fetchReady) {
            log.debug("Policy cache {} saw its first fetch outcome", name);
        }
        fetchReady = true;
        updateReadiness();
        notifyObservers();
    }

    /** Forgets management state. The policy values themselves are kept. */
    public void reset() {
        lastPolicyRefreshTime = null;
        unmanaged = false;
        publicKeyVersion = PublicKeyVersion.invalid();
        notifier.inform(SubsystemState.UNENROLLED, ErrorDetails.NO_DETAILS, NotifierSource.POLICY_CACHE);
    }

    public PolicyMap policies() {
        return policies;
    }

    public boolean isReady() {
        return ready;
    }

    public boolean isUnmanaged() {
        return unmanaged;
    }

    public boolean machineIdMissing() {
        return machineIdMissing;
    }

    public Optional<Instant> lastPolicyRefreshTime() {
        return Optional.ofNullable(lastPolicyRefreshTime);
    }

    /** The last key version reported by the server, if one is known. */
    public Optional<Integer> getPublicKeyVersion() {
        return publicKeyVersion.valid() ? Optional.of(publicKeyVersion.version()) : Optional.empty();
    }

    public long rejectedResponseCount() {
        return rejectedResponseCount;
    }

    public String name() {
        return name;
    }

    public void addObserver(PolicyCacheObserver observer) {
        observers.addIfAbsent(observer);
    }

    public void removeObserver(PolicyCacheObserver observer) {
        observers.remove(observer);
    }

    /** Tells every observer the cache is going away, then detaches them. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (PolicyCacheObserver observer : observers) {
            try {
                observer.onCacheGoingAway(this);
            } catch (RuntimeException ex) {
                log.warn("Policy cache observer failed while cache={} went away: {}", name, ex.getMessage());
            }
        }
        observers.clear();
    }

    private void onDiskCacheLoaded(Optional<CachedPolicy> stored) {
        if (closed) {
            return;
        }
        // A fetch that completed while the store was read is newer than anything on disk.
        if (stored.isPresent() && lastPolicyRefreshTime == null) {
            CachedPolicy cached = stored.get();
            Instant timestamp = Instant.ofEpochMilli(cached.timestamp());
            if (cached.unmanaged()) {
                markUnmanaged(timestamp);
            } else {
                decodeAndValidate(cached.response(), false).ifPresent(decoded -> {
                    apply(decoded);
                    lastPolicyRefreshTime = timestamp;
                });
            }
        }
        diskCacheReady = true;
        log.debug("Policy cache {} finished loading from storage", name);
        updateReadiness();
        notifyObservers();
    }

    private Optional<DecodedPolicy> decodeAndValidate(PolicyFetchResponse response,
                                                      boolean checkTimestampValidity) {
        DecodedPolicy decoded;
        try {
            decoded = decoder.decode(response);
        } catch (PolicyDecodeException ex) {
            rejectedResponseCount++;
            log.warn("Policy cache {} rejected response, decoding failed: {}", name, ex.getMessage());
            return Optional.empty();
        }
        if (checkTimestampValidity && decoded.timestamp().isAfter(clock.instant())) {
            rejectedResponseCount++;
            log.warn("Policy cache {} rejected response, timestamp {} is in the future", name, decoded.timestamp());
            return Optional.empty();
        }
        return Optional.of(decoded);
    }

    private void apply(DecodedPolicy decoded) {
        unmanaged = false;
        publicKeyVersion = decoded.publicKeyVersion();
        machineIdMissing = decoded.machineIdMissing();
        if (policies.equals(decoded.policies())) {
            log.debug("Policy cache {} received unchanged policy", name);
        } else {
            log.info("Policy cache {} applied {} policies", name, decoded.policies().size());
        }
        policies = decoded.policies();
    }

    private void markUnmanaged(Instant timestamp) {
        unmanaged = true;
        publicKeyVersion = PublicKeyVersion.invalid();
        policies = PolicyMap.empty();
        lastPolicyRefreshTime = timestamp;
        log.info("Policy cache {} is unmanaged", name);
    }

    private void persist(CachedPolicy cached) {
        long writeId = latestWrite.incrementAndGet();
        pendingWrites = pendingWrites
            .thenRunAsync(() -> write(writeId, cached), ioExecutor)
            .exceptionally(ex -> {
                log.warn("Policy cache {} write failed: {}", name, ex.getMessage());
                return null;
            });
    }

    private void write(long writeId, CachedPolicy cached) {
        if (writeId != latestWrite.get()) {
            log.debug("Policy cache {} skipped a superseded write", name);
            return;
        }
        try {
            store.store(cached);
        } catch (PolicyStoreException ex) {
            log.warn("Policy cache {} could not be persisted: {}", name, ex.getMessage());
        }
    }

    private void updateReadiness() {
        if (!ready && diskCacheReady && fetchReady) {
            ready = true;
            log.info("Policy cache {} is ready", name);
        }
    }

    private void notifyObservers() {
        if (!ready) {
            return;
        }
        for (PolicyCacheObserver observer : observers) {
            try {
                observer.onCacheUpdate(this);
            } catch (RuntimeException ex) {
                log.warn("Policy cache observer failed for cache={}: {}", name, ex.getMessage());
            }
        }
    }
}
