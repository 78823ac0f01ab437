package com.ryuqq.queuebridge.adapter.inmemory.dedup;

import com.ryuqq.queuebridge.core.spi.DedupStorage;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link DedupStorage} for testing and reference purposes.
 *
 * <p>Keys are recorded on first sight with an expiry deadline. A key seen again
 * before its deadline is reported as existing; after the deadline it is recorded anew.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>{@link ConcurrentHashMap#compute} makes check-and-record atomic per key</li>
 *   <li>Concurrent requests with the same key: exactly one sees {@code false}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * DedupStorage storage = new InMemoryDedupStorage();
 *
 * storage.exists("queuebridge:emails:welcome-42"); // false, recorded
 * storage.exists("queuebridge:emails:welcome-42"); // true
 * </pre>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public class InMemoryDedupStorage implements DedupStorage {

    /**
     * Default key lifetime: 24 hours.
     */
    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    /**
     * Key → expiry epoch millis.
     */
    private final ConcurrentHashMap<String, Long> store;
    private final Duration ttl;
    private final Clock clock;

    /**
     * Creates a new InMemoryDedupStorage with the default 24h TTL.
     */
    public InMemoryDedupStorage() {
        this(DEFAULT_TTL, Clock.systemUTC());
    }

    /**
     * Creates a new InMemoryDedupStorage.
     *
     * @param ttl key lifetime
     * @param clock time source for expiry
     * @throws IllegalArgumentException if ttl is not positive or clock is null
     */
    public InMemoryDedupStorage(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = new ConcurrentHashMap<>();
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Uses {@link ConcurrentHashMap#compute} for atomic check-and-record</li>
     *   <li>An expired entry is overwritten and reported as absent</li>
     * </ul>
     */
    @Override
    public boolean exists(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key cannot be null or empty");
        }

        long now = clock.millis();
        boolean[] seen = new boolean[1];
        store.compute(key, (k, expiresAt) -> {
            if (expiresAt != null && expiresAt > now) {
                seen[0] = true;
                return expiresAt;
            }
            return now + ttl.toMillis();
        });
        return seen[0];
    }

    /**
     * Clears all keys. Used for test cleanup.
     */
    public void clear() {
        store.clear();
    }

    /**
     * Returns the number of recorded keys, expired ones included. Used for test assertions.
     *
     * @return key count
     */
    public int size() {
        return store.size();
    }

    public Duration getTtl() {
        return ttl;
    }
}
