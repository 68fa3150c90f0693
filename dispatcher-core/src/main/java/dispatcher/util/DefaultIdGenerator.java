package dispatcher.util;

import com.github.f4b6a3.ulid.UlidCreator;
import dispatcher.spi.IdGenerator;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Default {@link IdGenerator}: an atomic counter for numeric ids and monotonic ULIDs for codes.
 *
 * <p>The counter starts at {@value #DEFAULT_SEED} unless a seed is supplied. A seeded
 * instance gives deterministic numeric ids in tests.
 */
public final class DefaultIdGenerator implements IdGenerator {
    public static final long DEFAULT_SEED = 10_000L;

    private static final DefaultIdGenerator SHARED = new DefaultIdGenerator();

    private final AtomicLong counter;

    public DefaultIdGenerator() {
        this(DEFAULT_SEED);
    }

    public DefaultIdGenerator(long seed) {
        if (seed < 0) {
            throw new IllegalArgumentException("seed must be >= 0");
        }
        this.counter = new AtomicLong(seed);
    }

    /**
     * Returns the process-wide instance used when no generator is configured.
     *
     * @return the shared generator
     */
    public static DefaultIdGenerator shared() {
        return SHARED;
    }

    @Override
    public long nextId() {
        return counter.getAndIncrement();
    }

    @Override
    public String nextCode() {
        return UlidCreator.getMonotonicUlid().toString();
    }
}
