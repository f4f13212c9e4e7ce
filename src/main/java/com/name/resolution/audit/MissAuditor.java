package com.name.resolution.audit;

/**
 * Side-channel recorder of definitive resolution misses, for offline analysis.
 * Implementations must never throw or block the resolving caller for long;
 * a failing audit sink must not affect resolution.
 */
public interface MissAuditor extends AutoCloseable {

    /**
     * Records a miss for an identifier.
     */
    void record(String id, MissReason reason);

    /**
     * Releases the sink. The default does nothing.
     */
    @Override
    default void close() {
    }
}
