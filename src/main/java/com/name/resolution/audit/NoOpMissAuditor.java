package com.name.resolution.audit;

/**
 * No-op implementation of {@link MissAuditor}. Used when no miss log is configured.
 */
public class NoOpMissAuditor implements MissAuditor {

    @Override
    public void record(String id, MissReason reason) {
        // no-op
    }
}
