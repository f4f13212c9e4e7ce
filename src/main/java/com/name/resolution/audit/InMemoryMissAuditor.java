package com.name.resolution.audit;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link MissAuditor}.
 * Thread-safe via CopyOnWriteArrayList.
 */
public class InMemoryMissAuditor implements MissAuditor {

    private final List<Miss> misses = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public InMemoryMissAuditor() {
        this(Clock.systemUTC());
    }

    public InMemoryMissAuditor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void record(String id, MissReason reason) {
        misses.add(new Miss(id, reason, clock.instant()));
    }

    public List<Miss> getMisses() {
        return Collections.unmodifiableList(new ArrayList<>(misses));
    }

    public List<Miss> getMisses(MissReason reason) {
        return misses.stream()
                .filter(m -> m.reason() == reason)
                .collect(Collectors.toList());
    }

    public int size() {
        return misses.size();
    }

    /**
     * One recorded miss.
     */
    public record Miss(String id, MissReason reason, Instant timestamp) {}
}
