package com.herzen.audit.evaluation;

import com.herzen.audit.domain.DomainModels.Course;
import com.herzen.audit.domain.DomainModels.CourseKey;
import com.herzen.audit.domain.DomainModels.Transcript;
import com.herzen.audit.evaluation.EvaluationModels.NodeKey;

import java.util.*;

/**
 * Mutable per-run bookkeeping of which rule node consumed which course. One instance
 * belongs to exactly one audit run and is discarded afterwards.
 */
public final class AllocationState {
    private final Transcript transcript;
    private final Map<CourseKey, Allocation> consumed = new HashMap<>();
    private long sequence;

    public AllocationState(Transcript transcript) {
        this.transcript = transcript;
    }

    public boolean isAvailable(Course course) {
        return !consumed.containsKey(course.key());
    }

    public List<Course> available() {
        return transcript.courses().stream().filter(this::isAvailable).toList();
    }

    public void consume(Course course, NodeKey node) {
        Allocation previous = consumed.putIfAbsent(course.key(), new Allocation(course, node, sequence++));
        if (previous != null) {
            throw new IllegalStateException(course + " already consumed by " + previous.node());
        }
    }

    public void release(Course course) {
        consumed.remove(course.key());
    }

    /** Position to pass to {@link #heldSince(long)} or {@link #heldBetween(long, long)}. */
    public long mark() {
        return sequence;
    }

    public List<Allocation> heldSince(long mark) {
        return heldBetween(mark, Long.MAX_VALUE);
    }

    public List<Allocation> heldBetween(long from, long to) {
        return consumed.values().stream()
                .filter(a -> a.sequence() >= from && a.sequence() < to)
                .sorted(Comparator.comparingLong(Allocation::sequence))
                .toList();
    }

    public List<Course> unconsumed() {
        return available();
    }

    public record Allocation(Course course, NodeKey node, long sequence) {}
}
