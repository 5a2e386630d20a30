package com.herzen.audit.evaluation;

import com.herzen.audit.domain.DomainModels.Course;
import com.herzen.audit.domain.DomainModels.Transcript;
import com.herzen.audit.rule.RuleModels.*;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Transcript-wide figures used by conditional rules. Computed over the full transcript at the
 * start of a run and never affected by allocation, so branch choice does not depend on the
 * order in which sibling rules were evaluated.
 */
public final class TranscriptAggregates {
    private final List<Course> completed;
    private final BigDecimal totalCredits;
    private final BigDecimal gpa;
    private final Map<Aggregate, BigDecimal> cache = new HashMap<>();

    public TranscriptAggregates(Transcript transcript) {
        this.completed = transcript.courses().stream().filter(c -> c.grade().earnsCredit()).toList();
        this.totalCredits = sum(completed);

        BigDecimal points = BigDecimal.ZERO;
        BigDecimal gradedCredits = BigDecimal.ZERO;
        for (Course c : transcript.courses()) {
            if (c.grade().isLetter()) {
                points = points.add(c.credits().multiply(BigDecimal.valueOf(c.grade().points())));
                gradedCredits = gradedCredits.add(c.credits());
            }
        }
        this.gpa = gradedCredits.signum() == 0 ? BigDecimal.ZERO : points.divide(gradedCredits, 3, RoundingMode.HALF_UP);
    }

    public BigDecimal totalCredits() {
        return totalCredits;
    }

    public BigDecimal gpa() {
        return gpa;
    }

    public BigDecimal value(Aggregate aggregate) {
        return switch (aggregate.kind()) {
            case TOTAL_CREDITS -> totalCredits;
            case GPA -> gpa;
            case COUNT_OF -> cache.computeIfAbsent(aggregate,
                    a -> BigDecimal.valueOf(matching(a.patterns()).size()));
            case CREDITS_OF -> cache.computeIfAbsent(aggregate, a -> sum(matching(a.patterns())));
        };
    }

    public boolean test(Condition condition) {
        if (condition instanceof And a) return test(a.left()) && test(a.right());
        if (condition instanceof Or o) return test(o.left()) || test(o.right());
        if (condition instanceof Not n) return !test(n.operand());
        Comparison c = (Comparison) condition;
        return c.operator().test(value(c.aggregate()), c.value());
    }

    private List<Course> matching(List<CoursePattern> patterns) {
        return completed.stream().filter(c -> patterns.stream().anyMatch(p -> p.matches(c))).toList();
    }

    private static BigDecimal sum(List<Course> courses) {
        return courses.stream().map(Course::credits).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
