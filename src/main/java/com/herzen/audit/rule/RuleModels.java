package com.herzen.audit.rule;

import com.herzen.audit.domain.DomainModels.BlockType;
import com.herzen.audit.domain.DomainModels.Course;
import com.herzen.audit.domain.DomainModels.Grade;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable rule tree produced by the block parser. Node ids follow parse order and are
 * unique within one block.
 */
public class RuleModels {
    public sealed interface Rule {
        int id();

        String label();
    }

    public record CourseSet(int id, String label, List<CoursePattern> patterns,
                            int minCount, BigDecimal minCredits, Grade gradeFloor) implements Rule {
        public CourseSet {
            patterns = List.copyOf(patterns);
            if (minCount < 0 || minCredits.signum() < 0) {
                throw new IllegalArgumentException("Minimums must not be negative");
            }
        }

        public boolean matches(Course course) {
            return patterns.stream().anyMatch(p -> p.matches(course));
        }

        public String describePatterns() {
            return CoursePattern.describe(patterns);
        }
    }

    public record Group(int id, String label, GroupMode mode, int required, List<Rule> children) implements Rule {
        public Group {
            children = List.copyOf(children);
        }
    }

    public record Maximum(int id, String label, Rule child, Ceiling ceiling) implements Rule {}

    public record Conditional(int id, String label, Condition condition, Rule thenRule, Rule elseRule) implements Rule {}

    public record BlockReference(int id, String label, String blockId, SharePolicy share) implements Rule {}

    public enum GroupMode { ALL, ANY, N_OF }

    public enum SharePolicy { EXCLUSIVE, SHARED }

    public enum Unit { COURSES, CREDITS }

    public record Ceiling(Unit unit, BigDecimal limit) {}

    /**
     * Compiled course matcher: subject is exact, a prefix ({@code HIST*}) or any ({@code *});
     * the number must fall into {@code [low, high]}.
     */
    public record CoursePattern(String subject, boolean subjectPrefix, int low, int high) {
        public static final int ANY_LOW = 0;
        public static final int ANY_HIGH = Integer.MAX_VALUE;

        public boolean matches(Course course) {
            boolean subjectOk = subjectPrefix
                    ? course.subject().startsWith(subject)
                    : course.subject().equals(subject);
            return subjectOk && course.number() >= low && course.number() <= high;
        }

        public boolean anyNumber() {
            return low == ANY_LOW && high == ANY_HIGH;
        }

        public String subjectText() {
            return subjectPrefix ? subject + "*" : subject;
        }

        public String numberText() {
            if (anyNumber()) return "*";
            if (low == high) return String.valueOf(low);
            return low + "-" + high;
        }

        public String describe() {
            if (subjectPrefix && subject.isEmpty() && anyNumber()) return "any course";
            if (anyNumber()) return subjectText();
            return subjectText() + " " + numberText();
        }

        static String describe(List<CoursePattern> patterns) {
            return patterns.stream().map(CoursePattern::describe).collect(Collectors.joining(", "));
        }
    }

    public sealed interface Condition {}

    public record And(Condition left, Condition right) implements Condition {}

    public record Or(Condition left, Condition right) implements Condition {}

    public record Not(Condition operand) implements Condition {}

    public record Comparison(Aggregate aggregate, Operator operator, BigDecimal value) implements Condition {}

    public record Aggregate(AggregateKind kind, List<CoursePattern> patterns) {
        public Aggregate {
            patterns = patterns == null ? List.of() : List.copyOf(patterns);
        }
    }

    public enum AggregateKind {
        TOTAL_CREDITS("total-credits"), GPA("gpa"), COUNT_OF("count-of"), CREDITS_OF("credits-of");

        private final String keyword;

        AggregateKind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    public enum Operator {
        GE(">="), GT(">"), LE("<="), LT("<"), EQ("=="), NE("!=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean test(BigDecimal actual, BigDecimal expected) {
            int cmp = actual.compareTo(expected);
            return switch (this) {
                case GE -> cmp >= 0;
                case GT -> cmp > 0;
                case LE -> cmp <= 0;
                case LT -> cmp < 0;
                case EQ -> cmp == 0;
                case NE -> cmp != 0;
            };
        }

        public static Operator fromSymbol(String symbol) {
            for (Operator c : values()) {
                if (c.symbol.equals(symbol)) return c;
            }
            throw new IllegalArgumentException("Unknown comparator: " + symbol);
        }
    }

    public record Block(String id, BlockType type, String title, Rule rule, int nodeCount) {}
}
