package com.herzen.audit.evaluation;

import com.herzen.audit.config.AuditProperties;
import com.herzen.audit.config.AuditProperties.ReleaseOrder;
import com.herzen.audit.domain.DomainModels.Course;
import com.herzen.audit.domain.DomainModels.CourseKey;
import com.herzen.audit.domain.DomainModels.Grade;
import com.herzen.audit.domain.DomainModels.Transcript;
import com.herzen.audit.evaluation.AllocationState.Allocation;
import com.herzen.audit.evaluation.EvaluationModels.*;
import com.herzen.audit.parser.RulePrinter;
import com.herzen.audit.rule.RuleModels.Block;
import com.herzen.audit.rule.RuleModels.BlockReference;
import com.herzen.audit.rule.RuleModels.Ceiling;
import com.herzen.audit.rule.RuleModels.Conditional;
import com.herzen.audit.rule.RuleModels.CourseSet;
import com.herzen.audit.rule.RuleModels.Group;
import com.herzen.audit.rule.RuleModels.GroupMode;
import com.herzen.audit.rule.RuleModels.Maximum;
import com.herzen.audit.rule.RuleModels.Rule;
import com.herzen.audit.rule.RuleModels.SharePolicy;
import com.herzen.audit.rule.RuleModels.Unit;
import com.herzen.audit.validation.LinkedCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Allocates transcript courses against linked rule trees.
 * <p>
 * Course sets take candidates earliest term first, then highest credit value, and stop as soon
 * as both minimums hold. ANY/N_OF groups evaluate every child and count the first satisfied
 * children in declared order; partial consumption of other children is kept unless
 * {@code audit.release-unselected-children} is set. This is a deterministic greedy policy, not an
 * optimal assignment.
 */
@Component
public class RuleEvaluator {
    private static final Logger log = LoggerFactory.getLogger(RuleEvaluator.class);

    private static final Comparator<Course> ALLOCATION_ORDER = Comparator.comparing(Course::term)
            .thenComparing(Course::credits, Comparator.reverseOrder());

    private final AuditProperties properties;
    private final RulePrinter printer;

    public RuleEvaluator(AuditProperties properties, RulePrinter printer) {
        this.properties = properties;
        this.printer = printer;
    }

    public EvaluationOutcome evaluate(LinkedCatalog catalog, Transcript transcript, List<String> blockIds) {
        Run run = new Run(catalog, transcript);
        Scope main = new Scope(new AllocationState(transcript));

        List<BlockResult> results = new ArrayList<>();
        for (String blockId : blockIds) {
            Block block = run.resolve(blockId);
            NodeVerdict root = run.evaluateBlock(block, main);
            results.add(new BlockResult(block.id(), block.title(), block.type(), root.satisfied(), root,
                    main.state.unconsumed()));
        }
        return new EvaluationOutcome(results, main.state.unconsumed());
    }

    public BlockResult evaluate(LinkedCatalog catalog, Transcript transcript, String blockId) {
        return evaluate(catalog, transcript, List.of(blockId)).blocks().get(0);
    }

    private static final class Scope {
        private final AllocationState state;
        private final Set<String> evaluatedBlocks = new HashSet<>();

        private Scope(AllocationState state) {
            this.state = state;
        }
    }

    private final class Run {
        private final LinkedCatalog catalog;
        private final Transcript transcript;
        private final TranscriptAggregates aggregates;
        private final long deadline;

        private Run(LinkedCatalog catalog, Transcript transcript) {
            this.catalog = catalog;
            this.transcript = transcript;
            this.aggregates = new TranscriptAggregates(transcript);
            this.deadline = properties.evaluationDeadlineMs() > 0
                    ? System.nanoTime() + properties.evaluationDeadlineMs() * 1_000_000L
                    : 0L;
        }

        Block resolve(String blockId) {
            OptionalInt slot = catalog.slotOf(blockId);
            if (slot.isEmpty()) {
                throw new EvaluationException("UNRESOLVED_REFERENCE", "Block is not in the linked catalog: " + blockId);
            }
            return catalog.block(slot.getAsInt());
        }

        // always against the scope's current pool; a repeat sees only what earlier passes left
        NodeVerdict evaluateBlock(Block block, Scope scope) {
            scope.evaluatedBlocks.add(block.id());
            return evaluate(block.id(), block.rule(), scope);
        }

        NodeVerdict evaluate(String blockId, Rule rule, Scope scope) {
            if (deadline != 0L && System.nanoTime() - deadline > 0) {
                throw new EvaluationException("DEADLINE_EXCEEDED",
                        "Audit exceeded " + properties.evaluationDeadlineMs() + " ms in block " + blockId);
            }
            if (rule instanceof CourseSet set) return courseSet(blockId, set, scope);
            if (rule instanceof Group group) return group(blockId, group, scope);
            if (rule instanceof Maximum max) return maximum(blockId, max, scope);
            if (rule instanceof Conditional conditional) return conditional(blockId, conditional, scope);
            return reference(blockId, (BlockReference) rule, scope);
        }

        private NodeVerdict courseSet(String blockId, CourseSet set, Scope scope) {
            NodeKey key = new NodeKey(blockId, set.id());
            List<Course> candidates = new ArrayList<>(scope.state.available().stream()
                    .filter(c -> allocatable(c, set))
                    .toList());
            candidates.sort(ALLOCATION_ORDER);

            List<Course> applied = new ArrayList<>();
            BigDecimal credits = BigDecimal.ZERO;
            for (Course course : candidates) {
                if (applied.size() >= set.minCount() && credits.compareTo(set.minCredits()) >= 0) break;
                scope.state.consume(course, key);
                applied.add(course);
                credits = credits.add(course.credits());
            }
            return courseSetVerdict(blockId, set, applied, true);
        }

        private NodeVerdict group(String blockId, Group group, Scope scope) {
            List<NodeVerdict> children = new ArrayList<>();
            List<Long> marks = new ArrayList<>();
            for (Rule child : group.children()) {
                marks.add(scope.state.mark());
                children.add(evaluate(blockId, child, scope));
            }
            marks.add(scope.state.mark());
            children = selectCounted(group, children);

            if (properties.releaseUnselectedChildren() && group.mode() != GroupMode.ALL) {
                for (int i = 0; i < children.size(); i++) {
                    if (children.get(i).counted()) continue;
                    List<Allocation> held = scope.state.heldBetween(marks.get(i), marks.get(i + 1));
                    if (held.isEmpty()) continue;
                    Set<CourseKey> released = new HashSet<>();
                    for (Allocation allocation : held) {
                        scope.state.release(allocation.course());
                        released.add(allocation.course().key());
                    }
                    log.debug("Released {} course(s) held by uncounted child {} of {}/{}",
                            released.size(), group.children().get(i).id(), blockId, group.id());
                    children.set(i, recheck(blockId, group.children().get(i), children.get(i), released, scope)
                            .withCounted(false));
                }
            }
            return groupVerdict(blockId, group, children, true);
        }

        private NodeVerdict maximum(String blockId, Maximum max, Scope scope) {
            long mark = scope.state.mark();
            NodeVerdict child = evaluate(blockId, max.child(), scope);

            List<Allocation> held = new ArrayList<>(scope.state.heldSince(mark));
            List<Course> released = new ArrayList<>();
            while (exceeds(max.ceiling(), held)) {
                Allocation victim = properties.maximumReleaseOrder() == ReleaseOrder.MOST_RECENT_FIRST
                        ? held.remove(held.size() - 1)
                        : held.remove(0);
                scope.state.release(victim.course());
                released.add(victim.course());
            }

            String note = null;
            if (!released.isEmpty()) {
                Set<CourseKey> keys = released.stream().map(Course::key).collect(Collectors.toSet());
                child = recheck(blockId, max.child(), child, keys, scope);
                note = "capped at " + amount(max.ceiling()) + "; released "
                        + released.stream().map(Course::toString).collect(Collectors.joining(", "));
                log.debug("Maximum {}/{} released {}", blockId, max.id(), released);
            }
            return maximumVerdict(blockId, max, child, note);
        }

        private NodeVerdict conditional(String blockId, Conditional conditional, Scope scope) {
            boolean holds = aggregates.test(conditional.condition());
            Rule branch = holds ? conditional.thenRule() : conditional.elseRule();
            NodeVerdict child = branch == null ? null : evaluate(blockId, branch, scope);
            return conditionalVerdict(blockId, conditional, holds, child);
        }

        private NodeVerdict reference(String blockId, BlockReference ref, Scope scope) {
            Block target = resolve(ref.blockId());
            NodeVerdict child;
            String note = null;
            if (ref.share() == SharePolicy.SHARED) {
                child = evaluateBlock(target, new Scope(new AllocationState(transcript)));
                note = "shared: applied courses remain available";
            } else {
                if (scope.evaluatedBlocks.contains(target.id())) {
                    note = "already evaluated in this run; its courses are spent";
                }
                child = evaluateBlock(target, scope);
            }
            return referenceVerdict(blockId, ref, child, note);
        }

        /** Rebuilds a verdict after some of the courses it applied were released. */
        private NodeVerdict recheck(String blockId, Rule rule, NodeVerdict verdict, Set<CourseKey> released, Scope scope) {
            if (rule instanceof CourseSet set) {
                List<Course> kept = verdict.applied().stream().filter(c -> !released.contains(c.key())).toList();
                return courseSetVerdict(blockId, set, kept, verdict.counted());
            }
            if (rule instanceof Group group) {
                List<NodeVerdict> children = new ArrayList<>();
                for (int i = 0; i < group.children().size(); i++) {
                    children.add(recheck(blockId, group.children().get(i), verdict.children().get(i), released, scope));
                }
                return groupVerdict(blockId, group, selectCounted(group, children), verdict.counted());
            }
            if (rule instanceof Maximum max) {
                NodeVerdict child = recheck(blockId, max.child(), verdict.children().get(0), released, scope);
                return maximumVerdict(blockId, max, child, verdict.note()).withCounted(verdict.counted());
            }
            if (rule instanceof Conditional conditional) {
                if (verdict.children().isEmpty()) return verdict;
                NodeVerdict previous = verdict.children().get(0);
                boolean holds = previous.nodeId() == conditional.thenRule().id();
                Rule branch = holds ? conditional.thenRule() : conditional.elseRule();
                NodeVerdict child = recheck(blockId, branch, previous, released, scope);
                return conditionalVerdict(blockId, conditional, holds, child).withCounted(verdict.counted());
            }
            BlockReference ref = (BlockReference) rule;
            if (ref.share() == SharePolicy.SHARED) return verdict;
            Block target = resolve(ref.blockId());
            NodeVerdict child = recheck(target.id(), target.rule(), verdict.children().get(0), released, scope);
            return referenceVerdict(blockId, ref, child, verdict.note()).withCounted(verdict.counted());
        }
    }

    private boolean allocatable(Course course, CourseSet set) {
        Grade grade = course.grade();
        boolean usable = grade.earnsCredit() || (grade == Grade.IN_PROGRESS && properties.countInProgress());
        return usable && set.matches(course) && grade.meets(set.gradeFloor());
    }

    private boolean exceeds(Ceiling ceiling, List<Allocation> held) {
        if (ceiling.unit() == Unit.COURSES) {
            return BigDecimal.valueOf(held.size()).compareTo(ceiling.limit()) > 0;
        }
        BigDecimal credits = held.stream().map(a -> a.course().credits()).reduce(BigDecimal.ZERO, BigDecimal::add);
        return credits.compareTo(ceiling.limit()) > 0;
    }

    private List<NodeVerdict> selectCounted(Group group, List<NodeVerdict> children) {
        List<NodeVerdict> out = new ArrayList<>();
        int taken = 0;
        for (NodeVerdict child : children) {
            boolean counted;
            if (group.mode() == GroupMode.ALL) {
                counted = true;
            } else {
                counted = child.satisfied() && taken < group.required();
                if (counted) taken++;
            }
            out.add(child.withCounted(counted));
        }
        return out;
    }

    private NodeVerdict courseSetVerdict(String blockId, CourseSet set, List<Course> applied, boolean counted) {
        BigDecimal credits = credits(applied);
        boolean satisfied = applied.size() >= set.minCount() && credits.compareTo(set.minCredits()) >= 0;

        String shortfall = null;
        if (!satisfied) {
            int missingCount = Math.max(0, set.minCount() - applied.size());
            BigDecimal missingCredits = set.minCredits().subtract(credits).max(BigDecimal.ZERO);
            String more = applied.isEmpty() ? "" : "more ";
            List<String> parts = new ArrayList<>();
            if (missingCount > 0) {
                parts.add(missingCount + " " + more + (missingCount == 1 ? "course" : "courses"));
            }
            if (missingCredits.signum() > 0) {
                parts.add(plain(missingCredits) + " " + more + (missingCredits.compareTo(BigDecimal.ONE) == 0 ? "credit" : "credits"));
            }
            shortfall = "needs " + String.join(" and ", parts) + " from " + set.describePatterns() + floorText(set);
        }

        String description = requirementText(set.minCount(), set.minCredits()) + " from " + set.describePatterns() + floorText(set);
        return new NodeVerdict(set.id(), blockId, NodeKind.COURSE_SET, description, set.label(), satisfied, counted,
                applied, credits, shortfall, null, List.of());
    }

    private NodeVerdict groupVerdict(String blockId, Group group, List<NodeVerdict> children, boolean counted) {
        long satisfiedCount = children.stream().filter(c -> c.counted() && c.satisfied()).count();
        boolean satisfied = satisfiedCount >= group.required();
        List<Course> applied = children.stream().flatMap(c -> c.applied().stream()).toList();

        String shortfall = null;
        if (!satisfied) {
            long missing = group.required() - satisfiedCount;
            shortfall = "needs " + missing + (satisfiedCount > 0 ? " more" : "") + " of "
                    + children.size() + " " + requirements(children.size());
        }

        String mode = switch (group.mode()) {
            case ALL -> "all of ";
            case ANY -> "any of ";
            case N_OF -> group.required() + " of ";
        };
        String description = mode + children.size() + " " + requirements(children.size());
        return new NodeVerdict(group.id(), blockId, NodeKind.GROUP, description, group.label(), satisfied, counted,
                applied, credits(applied), shortfall, null, children);
    }

    private NodeVerdict maximumVerdict(String blockId, Maximum max, NodeVerdict child, String note) {
        return new NodeVerdict(max.id(), blockId, NodeKind.MAXIMUM, "at most " + amount(max.ceiling()), max.label(),
                child.satisfied(), true, child.applied(), child.appliedCredits(),
                child.satisfied() ? null : child.shortfall(), note, List.of(child));
    }

    private NodeVerdict conditionalVerdict(String blockId, Conditional conditional, boolean holds, NodeVerdict child) {
        String description = "if " + printer.describe(conditional.condition());
        if (child == null) {
            return new NodeVerdict(conditional.id(), blockId, NodeKind.CONDITIONAL, description, conditional.label(),
                    true, true, List.of(), BigDecimal.ZERO, null, "condition not met; no requirement", List.of());
        }
        return new NodeVerdict(conditional.id(), blockId, NodeKind.CONDITIONAL, description, conditional.label(),
                child.satisfied(), true, child.applied(), child.appliedCredits(),
                child.satisfied() ? null : child.shortfall(),
                holds ? "condition met" : "condition not met", List.of(child));
    }

    private NodeVerdict referenceVerdict(String blockId, BlockReference ref, NodeVerdict child, String note) {
        String description = "block " + ref.blockId() + (ref.share() == SharePolicy.SHARED ? " (shared)" : "");
        return new NodeVerdict(ref.id(), blockId, NodeKind.BLOCK_REFERENCE, description, ref.label(),
                child.satisfied(), true, child.applied(), child.appliedCredits(),
                child.satisfied() ? null : "block " + ref.blockId() + " is not satisfied", note, List.of(child));
    }

    private static String requirementText(int count, BigDecimal credits) {
        List<String> parts = new ArrayList<>();
        if (count > 0 || credits.signum() == 0) {
            parts.add(count + (count == 1 ? " course" : " courses"));
        }
        if (credits.signum() > 0) {
            parts.add(plain(credits) + (credits.compareTo(BigDecimal.ONE) == 0 ? " credit" : " credits"));
        }
        return String.join(" and ", parts);
    }

    private static String floorText(CourseSet set) {
        return set.gradeFloor() == null ? "" : " with grade " + set.gradeFloor() + " or better";
    }

    private static String requirements(int n) {
        return n == 1 ? "requirement" : "requirements";
    }

    private static String amount(Ceiling ceiling) {
        return plain(ceiling.limit()) + (ceiling.unit() == Unit.COURSES ? " courses" : " credits");
    }

    private static BigDecimal credits(List<Course> courses) {
        return courses.stream().map(Course::credits).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
