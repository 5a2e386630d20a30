package com.herzen.audit.evaluation;

import com.herzen.audit.domain.DomainModels.BlockType;
import com.herzen.audit.domain.DomainModels.Course;

import java.math.BigDecimal;
import java.util.List;

public class EvaluationModels {
    public record NodeKey(String blockId, int nodeId) {}

    public enum NodeKind { COURSE_SET, GROUP, MAXIMUM, CONDITIONAL, BLOCK_REFERENCE }

    /**
     * Verdict for one rule node. {@code applied} lists every course applied anywhere in the
     * subtree; {@code counted} is false for ANY/N_OF children that did not count toward the group.
     */
    public record NodeVerdict(int nodeId,
                              String blockId,
                              NodeKind kind,
                              String description,
                              String label,
                              boolean satisfied,
                              boolean counted,
                              List<Course> applied,
                              BigDecimal appliedCredits,
                              String shortfall,
                              String note,
                              List<NodeVerdict> children) {
        public NodeVerdict {
            applied = List.copyOf(applied);
            children = List.copyOf(children);
        }

        public NodeVerdict withCounted(boolean value) {
            return new NodeVerdict(nodeId, blockId, kind, description, label, satisfied, value,
                    applied, appliedCredits, shortfall, note, children);
        }

        public String title() {
            return label != null ? label : description;
        }
    }

    public record BlockResult(String blockId,
                              String title,
                              BlockType type,
                              boolean satisfied,
                              NodeVerdict root,
                              List<Course> unconsumed) {}

    public record EvaluationOutcome(List<BlockResult> blocks, List<Course> unusedCourses) {}
}
