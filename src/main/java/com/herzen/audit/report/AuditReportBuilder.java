package com.herzen.audit.report;

import com.herzen.audit.domain.DomainModels.Course;
import com.herzen.audit.domain.DomainModels.Transcript;
import com.herzen.audit.evaluation.EvaluationModels.*;
import com.herzen.audit.report.ReportModels.*;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.*;

@Component
public class AuditReportBuilder {
    private static final Set<NodeKind> REPORTED_KINDS = EnumSet.of(NodeKind.COURSE_SET, NodeKind.GROUP);

    public AuditReport build(Transcript transcript, EvaluationOutcome outcome) {
        List<String> satisfied = new ArrayList<>();
        List<BlockShortfalls> unsatisfied = new ArrayList<>();
        for (BlockResult block : outcome.blocks()) {
            if (block.satisfied()) {
                satisfied.add(block.blockId());
            } else {
                List<Shortfall> shortfalls = new ArrayList<>();
                collect(block.root(), shortfalls);
                unsatisfied.add(new BlockShortfalls(block.blockId(), block.title(), shortfalls));
            }
        }

        Set<Course> unused = new HashSet<>(outcome.unusedCourses());
        List<Course> applied = transcript.courses().stream().filter(c -> !unused.contains(c)).toList();
        BigDecimal appliedCredits = applied.stream().map(Course::credits).reduce(BigDecimal.ZERO, BigDecimal::add);

        return new AuditReport(transcript.studentId(), unsatisfied.isEmpty(), satisfied, unsatisfied,
                applied, appliedCredits, outcome.unusedCourses(), outcome.blocks());
    }

    private void collect(NodeVerdict node, List<Shortfall> out) {
        if (node.satisfied()) return;
        if (REPORTED_KINDS.contains(node.kind()) && node.shortfall() != null) {
            out.add(new Shortfall(node.blockId(), node.nodeId(), node.title(), node.shortfall()));
        }
        node.children().forEach(child -> collect(child, out));
    }
}
