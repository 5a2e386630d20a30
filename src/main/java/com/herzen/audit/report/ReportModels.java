package com.herzen.audit.report;

import com.herzen.audit.domain.DomainModels.Course;
import com.herzen.audit.evaluation.EvaluationModels.BlockResult;

import java.math.BigDecimal;
import java.util.List;

public class ReportModels {
    public record AuditReport(String studentId,
                              boolean satisfied,
                              List<String> satisfiedBlocks,
                              List<BlockShortfalls> unsatisfiedBlocks,
                              List<Course> appliedCourses,
                              BigDecimal appliedCredits,
                              List<Course> unusedCourses,
                              List<BlockResult> blocks) {}

    public record BlockShortfalls(String blockId, String title, List<Shortfall> shortfalls) {}

    public record Shortfall(String blockId, int nodeId, String requirement, String text) {}
}
