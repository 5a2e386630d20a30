package com.herzen.audit.service;

import com.herzen.audit.config.AuditProperties;
import com.herzen.audit.domain.DomainModels.Transcript;
import com.herzen.audit.evaluation.EvaluationModels.BlockResult;
import com.herzen.audit.evaluation.EvaluationModels.EvaluationOutcome;
import com.herzen.audit.evaluation.RuleEvaluator;
import com.herzen.audit.report.AuditReportBuilder;
import com.herzen.audit.report.ReportModels.AuditReport;
import com.herzen.audit.report.ReportModels.BlockShortfalls;
import com.herzen.audit.repository.AuditRunJdbcRepository;
import com.herzen.audit.repository.AuditRunJdbcRepository.AuditRunRow;
import com.herzen.audit.validation.LinkedCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

@Service
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final BlockCatalogService catalogService;
    private final RuleEvaluator evaluator;
    private final AuditReportBuilder reportBuilder;
    private final AuditRunJdbcRepository repository;
    private final AuditProperties properties;

    public AuditService(BlockCatalogService catalogService,
                        RuleEvaluator evaluator,
                        AuditReportBuilder reportBuilder,
                        AuditRunJdbcRepository repository,
                        AuditProperties properties) {
        this.catalogService = catalogService;
        this.evaluator = evaluator;
        this.reportBuilder = reportBuilder;
        this.repository = repository;
        this.properties = properties;
    }

    public AuditReport audit(Transcript transcript, List<String> blockIds) {
        if (transcript == null || transcript.studentId() == null || transcript.studentId().isBlank()) {
            throw new IllegalArgumentException("Transcript with a student id is required");
        }
        if (blockIds == null || blockIds.isEmpty()) {
            throw new IllegalArgumentException("At least one block id is required");
        }

        LinkedCatalog catalog = catalogService.catalog();
        blockIds.stream().filter(id -> !catalog.contains(id)).findFirst().ifPresent(id -> {
            throw new UnknownBlockException(id);
        });

        EvaluationOutcome outcome = evaluator.evaluate(catalog, transcript, blockIds);
        AuditReport report = reportBuilder.build(transcript, outcome);

        if (properties.recordHistory()) {
            repository.saveRuns(toRows(transcript.studentId(), report));
        }
        log.info("Audit for student {} over {}: {} satisfied, {} unsatisfied, {} unused course(s)",
                transcript.studentId(), blockIds, report.satisfiedBlocks().size(),
                report.unsatisfiedBlocks().size(), report.unusedCourses().size());
        return report;
    }

    public List<AuditRunRow> history(String studentId) {
        return repository.loadRuns(studentId);
    }

    private List<AuditRunRow> toRows(String studentId, AuditReport report) {
        String runId = UUID.randomUUID().toString();
        Instant ts = Instant.now();
        Map<String, Integer> shortfallCounts = report.unsatisfiedBlocks().stream()
                .collect(Collectors.toMap(BlockShortfalls::blockId, b -> b.shortfalls().size(), (a, b) -> a));

        List<AuditRunRow> rows = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (BlockResult block : report.blocks()) {
            if (!seen.add(block.blockId())) continue;
            rows.add(new AuditRunRow(runId, studentId, block.blockId(), block.satisfied(),
                    block.root().appliedCredits(), shortfallCounts.getOrDefault(block.blockId(), 0), ts));
        }
        return rows;
    }
}
