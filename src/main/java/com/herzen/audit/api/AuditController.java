package com.herzen.audit.api;

import com.herzen.audit.domain.DomainModels.Transcript;
import com.herzen.audit.report.ReportModels.AuditReport;
import com.herzen.audit.repository.AuditRunJdbcRepository.AuditRunRow;
import com.herzen.audit.service.AuditService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/audits")
public class AuditController {
    private final AuditService auditService;

    public AuditController(AuditService auditService) {
        this.auditService = auditService;
    }

    @PostMapping
    public ResponseEntity<AuditReport> audit(@RequestBody AuditRequest request) {
        return ResponseEntity.ok(auditService.audit(request.transcript(), request.blockIds()));
    }

    @GetMapping("/history")
    public ResponseEntity<List<AuditRunRow>> history(@RequestParam String studentId) {
        return ResponseEntity.ok(auditService.history(studentId));
    }

    public record AuditRequest(Transcript transcript, List<String> blockIds) {}
}
