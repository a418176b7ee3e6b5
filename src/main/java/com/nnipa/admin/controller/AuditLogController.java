package com.nnipa.admin.controller;

import com.nnipa.admin.dto.response.ApiResponse;
import com.nnipa.admin.dto.response.AuditLogResponse;
import com.nnipa.admin.service.AuditLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/admin/audit-logs")
@RequiredArgsConstructor
@Tag(name = "Audit Log", description = "Read-only access to the admin audit trail")
public class AuditLogController {

    private final AuditLogService auditLogService;

    @GetMapping
    @Operation(summary = "Search audit log", description = "Newest first, optionally filtered")
    public ResponseEntity<ApiResponse<Page<AuditLogResponse>>> search(
            @Parameter(description = "Trace ID") @RequestParam(required = false) String traceId,
            @Parameter(description = "Entity type, e.g. users") @RequestParam(required = false) String entityType,
            @Parameter(description = "Actor") @RequestParam(required = false) String actor,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {

        return ResponseEntity.ok(ApiResponse.success(auditLogService.search(traceId, entityType, actor, page, size)));
    }

    @GetMapping("/trace/{traceId}")
    @Operation(summary = "Audit records of one request", description = "All records sharing a trace ID")
    public ResponseEntity<ApiResponse<List<AuditLogResponse>>> byTraceId(@PathVariable String traceId) {
        return ResponseEntity.ok(ApiResponse.success(auditLogService.findByTraceId(traceId)));
    }
}
