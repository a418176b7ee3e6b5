package com.nnipa.admin.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Audit log entry")
public class AuditLogResponse {

    private UUID id;

    @Schema(description = "ULID trace ID of the audited request", example = "01HZX3J8G6Q2W0R5T7Y9B1C3D5")
    private String traceId;

    private String method;
    private String path;
    private String entityType;
    private String entityId;

    @Schema(description = "HTTP status the request completed with", example = "200")
    private Integer outcome;

    private String actor;
    private String ipAddress;
    private LocalDateTime createdAt;
}
