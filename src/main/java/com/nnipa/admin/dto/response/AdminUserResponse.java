package com.nnipa.admin.dto.response;

import com.nnipa.admin.enums.UserStatus;
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
@Schema(description = "Admin user summary")
public class AdminUserResponse {

    private UUID id;
    private String username;
    private UserStatus status;
    private LocalDateTime passwordChangedAt;
    private LocalDateTime passwordExpiresAt;
    private boolean mustChangePassword;
    private boolean passwordExpired;

    @Schema(description = "Number of retired passwords kept for reuse checks")
    private int passwordHistorySize;

    private LocalDateTime createdAt;
}
