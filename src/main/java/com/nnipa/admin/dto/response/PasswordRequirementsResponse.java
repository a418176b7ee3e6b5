package com.nnipa.admin.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Password policy requirements, for client-side hinting")
public class PasswordRequirementsResponse {

    @Schema(description = "Minimum password length", example = "12")
    private int minLength;

    private boolean requireUppercase;

    private boolean requireDigit;

    private boolean requireSpecial;

    @Schema(description = "Accepted special characters", example = "!@#$%^&*(),.?\":{}|<>")
    private String specialCharacters;

    @Schema(description = "Number of retired passwords that may not be reused", example = "3")
    private int historyWindow;

    @Schema(description = "Days until a password must be rotated", example = "90")
    private int maxAgeDays;

    private List<Requirement> rules;

    @Schema(description = "Human readable summary")
    private String message;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Requirement {
        private String code;
        private String description;
    }
}
