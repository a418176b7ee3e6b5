package com.nnipa.admin.controller;

import com.nnipa.admin.dto.request.ValidatePasswordRequest;
import com.nnipa.admin.dto.response.ApiResponse;
import com.nnipa.admin.dto.response.PasswordRequirementsResponse;
import com.nnipa.admin.service.PasswordPolicyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the password policy.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/password")
@RequiredArgsConstructor
@Tag(name = "Password", description = "Password policy APIs")
public class PasswordController {

    private final PasswordPolicyService passwordPolicyService;

    @PostMapping("/validate")
    @Operation(summary = "Validate password", description = "Check if password meets policy requirements")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "200",
                    description = "Password validation result"
            )
    })
    public ResponseEntity<ApiResponse<PasswordPolicyService.PasswordCheckResult>> validatePassword(
            @Valid @RequestBody ValidatePasswordRequest request) {

        PasswordPolicyService.PasswordCheckResult result = passwordPolicyService.check(request.getPassword());

        return ResponseEntity.ok(ApiResponse.success(result,
                result.isAccepted() ? "Password meets requirements" : "Password does not meet requirements"));
    }

    @GetMapping("/policy")
    @Operation(summary = "Get password policy", description = "Get current password policy requirements")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "200",
                    description = "Password policy retrieved"
            )
    })
    public ResponseEntity<ApiResponse<PasswordRequirementsResponse>> getPasswordPolicy() {
        return ResponseEntity.ok(ApiResponse.success(passwordPolicyService.requirements(), "Password policy retrieved"));
    }
}
