package com.nnipa.admin.controller;

import com.nnipa.admin.dto.request.ChangePasswordRequest;
import com.nnipa.admin.dto.request.CreateAdminUserRequest;
import com.nnipa.admin.dto.response.AdminUserResponse;
import com.nnipa.admin.dto.response.ApiResponse;
import com.nnipa.admin.service.AdminUserService;
import com.nnipa.admin.web.AdminRequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for admin principals and their credentials.
 */
@Slf4j
@RestController
@RequestMapping("/admin/users")
@RequiredArgsConstructor
@Tag(name = "Admin Users", description = "Admin principal and credential management APIs")
public class AdminUserController {

    private final AdminUserService adminUserService;

    @PostMapping
    @Operation(summary = "Create admin user", description = "Register an admin principal with an initial password")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "201",
                    description = "Admin user created"
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "400",
                    description = "Password does not meet requirements or validation failed"
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "409",
                    description = "Username already exists"
            )
    })
    public ResponseEntity<ApiResponse<AdminUserResponse>> createUser(
            @Parameter(hidden = true) @RequestAttribute(AdminRequestContext.ATTRIBUTE) AdminRequestContext context,
            @Valid @RequestBody CreateAdminUserRequest request) {

        AdminUserResponse user = adminUserService.createUser(context, request.getUsername(), request.getPassword());

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(user, "Admin user created successfully"));
    }

    @GetMapping("/{userId}")
    @Operation(summary = "Get admin user", description = "Get an admin principal and its credential status")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "200",
                    description = "Admin user retrieved"
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "404",
                    description = "Admin user not found"
            )
    })
    public ResponseEntity<ApiResponse<AdminUserResponse>> getUser(@PathVariable UUID userId) {
        return ResponseEntity.ok(ApiResponse.success(adminUserService.getUser(userId)));
    }

    @PutMapping("/{userId}/password")
    @Operation(summary = "Change password",
            description = "Rotate an admin principal's password after verifying the current one")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "200",
                    description = "Password changed successfully"
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "400",
                    description = "New password rejected by policy or recently used"
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "401",
                    description = "Current password incorrect"
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "409",
                    description = "Password was changed concurrently"
            )
    })
    public ResponseEntity<ApiResponse<Void>> changePassword(
            @Parameter(hidden = true) @RequestAttribute(AdminRequestContext.ATTRIBUTE) AdminRequestContext context,
            @PathVariable UUID userId,
            @Valid @RequestBody ChangePasswordRequest request) {

        adminUserService.changePassword(context, userId, request.getCurrentPassword(), request.getNewPassword());

        return ResponseEntity.ok(ApiResponse.success(null, "Password changed successfully"));
    }

    @PostMapping("/{userId}/password/expire")
    @Operation(summary = "Expire password", description = "Force the admin principal to change password")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "200",
                    description = "Password expired"
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "404",
                    description = "Admin user not found"
            )
    })
    public ResponseEntity<ApiResponse<Void>> expirePassword(
            @Parameter(hidden = true) @RequestAttribute(AdminRequestContext.ATTRIBUTE) AdminRequestContext context,
            @PathVariable UUID userId) {

        adminUserService.expirePassword(context, userId);

        return ResponseEntity.ok(ApiResponse.success(null, "Password expired"));
    }
}
