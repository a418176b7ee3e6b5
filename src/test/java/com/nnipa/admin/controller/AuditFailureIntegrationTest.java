package com.nnipa.admin.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nnipa.admin.audit.AuditRecorder;
import com.nnipa.admin.dto.request.CreateAdminUserRequest;
import com.nnipa.admin.exception.AuditWriteException;
import com.nnipa.admin.persistence.UnitOfWork;
import com.nnipa.admin.repository.AdminUserRepository;
import com.nnipa.admin.web.AdminRequestContext;
import com.nnipa.admin.web.AdminRequestFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AuditFailureIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AdminUserRepository adminUserRepository;

    @MockBean
    private AuditRecorder auditRecorder;

    @Test
    @DisplayName("When the audit record cannot be written the mutation is not committed")
    void auditFailureRollsBackMutation() throws Exception {
        when(auditRecorder.record(any(UnitOfWork.class), any(AdminRequestContext.class), anyInt()))
                .thenThrow(new AuditWriteException("Audit record could not be written", "-",
                        new DataIntegrityViolationException("value too long")));
        String username = "fail-" + UUID.randomUUID().toString().substring(0, 8);

        mockMvc.perform(post("/admin/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new CreateAdminUserRequest(username, "OldPass1234!"))))
                .andExpect(status().isInternalServerError())
                .andExpect(header().exists(AdminRequestFilter.TRACE_ID_HEADER))
                .andExpect(jsonPath("$.errorCode").value("AUDIT_WRITE_FAILED"))
                .andExpect(jsonPath("$.data").doesNotExist());

        assertThat(adminUserRepository.existsByUsername(username)).isFalse();
    }

    @Test
    @DisplayName("Read-only requests never reach the audit recorder")
    void readsSkipRecorder() throws Exception {
        mockMvc.perform(get("/api/v1/password/policy")).andExpect(status().isOk());

        verify(auditRecorder, never()).record(any(UnitOfWork.class), any(AdminRequestContext.class), anyInt());
    }
}
