package com.nnipa.admin.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nnipa.admin.audit.AuditRecorder;
import com.nnipa.admin.config.AdminProperties;
import com.nnipa.admin.dto.response.ApiResponse;
import com.nnipa.admin.exception.AuditWriteException;
import com.nnipa.admin.persistence.UnitOfWork;
import com.nnipa.admin.persistence.UnitOfWorkManager;
import com.nnipa.admin.trace.TraceContext;
import com.nnipa.admin.trace.TraceId;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.security.Principal;

/**
 * Outermost filter of every request.
 *
 * <p>This filter:
 * 1. Generates the request's trace id, binds it to the log context and returns it in
 *    the {@value #TRACE_ID_HEADER} response header
 * 2. Exposes an {@link AdminRequestContext} to handlers as a request attribute
 * 3. On a 2xx completion of a mutating request, writes the audit record inside the
 *    request's unit of work and commits; any other outcome rolls back
 * 4. Buffers the response body until the commit outcome is known, so a client never
 *    sees success for a change that did not commit
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class AdminRequestFilter extends OncePerRequestFilter {

    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private final UnitOfWorkManager unitOfWorkManager;
    private final AuditRecorder auditRecorder;
    private final AdminProperties adminProperties;
    private final ObjectMapper objectMapper;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        TraceId traceId = TraceContext.generate();
        String path = resolvePath(request);
        AdminRequestContext context = AdminRequestContext.builder()
                .traceId(traceId)
                .method(request.getMethod())
                .path(path)
                .actor(resolveActor(request))
                .clientIp(getClientIpAddress(request))
                .mutating(adminProperties.getAudit().isAudited(request.getMethod(), path))
                .unitOfWorkManager(unitOfWorkManager)
                .build();

        request.setAttribute(AdminRequestContext.ATTRIBUTE, context);
        response.setHeader(TRACE_ID_HEADER, traceId.toString());
        ContentCachingResponseWrapper bufferedResponse = new ContentCachingResponseWrapper(response);

        try (TraceContext.Binding ignored = TraceContext.bind(traceId)) {
            log.debug("{} {} started (mutating={})", context.getMethod(), path, context.isMutating());
            try {
                filterChain.doFilter(request, bufferedResponse);
                complete(context, bufferedResponse);
            } catch (ServletException | IOException | RuntimeException ex) {
                context.abandon("request failed with " + ex.getClass().getSimpleName());
                throw ex;
            } finally {
                context.release();
            }
            bufferedResponse.copyBodyToResponse();
        }
    }

    private void complete(AdminRequestContext context, ContentCachingResponseWrapper response) throws IOException {
        int status = response.getStatus();

        if (status < 200 || status >= 300) {
            context.abandon("completed with status " + status);
            return;
        }

        if (!context.isMutating()) {
            context.currentUnitOfWork()
                    .filter(UnitOfWork::isActive)
                    .ifPresent(UnitOfWork::commit);
            return;
        }

        try {
            UnitOfWork unitOfWork = context.unitOfWork();
            auditRecorder.record(unitOfWork, context, status);
            unitOfWork.commit();
            log.info("{} {} committed with audit record (status={})", context.getMethod(), context.getPath(), status);
        } catch (RuntimeException ex) {
            log.error("{} {} rolled back, audit trail could not be completed: {}",
                    context.getMethod(), context.getPath(), ex.getMessage(), ex);
            context.abandon("audit or commit failed");
            writeFailure(context, response, ex);
        }
    }

    private void writeFailure(AdminRequestContext context, ContentCachingResponseWrapper response,
                              RuntimeException ex) throws IOException {
        String errorCode = ex instanceof AuditWriteException auditFailure
                ? auditFailure.getErrorCode()
                : "COMMIT_FAILED";

        ApiResponse<Object> body = ApiResponse.error("The change was not saved", errorCode);
        body.setTraceId(context.getTraceId().toString());

        response.resetBuffer();
        response.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getOutputStream().write(objectMapper.writeValueAsBytes(body));
    }

    private String resolvePath(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (StringUtils.hasText(contextPath) && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }

    private String resolveActor(HttpServletRequest request) {
        String actor = request.getHeader(adminProperties.getAudit().getActorHeader());
        if (StringUtils.hasText(actor)) {
            return actor.trim();
        }
        Principal principal = request.getUserPrincipal();
        return principal != null ? principal.getName() : null;
    }

    private String getClientIpAddress(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }

        String xRealIp = request.getHeader("X-Real-IP");
        if (xRealIp != null && !xRealIp.isEmpty()) {
            return xRealIp;
        }

        return request.getRemoteAddr();
    }
}
