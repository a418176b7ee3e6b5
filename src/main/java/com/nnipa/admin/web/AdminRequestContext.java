package com.nnipa.admin.web;

import com.nnipa.admin.persistence.UnitOfWork;
import com.nnipa.admin.persistence.UnitOfWorkManager;
import com.nnipa.admin.trace.TraceId;
import lombok.Builder;
import lombok.Getter;

import java.util.Objects;
import java.util.Optional;

/**
 * Explicit per-request context handed from the request filter to controllers and
 * services: the request's trace id, who and what it is about, and the request's unit of
 * work.
 *
 * <p>The unit of work is acquired lazily on the first call to {@link #unitOfWork()}, so
 * handlers can do slow work (credential hashing) before holding a pooled connection.
 * The filter that created the context decides whether it commits.
 */
@Getter
public class AdminRequestContext {

    public static final String ATTRIBUTE = "com.nnipa.admin.web.AdminRequestContext";

    private final TraceId traceId;
    private final String method;
    private final String path;
    private final String actor;
    private final String clientIp;
    private final boolean mutating;

    @Getter(lombok.AccessLevel.NONE)
    private final UnitOfWorkManager unitOfWorkManager;

    @Getter(lombok.AccessLevel.NONE)
    private UnitOfWork unitOfWork;

    @Builder
    public AdminRequestContext(TraceId traceId, String method, String path, String actor,
                               String clientIp, boolean mutating, UnitOfWorkManager unitOfWorkManager) {
        this.traceId = Objects.requireNonNull(traceId, "traceId");
        this.method = method;
        this.path = path;
        this.actor = actor;
        this.clientIp = clientIp;
        this.mutating = mutating;
        this.unitOfWorkManager = Objects.requireNonNull(unitOfWorkManager, "unitOfWorkManager");
    }

    /**
     * The request's unit of work, acquired on first use. Writes issued through
     * repositories after this call belong to the request's transaction.
     */
    public UnitOfWork unitOfWork() {
        if (unitOfWork == null) {
            unitOfWork = unitOfWorkManager.acquire();
        } else if (!unitOfWork.isActive()) {
            throw new IllegalStateException("Unit of work for request " + traceId
                    + " is already " + unitOfWork.getState());
        }
        return unitOfWork;
    }

    public Optional<UnitOfWork> currentUnitOfWork() {
        return Optional.ofNullable(unitOfWork);
    }

    public void abandon(String reason) {
        if (unitOfWork != null) {
            unitOfWork.abandon(reason);
        }
    }

    public void release() {
        if (unitOfWork != null) {
            unitOfWork.close();
        }
    }
}
