package com.nnipa.admin.web;

import com.nnipa.admin.persistence.UnitOfWork;
import com.nnipa.admin.persistence.UnitOfWorkManager;
import com.nnipa.admin.persistence.UnitOfWorkState;
import com.nnipa.admin.trace.TraceId;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AdminRequestContextTest {

    private final UnitOfWorkManager unitOfWorkManager = mock(UnitOfWorkManager.class);
    private final UnitOfWork unitOfWork = mock(UnitOfWork.class);

    @Test
    void attributeNameIsTheClassName() {
        assertThat(AdminRequestContext.ATTRIBUTE).isEqualTo(AdminRequestContext.class.getName());
    }

    @Test
    void unitOfWorkIsAcquiredOnceOnFirstUse() {
        when(unitOfWorkManager.acquire()).thenReturn(unitOfWork);
        when(unitOfWork.isActive()).thenReturn(true);
        AdminRequestContext context = newContext();

        assertThat(context.currentUnitOfWork()).isEmpty();
        assertThat(context.unitOfWork()).isSameAs(unitOfWork);
        assertThat(context.unitOfWork()).isSameAs(unitOfWork);

        verify(unitOfWorkManager, times(1)).acquire();
    }

    @Test
    void completedUnitOfWorkIsNotHandedOutAgain() {
        when(unitOfWorkManager.acquire()).thenReturn(unitOfWork);
        when(unitOfWork.isActive()).thenReturn(false);
        when(unitOfWork.getState()).thenReturn(UnitOfWorkState.RELEASED);
        AdminRequestContext context = newContext();
        context.unitOfWork();

        assertThatThrownBy(context::unitOfWork).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void releaseWithoutUnitOfWorkIsNoOp() {
        AdminRequestContext context = newContext();

        context.abandon("not needed");
        context.release();

        verify(unitOfWorkManager, never()).acquire();
    }

    private AdminRequestContext newContext() {
        return AdminRequestContext.builder()
                .traceId(TraceId.generate())
                .method("POST")
                .path("/admin/users")
                .mutating(true)
                .unitOfWorkManager(unitOfWorkManager)
                .build();
    }
}
