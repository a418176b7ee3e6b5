package com.nnipa.admin.persistence;

/**
 * Lifecycle of a {@link UnitOfWork}:
 * {@code CREATED -> ACTIVE -> (COMMITTED | ROLLED_BACK) -> RELEASED}.
 */
public enum UnitOfWorkState {
    CREATED,
    ACTIVE,
    COMMITTED,
    ROLLED_BACK,
    RELEASED
}
