package com.nnipa.admin.trace;

import com.github.f4b6a3.ulid.Ulid;
import com.github.f4b6a3.ulid.UlidCreator;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.Optional;

/**
 * Request correlation identifier: a 26 character ULID in Crockford base32.
 *
 * <p>Values are generated with the monotonic ULID factory, so ids created later in the
 * process never sort before earlier ones, even within the same millisecond.
 */
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class TraceId implements Comparable<TraceId> {

    public static final int LENGTH = 26;

    /** Written wherever a trace id is expected but none is bound. */
    public static final String ABSENT = "-";

    private final Ulid ulid;

    public static TraceId generate() {
        return new TraceId(UlidCreator.getMonotonicUlid());
    }

    public static Optional<TraceId> parse(String value) {
        if (value == null || !Ulid.isValid(value)) {
            return Optional.empty();
        }
        return Optional.of(new TraceId(Ulid.from(value)));
    }

    public Instant getTimestamp() {
        return ulid.getInstant();
    }

    @Override
    public int compareTo(TraceId other) {
        return ulid.compareTo(other.ulid);
    }

    @Override
    public String toString() {
        return ulid.toString();
    }
}
