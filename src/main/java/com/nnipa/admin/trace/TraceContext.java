package com.nnipa.admin.trace;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Binds a trace id to the log context of the executing thread.
 *
 * <p>The binding only feeds the log sink ({@value #MDC_KEY} in the logging pattern).
 * Business code receives the trace id explicitly through
 * {@link com.nnipa.admin.web.AdminRequestContext}; it never reads it from here.
 *
 * <pre>{@code
 * try (TraceContext.Binding ignored = TraceContext.bind(traceId)) {
 *     // every log line in here carries traceId
 * }
 * }</pre>
 */
public final class TraceContext {

    public static final String MDC_KEY = "traceId";

    private TraceContext() {
        // Utility class
    }

    public static TraceId generate() {
        return TraceId.generate();
    }

    /**
     * Bind {@code traceId} until the returned binding is closed. Closing restores whatever
     * was bound before, so nothing leaks into the next request handled by the same thread.
     */
    public static Binding bind(TraceId traceId) {
        String previous = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, traceId.toString());
        return new Binding(previous);
    }

    public static Optional<TraceId> current() {
        return TraceId.parse(MDC.get(MDC_KEY));
    }

    public static String currentOrSentinel() {
        return current().map(TraceId::toString).orElse(TraceId.ABSENT);
    }

    /**
     * Scoped log-context binding.
     */
    public static final class Binding implements AutoCloseable {

        private final String previous;
        private boolean closed;

        private Binding(String previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (previous == null) {
                MDC.remove(MDC_KEY);
            } else {
                MDC.put(MDC_KEY, previous);
            }
        }
    }
}
