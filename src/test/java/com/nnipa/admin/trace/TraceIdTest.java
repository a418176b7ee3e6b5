package com.nnipa.admin.trace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TraceIdTest {

    private static final String CROCKFORD = "0123456789ABCDEFGHJKMNPQRSTVWXYZ";

    @Test
    @DisplayName("Generated ids are 26 Crockford base32 characters")
    void format() {
        String value = TraceId.generate().toString();

        assertThat(value).hasSize(TraceId.LENGTH);
        for (char c : value.toCharArray()) {
            assertThat(CROCKFORD.indexOf(c)).as("character %s", c).isNotNegative();
        }
    }

    @Test
    @DisplayName("Ids generated in sequence never sort backwards and never repeat")
    void monotonicAndUnique() {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 10_000; i++) {
            ids.add(TraceId.generate().toString());
        }

        for (int i = 1; i < ids.size(); i++) {
            assertThat(ids.get(i)).isGreaterThan(ids.get(i - 1));
        }
        Set<String> unique = new HashSet<>(ids);
        assertThat(unique).hasSize(ids.size());
    }

    @Test
    @DisplayName("Parsing accepts generated ids and rejects anything else")
    void parse() {
        TraceId traceId = TraceId.generate();

        assertThat(TraceId.parse(traceId.toString())).contains(traceId);
        assertThat(TraceId.parse(null)).isEmpty();
        assertThat(TraceId.parse(TraceId.ABSENT)).isEmpty();
        assertThat(TraceId.parse("not-a-ulid")).isEmpty();
    }

    @Test
    @DisplayName("Timestamp component is the generation time")
    void timestamp() {
        long before = System.currentTimeMillis();
        TraceId traceId = TraceId.generate();
        long after = System.currentTimeMillis();

        assertThat(traceId.getTimestamp().toEpochMilli()).isBetween(before, after);
    }
}
