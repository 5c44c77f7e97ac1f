package com.mikov.emailverifier.cache;

import com.mikov.emailverifier.smtp.dns.MxRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class MxRecordCacheTest {
    private static final List<MxRecord> RECORDS = List.of(new MxRecord("mx.example.com", 10));

    @Test
    void expiresEntriesAfterTtl() {
        final var now = new AtomicLong(1_000);
        final var cache = new MxRecordCache(500, 10, now::get);
        cache.put("example.com", RECORDS);

        now.addAndGet(500);
        assertThat(cache.get("example.com")).isEqualTo(RECORDS);

        now.addAndGet(1);
        assertThat(cache.get("example.com")).isNull();
    }

    @Test
    void evictsExpiredEntriesWhenFull() {
        final var now = new AtomicLong(0);
        final var cache = new MxRecordCache(100, 2, now::get);
        cache.put("a.com", RECORDS);
        now.addAndGet(200);
        cache.put("b.com", RECORDS);

        cache.put("c.com", RECORDS);

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get("a.com")).isNull();
        assertThat(cache.get("b.com")).isEqualTo(RECORDS);
        assertThat(cache.get("c.com")).isEqualTo(RECORDS);
    }

    @Test
    void neverGrowsBeyondMaxSize() {
        final var cache = new MxRecordCache(60_000, 2);
        cache.put("a.com", RECORDS);
        cache.put("b.com", RECORDS);
        cache.put("c.com", RECORDS);

        assertThat(cache.size()).isLessThanOrEqualTo(2);
        assertThat(cache.get("c.com")).isEqualTo(RECORDS);
    }
}
