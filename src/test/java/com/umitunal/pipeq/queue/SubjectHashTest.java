package com.umitunal.pipeq.queue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SubjectHashTest {

    @Test
    @DisplayName("Should produce the same base-36 hash as records already in the store")
    void testKnownValues() {
        assertThat(SubjectHash.of("")).isEqualTo("0");
        assertThat(SubjectHash.of("a")).isEqualTo("2p");
        assertThat(SubjectHash.of("hello")).isEqualTo("1n1e4y");
        assertThat(SubjectHash.of("https://example.com/calls/1")).isEqualTo("jojl56");
    }

    @Test
    @DisplayName("Should never produce a negative hash")
    void testNonNegative() {
        // Integer.MIN_VALUE survives Math.abs only because of the widening to long
        for (String url : new String[]{"polygenelubricants", "https://example.com/" + "x".repeat(200)}) {
            assertThat(SubjectHash.of(url)).doesNotStartWith("-");
        }
    }

    @Test
    @DisplayName("Should build keys from the subject hash")
    void testKeyLayout() {
        String url = "https://example.com/calls/1";

        assertThat(QueueKeys.leaseKey(url)).isEqualTo("processing:jojl56");
        assertThat(QueueKeys.seenKey(url)).isEqualTo("seen:subject:jojl56");
        assertThat(QueueKeys.enrichedKey(url)).isEqualTo("enriched:" + url);
        assertThat(QueueKeys.deadLetterKey(QueueName.ENRICHMENT, url)).isEqualTo("dlq:summarize:jojl56");
        assertThat(QueueKeys.deadLetterKey(QueueName.DELIVERY, url)).isEqualTo("dlq:notify:jojl56");
        assertThat(QueueKeys.quarantineKey(QueueName.DELIVERY, "queue:notify:1700000000123:jojl56"))
                .isEqualTo("quarantine:notify:1700000000123:jojl56");
        assertThat(QueueKeys.entryKey(QueueName.DELIVERY, 1_700_000_000_123L, url))
                .isEqualTo("queue:notify:1700000000123:jojl56");
        assertThat(QueueKeys.entryKey(QueueName.ENRICHMENT, 42L, url))
                .isEqualTo("queue:summarize:0000000000042:jojl56");
    }
}
