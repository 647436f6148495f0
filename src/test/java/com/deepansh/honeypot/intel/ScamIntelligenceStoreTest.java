package com.deepansh.honeypot.intel;

import com.deepansh.honeypot.model.Evidence;
import com.deepansh.honeypot.model.ReportPayload;
import com.deepansh.honeypot.support.InMemoryStores;
import com.deepansh.honeypot.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ScamIntelligenceStoreTest {

    private InMemoryStores stores;
    private MutableClock clock;
    private ScamIntelligenceStore store;

    @BeforeEach
    void setUp() {
        stores = new InMemoryStores();
        clock = MutableClock.at("2026-02-01T08:00:00Z");
        store = stores.scamStore(clock);
    }

    @Test
    void markPushed_twice_staysPushedAndKeepsFirstTimestamp() {
        store.upsert(record("s1", Instant.parse("2026-02-01T07:00:00Z")));

        store.markPushed("s1");
        Instant firstPushedAt = stores.scam.get("s1").getPushedAt();
        clock.advance(Duration.ofMinutes(5));
        store.markPushed("s1");

        ScamIntelligenceRecord saved = stores.scam.get("s1");
        assertThat(saved.isPushedToExternal()).isTrue();
        assertThat(saved.getPushedAt()).isEqualTo(firstPushedAt).isEqualTo(Instant.parse("2026-02-01T08:00:00Z"));
    }

    @Test
    void markPushed_unknownSession_doesNothing() {
        store.markPushed("ghost");

        verify(stores.scamRepo, never()).save(any(ScamIntelligenceRecord.class));
    }

    @Test
    void listPending_oldestFirstAndExcludesPushed() {
        store.upsert(record("newer", Instant.parse("2026-02-01T07:30:00Z")));
        store.upsert(record("older", Instant.parse("2026-02-01T07:00:00Z")));
        store.upsert(record("done", Instant.parse("2026-02-01T06:00:00Z")));
        store.markPushed("done");

        assertThat(store.listPending()).containsExactly("older", "newer");
        assertThat(store.countPending()).isEqualTo(2);
    }

    @Test
    void getPayload_mapsRecordToWireShape() {
        ScamIntelligenceRecord record = record("s1", Instant.parse("2026-02-01T07:00:00Z"));
        record.setEvidence(Evidence.of(List.of("123456789012"), List.of("x@ybl"),
                List.of("http://bad.link"), List.of("+919876543210"), List.of("urgent")));
        record.setAgentNotes("KYC threat");
        store.upsert(record);

        ReportPayload payload = store.getPayload("s1").orElseThrow();

        assertThat(payload.sessionId()).isEqualTo("s1");
        assertThat(payload.scamDetected()).isTrue();
        assertThat(payload.totalMessagesExchanged()).isEqualTo(4);
        assertThat(payload.extractedIntelligence().upiIds()).containsExactly("x@ybl");
        assertThat(payload.extractedIntelligence().phishingLinks()).containsExactly("http://bad.link");
        assertThat(payload.agentNotes()).isEqualTo("KYC threat");
    }

    @Test
    void upsert_sameSession_replacesRecordIncludingPushedState() {
        store.upsert(record("s1", Instant.parse("2026-02-01T07:00:00Z")));
        store.markPushed("s1");

        store.upsert(record("s1", Instant.parse("2026-02-01T07:45:00Z")));

        assertThat(stores.scam).hasSize(1);
        assertThat(stores.scam.get("s1").isPushedToExternal()).isFalse();
    }

    @Test
    void listRecent_newestFirstAndCapped() {
        store.upsert(record("old", Instant.parse("2026-02-01T07:00:00Z")));
        store.upsert(record("new", Instant.parse("2026-02-01T09:00:00Z")));
        store.upsert(record("mid", Instant.parse("2026-02-01T08:00:00Z")));
        store.markPushed("mid");

        assertThat(store.listRecent(2)).extracting(ScamIntelligenceRecord::getSessionId)
                .containsExactly("new", "mid");
        assertThat(store.listRecent(0)).isEmpty();
    }

    @Test
    void clearAll_removesEverythingAndReportsCount() {
        store.upsert(record("a", Instant.parse("2026-02-01T07:00:00Z")));
        store.upsert(record("b", Instant.parse("2026-02-01T08:00:00Z")));

        assertThat(store.clearAll()).isEqualTo(2);
        assertThat(store.count()).isZero();
        assertThat(store.listPending()).isEmpty();
    }

    @Test
    void getPayload_unknown_isEmpty() {
        assertThat(store.getPayload("nope")).isEmpty();
    }

    private static ScamIntelligenceRecord record(String sessionId, Instant createdAt) {
        return ScamIntelligenceRecord.builder()
                .sessionId(sessionId)
                .totalMessagesExchanged(4)
                .createdAt(createdAt)
                .build();
    }
}
