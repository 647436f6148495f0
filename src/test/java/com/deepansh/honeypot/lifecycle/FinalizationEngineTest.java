package com.deepansh.honeypot.lifecycle;

import com.deepansh.honeypot.archive.ArchiveStore;
import com.deepansh.honeypot.archive.ArchivedSession;
import com.deepansh.honeypot.config.HoneypotProperties;
import com.deepansh.honeypot.exception.ReporterException;
import com.deepansh.honeypot.exception.SessionNotFoundException;
import com.deepansh.honeypot.exception.StorageException;
import com.deepansh.honeypot.intel.ScamIntelligenceRecord;
import com.deepansh.honeypot.intel.ScamIntelligenceStore;
import com.deepansh.honeypot.model.Evidence;
import com.deepansh.honeypot.model.ReportPayload;
import com.deepansh.honeypot.model.ScamStatus;
import com.deepansh.honeypot.model.Sender;
import com.deepansh.honeypot.report.ReporterGateway;
import com.deepansh.honeypot.session.ActiveSession;
import com.deepansh.honeypot.session.ActiveSessionStore;
import com.deepansh.honeypot.support.InMemoryStores;
import com.deepansh.honeypot.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.core.convert.ConversionFailedException;
import org.springframework.core.convert.TypeDescriptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FinalizationEngineTest {

    private InMemoryStores stores;
    private HoneypotProperties properties;
    private MutableClock clock;
    private ReporterGateway reporter;

    private ActiveSessionStore activeStore;
    private ArchiveStore archiveStore;
    private ScamIntelligenceStore scamStore;
    private FinalizationEngine engine;

    @BeforeEach
    void setUp() {
        stores = new InMemoryStores();
        properties = new HoneypotProperties();
        clock = MutableClock.at("2026-03-01T12:00:00Z");
        reporter = mock(ReporterGateway.class);

        activeStore = stores.activeStore(properties, clock);
        archiveStore = stores.archiveStore();
        scamStore = stores.scamStore(clock);
        engine = new FinalizationEngine(activeStore, archiveStore, scamStore, reporter,
                stores.storeLock, properties, clock);
    }

    @Test
    void finalize_unknownSession_throwsAndLeavesStoresUntouched() {
        assertThatThrownBy(() -> engine.finalizeSession("nonexistent", true))
                .isInstanceOf(SessionNotFoundException.class);

        assertThat(stores.archived).isEmpty();
        assertThat(stores.scam).isEmpty();
        verify(stores.archiveRepo, never()).save(any(ArchivedSession.class));
        verify(stores.scamRepo, never()).save(any(ScamIntelligenceRecord.class));
        verify(reporter, never()).push(any());
    }

    @Test
    void finalize_confirmedScam_archivesStoresIntelAndClearsActive() {
        confirmedScamSession("s1");

        FinalizationResult result = engine.finalizeSession("s1", false);

        assertThat(result.scam()).isTrue();
        assertThat(result.scamFlags()).isEqualTo(2);
        assertThat(result.totalMessages()).isEqualTo(3);
        assertThat(result.pushed()).isFalse();
        assertThat(stores.archived).containsKey("s1");
        assertThat(stores.scam).containsKey("s1");
        assertThat(activeStore.getFullSession("s1")).isEmpty();
        assertThat(stores.messages).isEmpty();
        assertThat(stores.intel).isEmpty();
    }

    @Test
    void finalize_confirmedScam_snapshotCarriesEvidenceAndNotes() {
        confirmedScamSession("s1");

        engine.finalizeSession("s1", false);

        ScamIntelligenceRecord record = stores.scam.get("s1");
        assertThat(record.getEvidence().getUpiIds()).containsExactly("fraud@ybl");
        assertThat(record.getAgentNotes()).isEqualTo("asks for UPI transfer");
        assertThat(record.isPushedToExternal()).isFalse();

        ArchivedSession archived = stores.archived.get("s1");
        assertThat(archived.isScam()).isTrue();
        assertThat(archived.getMessages()).extracting(ArchivedSession.ArchivedMessage::getSeq)
                .containsExactly(1, 2, 3);
        assertThat(archived.getCompletedAt()).isEqualTo(clock.instant());
    }

    @Test
    void finalize_benignSession_archivesOnly() {
        activeStore.appendMessage("b1", Sender.scammer, "hi", false, false, null);
        activeStore.appendMessage("b1", Sender.user, "hello", true, false, null);

        FinalizationResult result = engine.finalizeSession("b1", true);

        assertThat(result.scam()).isFalse();
        assertThat(result.totalMessages()).isEqualTo(2);
        assertThat(stores.archived).containsKey("b1");
        assertThat(stores.scam).isEmpty();
        assertThat(activeStore.isActive("b1")).isFalse();
        verify(reporter, never()).push(any());
    }

    @Test
    void finalize_writesScamThenArchiveThenClears() {
        confirmedScamSession("s1");

        engine.finalizeSession("s1", false);

        InOrder order = inOrder(stores.scamRepo, stores.archiveRepo, stores.sessionRepo);
        order.verify(stores.scamRepo).save(any(ScamIntelligenceRecord.class));
        order.verify(stores.archiveRepo).save(any(ArchivedSession.class));
        order.verify(stores.sessionRepo).deleteById("s1");
    }

    @Test
    void finalize_pushSucceeds_marksPushed() {
        confirmedScamSession("s1");
        when(reporter.isEnabled()).thenReturn(true);
        when(reporter.push(any())).thenReturn(true);

        FinalizationResult result = engine.finalizeSession("s1", true);

        assertThat(result.pushed()).isTrue();
        assertThat(stores.scam.get("s1").isPushedToExternal()).isTrue();
        assertThat(stores.scam.get("s1").getPushedAt()).isNotNull();
    }

    @Test
    void finalize_pushPayloadMatchesSnapshot() {
        confirmedScamSession("s1");
        when(reporter.isEnabled()).thenReturn(true);
        when(reporter.push(any())).thenAnswer(inv -> {
            ReportPayload payload = inv.getArgument(0);
            assertThat(payload.sessionId()).isEqualTo("s1");
            assertThat(payload.totalMessagesExchanged()).isEqualTo(3);
            assertThat(payload.extractedIntelligence().upiIds()).containsExactly("fraud@ybl");
            return true;
        });

        assertThat(engine.finalizeSession("s1", true).pushed()).isTrue();
    }

    @Test
    void finalize_pushThrows_stillSucceedsAndRecordStaysPending() {
        confirmedScamSession("s1");
        when(reporter.isEnabled()).thenReturn(true);
        when(reporter.push(any())).thenThrow(new ReporterException("503 from evaluator"));

        FinalizationResult result = engine.finalizeSession("s1", true);

        assertThat(result.scam()).isTrue();
        assertThat(result.pushed()).isFalse();
        assertThat(stores.archived).containsKey("s1");
        assertThat(scamStore.listPending()).containsExactly("s1");
    }

    @Test
    void finalize_pushReturnsFalse_recordStaysPending() {
        confirmedScamSession("s1");
        when(reporter.isEnabled()).thenReturn(true);
        when(reporter.push(any())).thenReturn(false);

        assertThat(engine.finalizeSession("s1", true).pushed()).isFalse();
        assertThat(stores.scam.get("s1").isPushedToExternal()).isFalse();
    }

    @Test
    void finalize_reporterDisabled_doesNotPush() {
        confirmedScamSession("s1");
        when(reporter.isEnabled()).thenReturn(false);

        assertThat(engine.finalizeSession("s1", true).pushed()).isFalse();
        verify(reporter, never()).push(any());
    }

    @Test
    void finalize_pushHappensOutsideStoreLock() {
        confirmedScamSession("s1");
        AtomicBoolean lockHeldDuringPush = new AtomicBoolean(true);
        when(reporter.isEnabled()).thenReturn(true);
        when(reporter.push(any())).thenAnswer(inv -> {
            lockHeldDuringPush.set(stores.storeLock.isHeldByCurrentThread());
            // the session must already be gone when the evaluator is called
            assertThat(activeStore.isActive("s1")).isFalse();
            return true;
        });

        engine.finalizeSession("s1", true);

        assertThat(lockHeldDuringPush).isFalse();
    }

    @Test
    void finalize_archiveWriteFails_sessionStaysActive() {
        activeStore.appendMessage("b1", Sender.scammer, "hi", false, false, null);
        doThrow(new DataAccessResourceFailureException("disk full"))
                .when(stores.archiveRepo).save(any(ArchivedSession.class));

        assertThatThrownBy(() -> engine.finalizeSession("b1", false))
                .isInstanceOf(StorageException.class);
        assertThat(activeStore.isActive("b1")).isTrue();
    }

    @Test
    void finalizeTimedOut_onlyFinalizesSessionsIdleBeyondTimeout() {
        properties.getSession().setTimeoutSeconds(300);
        activeStore.appendMessage("idle", Sender.scammer, "x", false, false, null);
        clock.advance(Duration.ofMinutes(4));
        activeStore.appendMessage("recent", Sender.scammer, "y", false, false, null);
        clock.advance(Duration.ofMinutes(2));

        int count = engine.finalizeTimedOut();

        assertThat(count).isEqualTo(1);
        assertThat(stores.archived).containsOnlyKeys("idle");
        assertThat(activeStore.isActive("recent")).isTrue();
    }

    @Test
    void finalizeTimedOut_neverPushes() {
        confirmedScamSession("s1");
        clock.advance(Duration.ofMinutes(10));

        assertThat(engine.finalizeTimedOut()).isEqualTo(1);

        verify(reporter, never()).push(any());
        assertThat(scamStore.listPending()).containsExactly("s1");
    }

    @Test
    void finalizeTimedOut_sessionTouchedAfterQuery_isSkipped() {
        activeStore.appendMessage("s1", Sender.scammer, "x", false, false, null);
        clock.advance(Duration.ofMinutes(10));
        // A turn lands between the idle query and the per-session finalize
        doAnswer(inv -> {
            ActiveSession session = stores.sessions.get("s1");
            session.setUpdatedAt(clock.instant());
            return List.of(session);
        }).when(stores.sessionRepo).findByUpdatedAtBefore(any());

        assertThat(engine.finalizeTimedOut()).isZero();
        assertThat(activeStore.isActive("s1")).isTrue();
    }

    @Test
    void finalizeTimedOut_storageFailureOnOne_continuesWithOthers() {
        activeStore.appendMessage("a", Sender.scammer, "x", false, false, null);
        activeStore.appendMessage("b", Sender.scammer, "y", false, false, null);
        clock.advance(Duration.ofMinutes(10));
        doThrow(new DataAccessResourceFailureException("boom"))
                .when(stores.messageRepo).findBySessionIdOrderBySeqAsc("a");

        int count = engine.finalizeTimedOut();

        assertThat(count).isEqualTo(1);
        assertThat(stores.archived).containsOnlyKeys("b");
        assertThat(activeStore.isActive("a")).isTrue();
    }

    @Test
    void finalizeTimedOut_unreadableDocument_skipsItAndFinalizesTheRest() {
        activeStore.appendMessage("bad", Sender.scammer, "x", false, false, null);
        activeStore.appendMessage("good", Sender.scammer, "y", false, false, null);
        clock.advance(Duration.ofMinutes(10));
        doThrow(unreadableTimestamp())
                .when(stores.messageRepo).findBySessionIdOrderBySeqAsc("bad");

        int count = engine.finalizeTimedOut();

        assertThat(count).isEqualTo(1);
        assertThat(stores.archived).containsOnlyKeys("good");
        assertThat(activeStore.isActive("bad")).isTrue();
    }

    @Test
    void finalizeTimedOut_unexpectedErrorOnOne_continuesWithOthers() {
        activeStore.appendMessage("a", Sender.scammer, "x", false, false, null);
        activeStore.appendMessage("b", Sender.scammer, "y", false, false, null);
        clock.advance(Duration.ofMinutes(10));
        doAnswer(inv -> {
            ArchivedSession snapshot = inv.getArgument(0);
            if (snapshot.getSessionId().equals("a")) {
                throw new IllegalStateException("unexpected");
            }
            stores.archived.put(snapshot.getSessionId(), snapshot);
            return snapshot;
        }).when(stores.archiveRepo).save(any(ArchivedSession.class));

        int count = engine.finalizeTimedOut();

        assertThat(count).isEqualTo(1);
        assertThat(stores.archived).containsOnlyKeys("b");
        assertThat(activeStore.isActive("a")).isTrue();
    }

    @Test
    void finalize_unreadableDocument_surfacesAsStorageException() {
        activeStore.appendMessage("bad", Sender.scammer, "x", false, false, null);
        doThrow(unreadableTimestamp())
                .when(stores.messageRepo).findBySessionIdOrderBySeqAsc("bad");

        assertThatThrownBy(() -> engine.finalizeSession("bad", true))
                .isInstanceOf(StorageException.class)
                .hasCauseInstanceOf(ConversionFailedException.class);
        assertThat(stores.archived).isEmpty();
    }

    @Test
    void scenario_threeMessagesOneFlag_thresholdOne() {
        properties.getSession().setConfirmThreshold(1);
        activeStore.appendMessage("S1", Sender.scammer, "m1", false, false, null);
        activeStore.appendMessage("S1", Sender.scammer, "m2", false, true, null);
        activeStore.appendMessage("S1", Sender.scammer, "m3", false, false, null);

        assertThat(activeStore.getScamStatus("S1")).isEqualTo(new ScamStatus(1, true));

        FinalizationResult result = engine.finalizeSession("S1", false);

        assertThat(result.scam()).isTrue();
        assertThat(activeStore.getFullSession("S1")).isEmpty();
        assertThat(stores.scam.get("S1").getTotalMessagesExchanged()).isEqualTo(3);
    }

    private static ConversionFailedException unreadableTimestamp() {
        return new ConversionFailedException(TypeDescriptor.valueOf(String.class),
                TypeDescriptor.valueOf(Instant.class), "not-a-date", new IllegalArgumentException("not-a-date"));
    }

    private void confirmedScamSession(String sessionId) {
        activeStore.appendMessage(sessionId, Sender.scammer, "your account is blocked", false, true, null);
        activeStore.appendMessage(sessionId, Sender.user, "oh no what happened", true, false, null);
        activeStore.appendMessage(sessionId, Sender.scammer, "send to fraud@ybl now", false, true, null);
        activeStore.mergeIntelligence(sessionId,
                Evidence.of(List.of(), List.of("fraud@ybl"), List.of(), List.of(), List.of()),
                "asks for UPI transfer");
    }
}
