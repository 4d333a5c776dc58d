package com.fastguard.core.dlq;

import com.fastguard.config.GuardDeadLetterProperties;
import com.fastguard.core.dlq.store.LocalFileDeadLetterStore;
import com.fastguard.core.metric.GuardMetrics;
import com.fastguard.core.notify.AdminNotifier;
import com.fastguard.core.serializer.JacksonPayloadSerializer;
import com.fastguard.core.spi.dlq.DeadLetterStore;
import com.fastguard.exception.DeadLetterStoreException;
import com.fastguard.model.DeadLetterEntry;
import com.fastguard.model.ErrorInfo;
import com.fastguard.model.NotificationEvent;
import com.fastguard.model.enums.DeadLetterStatus;
import com.fastguard.model.enums.ReprocessOutcome;
import com.fastguard.model.enums.Severity;
import com.fastguard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DeadLetterQueueTest {

    @TempDir
    Path dir;

    private MutableClock clock;
    private GuardMetrics metrics;
    private AdminNotifier notifier;
    private GuardDeadLetterProperties props;
    private LocalFileDeadLetterStore store;
    private DeadLetterQueue dlq;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        metrics = GuardMetrics.simple();
        notifier = mock(AdminNotifier.class);
        props = new GuardDeadLetterProperties();
        props.setVisibilityTimeout(Duration.ofSeconds(30));
        props.setMaxReprocessAttempts(2);
        JacksonPayloadSerializer serializer = new JacksonPayloadSerializer();
        store = new LocalFileDeadLetterStore(dir.resolve("dlq.jsonl"), serializer);
        dlq = new DeadLetterQueue(store, serializer, props, metrics, notifier, clock);
    }

    private String send() {
        return dlq.sendToDlq("sms", Map.of("to", "+100", "text", "hi"),
                ErrorInfo.of("RETRY_EXHAUSTED", new IOException("gateway timeout"), clock)).orElseThrow();
    }

    @Test
    void sendStoresPendingEntry() {
        String id = send();

        DeadLetterEntry e = dlq.get(id).orElseThrow();
        assertThat(e.getStatus()).isEqualTo(DeadLetterStatus.PENDING);
        assertThat(e.getDependency()).isEqualTo("sms");
        assertThat(e.getPayload()).contains("\"to\":\"+100\"");
        assertThat(e.getErrorInfo().getAttributes()).containsEntry("exception", IOException.class.getName());
        assertThat(metrics.getRegistry().counter("guard.dlq.written").count()).isEqualTo(1.0);
    }

    @Test
    void receivedEntryBecomesVisibleAgainAfterTimeout() {
        String id = send();

        assertThat(dlq.receiveFromDlq(10)).extracting(DeadLetterEntry::getMessageId).containsExactly(id);
        assertThat(dlq.receiveFromDlq(10)).isEmpty();

        clock.advance(Duration.ofSeconds(30));
        assertThat(dlq.receiveFromDlq(10)).extracting(DeadLetterEntry::getMessageId).containsExactly(id);
    }

    @Test
    void receiveWithNonPositiveMaxReturnsNothing() {
        send();
        assertThat(dlq.receiveFromDlq(0)).isEmpty();
    }

    @Test
    void acknowledgeRemovesEntry() {
        String id = send();
        assertThat(dlq.acknowledge(id)).isTrue();
        assertThat(dlq.get(id)).isEmpty();
    }

    @Test
    void successfulReprocessArchivesEntry() {
        String id = send();

        assertThat(dlq.reprocessMessage(id, e -> true)).isEqualTo(ReprocessOutcome.REPROCESSED);
        assertThat(dlq.get(id).orElseThrow().getStatus()).isEqualTo(DeadLetterStatus.REPROCESSED);
        assertThat(dlq.reprocessMessage(id, e -> true)).isEqualTo(ReprocessOutcome.SKIPPED);
        assertThat(dlq.receiveFromDlq(10)).isEmpty();
    }

    @Test
    void failingReprocessRequeuesThenGivesUp() {
        String id = send();

        assertThat(dlq.reprocessMessage(id, e -> {
            throw new IOException("still down");
        })).isEqualTo(ReprocessOutcome.REQUEUED);
        DeadLetterEntry requeued = dlq.get(id).orElseThrow();
        assertThat(requeued.getStatus()).isEqualTo(DeadLetterStatus.PENDING);
        assertThat(requeued.getAttemptCount()).isEqualTo(1);
        assertThat(requeued.getLastReprocessError()).contains("still down");

        assertThat(dlq.reprocessMessage(id, e -> false)).isEqualTo(ReprocessOutcome.DEAD);
        assertThat(dlq.get(id).orElseThrow().getStatus()).isEqualTo(DeadLetterStatus.DEAD);

        ArgumentCaptor<NotificationEvent> captor = ArgumentCaptor.forClass(NotificationEvent.class);
        verify(notifier).sendNotification(captor.capture());
        assertThat(captor.getValue().getSeverity()).isEqualTo(Severity.ERROR);
        assertThat(captor.getValue().getErrorType()).isEqualTo("dead_letter:sms");
    }

    @Test
    void unknownIdIsNotFound() {
        assertThat(dlq.reprocessMessage("missing", e -> true)).isEqualTo(ReprocessOutcome.NOT_FOUND);
    }

    @Test
    void reprocessPendingCountsOutcomes() {
        String ok = send();
        send();

        Map<ReprocessOutcome, Integer> counts = dlq.reprocessPending(10, e -> e.getMessageId().equals(ok));

        assertThat(counts).containsEntry(ReprocessOutcome.REPROCESSED, 1).containsEntry(ReprocessOutcome.REQUEUED, 1);
        assertThat(dlq.countByStatus()).containsEntry(DeadLetterStatus.REPROCESSED, 1L)
                .containsEntry(DeadLetterStatus.PENDING, 1L);
    }

    @Test
    void writeFailureReturnsEmptyAndAlerts() {
        DeadLetterStore broken = mock(DeadLetterStore.class);
        when(broken.name()).thenReturn("broken");
        doThrow(new DeadLetterStoreException("disk full")).when(broken).save(any());
        DeadLetterQueue q = new DeadLetterQueue(broken, new JacksonPayloadSerializer(), props, metrics, notifier, clock);

        Optional<String> id = q.sendToDlq("sms", "payload", ErrorInfo.of("RETRY_EXHAUSTED", null, clock));

        assertThat(id).isEmpty();
        ArgumentCaptor<NotificationEvent> captor = ArgumentCaptor.forClass(NotificationEvent.class);
        verify(notifier).sendNotification(captor.capture());
        assertThat(captor.getValue().getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(metrics.getRegistry().counter("guard.dlq.write.failed").count()).isEqualTo(1.0);
    }

    @Test
    void worksWithoutNotifier() {
        DeadLetterStore broken = mock(DeadLetterStore.class);
        doThrow(new IllegalStateException("boom")).when(broken).save(any());
        DeadLetterQueue q = new DeadLetterQueue(broken, new JacksonPayloadSerializer(), props, metrics, null, clock);

        assertThat(q.sendToDlq("payload", null)).isEmpty();
        verify(notifier, never()).sendNotification(any(NotificationEvent.class));
    }

    @Test
    void purgeClearsEverything() {
        send();
        send();
        assertThat(dlq.purge()).isEqualTo(2);
        assertThat(dlq.list(null, 10)).isEmpty();
    }

    @Test
    void invalidMaxAttemptsRejected() {
        props.setMaxReprocessAttempts(0);
        assertThatThrownBy(() -> new DeadLetterQueue(mock(DeadLetterStore.class), new JacksonPayloadSerializer(),
                props, metrics, null, clock)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listFiltersByStatus() {
        send();
        String second = send();
        dlq.reprocessMessage(second, e -> true);

        List<DeadLetterEntry> pending = dlq.list(DeadLetterStatus.PENDING, 10);
        assertThat(pending).hasSize(1);
    }

    @Test
    void payloadWithoutJsonFormIsKeptAsText() {
        Optional<String> id = dlq.sendToDlq("sms", new OpaqueMessage("+100"),
                ErrorInfo.of("RETRY_EXHAUSTED", new IOException("gateway timeout"), clock));

        DeadLetterEntry e = dlq.get(id.orElseThrow()).orElseThrow();
        assertThat(e.getPayload()).isEqualTo("OpaqueMessage[+100]");
        assertThat(e.getErrorInfo().getKind()).isEqualTo("RETRY_EXHAUSTED");
        assertThat(e.getErrorInfo().getAttributes())
                .containsEntry(DeadLetterQueue.ATTR_PAYLOAD_FORMAT, DeadLetterQueue.PAYLOAD_FORMAT_TO_STRING)
                .containsEntry("exception", IOException.class.getName());
        assertThat(metrics.getRegistry().counter("guard.dlq.write.failed").count()).isZero();
        verify(notifier, never()).sendNotification(any(NotificationEvent.class));
    }

    @Test
    void plainObjectPayloadIsStillCaptured() {
        assertThat(dlq.sendToDlq("sms", new Object(), null)).isPresent();
        assertThat(dlq.list(null, 10)).singleElement()
                .satisfies(e -> assertThat(e.getErrorInfo().getAttributes())
                        .containsEntry(DeadLetterQueue.ATTR_PAYLOAD_FORMAT, DeadLetterQueue.PAYLOAD_FORMAT_TO_STRING));
    }

    @Test
    void reprocessLosingVersionRaceIsSkipped() {
        String id = send();

        ReprocessOutcome outcome = dlq.reprocessMessage(id, e -> {
            // 另一个消费者在租约期内抢先改写了同一条目
            DeadLetterEntry other = store.find(id).orElseThrow();
            other.setLastReprocessError("taken over");
            assertThat(store.update(other)).isTrue();
            return true;
        });

        assertThat(outcome).isEqualTo(ReprocessOutcome.SKIPPED);
        assertThat(dlq.get(id).orElseThrow().getStatus()).isEqualTo(DeadLetterStatus.IN_FLIGHT);
        assertThat(metrics.getRegistry().counter("guard.dlq.reprocessed").count()).isZero();
    }

    @Test
    void givingUpAfterLostRaceSendsNoAlert() {
        props.setMaxReprocessAttempts(1);
        String id = send();

        ReprocessOutcome outcome = dlq.reprocessMessage(id, e -> {
            assertThat(store.update(store.find(id).orElseThrow())).isTrue();
            return false;
        });

        assertThat(outcome).isEqualTo(ReprocessOutcome.SKIPPED);
        verify(notifier, never()).sendNotification(any(NotificationEvent.class));
    }

    /** 没有 getter, Jackson 无法序列化 */
    static final class OpaqueMessage {
        private final String to;

        OpaqueMessage(String to) {
            this.to = to;
        }

        @Override
        public String toString() {
            return "OpaqueMessage[" + to + "]";
        }
    }
}
