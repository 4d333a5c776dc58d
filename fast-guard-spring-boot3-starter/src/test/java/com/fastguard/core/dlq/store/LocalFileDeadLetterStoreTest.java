package com.fastguard.core.dlq.store;

import com.fastguard.config.GuardDeadLetterProperties;
import com.fastguard.core.dlq.DeadLetterQueue;
import com.fastguard.core.metric.GuardMetrics;
import com.fastguard.core.serializer.JacksonPayloadSerializer;
import com.fastguard.exception.DeadLetterStoreException;
import com.fastguard.model.DeadLetterEntry;
import com.fastguard.model.ErrorInfo;
import com.fastguard.model.enums.DeadLetterStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalFileDeadLetterStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @TempDir
    Path dir;

    private Path file;
    private JacksonPayloadSerializer serializer;
    private LocalFileDeadLetterStore store;

    @BeforeEach
    void setUp() {
        file = dir.resolve("nested/local_dlq.jsonl");
        serializer = new JacksonPayloadSerializer();
        store = new LocalFileDeadLetterStore(file, serializer);
    }

    private static DeadLetterEntry entry(String id) {
        return DeadLetterEntry.builder()
                .messageId(id)
                .dependency("payment")
                .payload("{\"orderId\":42}")
                .errorInfo(ErrorInfo.builder().kind("RETRY_EXHAUSTED").message("timeout").timestamp(T0).build()
                        .with("attempts", 6))
                .status(DeadLetterStatus.PENDING)
                .createdAt(T0)
                .updatedAt(T0)
                .build();
    }

    @Test
    void savedEntriesSurviveRestart() throws Exception {
        store.save(entry("a"));
        store.save(entry("b"));
        List<DeadLetterEntry> claimed = store.claim(1, T0, T0.plusSeconds(30));
        assertThat(claimed).extracting(DeadLetterEntry::getMessageId).containsExactly("a");

        LocalFileDeadLetterStore reopened = new LocalFileDeadLetterStore(file, serializer);

        DeadLetterEntry a = reopened.find("a").orElseThrow();
        assertThat(a.getStatus()).isEqualTo(DeadLetterStatus.IN_FLIGHT);
        assertThat(a.getVisibleAfter()).isEqualTo(T0.plusSeconds(30));
        assertThat(a.getErrorInfo().getAttributes()).containsEntry("attempts", "6");
        assertThat(reopened.find("b").orElseThrow().getStatus()).isEqualTo(DeadLetterStatus.PENDING);
        assertThat(Files.readAllLines(file)).hasSize(3);
    }

    @Test
    void tornTailIsDroppedOnRecovery() throws Exception {
        store.save(entry("a"));
        Files.write(file, "{\"messageId\":\"b\",\"sta".getBytes(StandardCharsets.UTF_8), StandardOpenOption.APPEND);

        LocalFileDeadLetterStore reopened = new LocalFileDeadLetterStore(file, serializer);

        assertThat(reopened.list(null, 10)).extracting(DeadLetterEntry::getMessageId).containsExactly("a");
        assertThat(new String(Files.readAllBytes(file), StandardCharsets.UTF_8)).endsWith("\n");
        reopened.save(entry("c"));
        assertThat(new LocalFileDeadLetterStore(file, serializer).list(null, 10))
                .extracting(DeadLetterEntry::getMessageId).containsExactly("a", "c");
    }

    @Test
    void unreadableLineIsSkipped() throws Exception {
        store.save(entry("a"));
        Files.write(file, "not-json\n".getBytes(StandardCharsets.UTF_8), StandardOpenOption.APPEND);
        store = new LocalFileDeadLetterStore(file, serializer);
        store.save(entry("b"));

        assertThat(new LocalFileDeadLetterStore(file, serializer).list(null, 10)).hasSize(2);
    }

    @Test
    void claimHonoursVisibilityTimeout() {
        store.save(entry("a"));
        assertThat(store.claim(10, T0, T0.plusSeconds(30))).hasSize(1);
        assertThat(store.claim(10, T0.plusSeconds(29), T0.plusSeconds(59))).isEmpty();
        assertThat(store.claim(10, T0.plusSeconds(30), T0.plusSeconds(60))).hasSize(1);
    }

    @Test
    void updateUsesOptimisticVersion() {
        store.save(entry("a"));
        DeadLetterEntry first = store.find("a").orElseThrow();
        DeadLetterEntry second = store.find("a").orElseThrow();

        first.setStatus(DeadLetterStatus.REPROCESSED);
        assertThat(store.update(first)).isTrue();
        assertThat(first.getVersion()).isEqualTo(1);

        second.setStatus(DeadLetterStatus.DEAD);
        assertThat(store.update(second)).isFalse();
        assertThat(store.find("a").orElseThrow().getStatus()).isEqualTo(DeadLetterStatus.REPROCESSED);
    }

    @Test
    void terminalEntriesAreNotClaimed() {
        store.save(entry("a"));
        DeadLetterEntry a = store.find("a").orElseThrow();
        a.setStatus(DeadLetterStatus.DEAD);
        store.update(a);

        assertThat(store.claim(10, T0, T0.plusSeconds(30))).isEmpty();
        assertThat(store.countByStatus()).containsEntry(DeadLetterStatus.DEAD, 1L)
                .containsEntry(DeadLetterStatus.PENDING, 0L);
    }

    @Test
    void duplicateIdRejected() {
        store.save(entry("a"));
        assertThatThrownBy(() -> store.save(entry("a"))).isInstanceOf(DeadLetterStoreException.class);
    }

    @Test
    void returnedEntriesAreCopies() {
        store.save(entry("a"));
        store.find("a").orElseThrow().getErrorInfo().with("mutated", true);
        assertThat(store.find("a").orElseThrow().getErrorInfo().getAttributes()).doesNotContainKey("mutated");
    }

    @Test
    void deleteAndCompactRewriteFile() throws Exception {
        store.save(entry("a"));
        store.save(entry("b"));
        store.claim(10, T0, T0.plusSeconds(30));
        assertThat(Files.readAllLines(file)).hasSize(4);

        store.compact();
        assertThat(Files.readAllLines(file)).hasSize(2);

        assertThat(store.delete("a")).isTrue();
        assertThat(store.delete("a")).isFalse();
        assertThat(new LocalFileDeadLetterStore(file, serializer).list(null, 10))
                .extracting(DeadLetterEntry::getMessageId).containsExactly("b");
    }

    @Test
    void purgeEmptiesStore() throws Exception {
        store.save(entry("a"));
        store.save(entry("b"));

        assertThat(store.purge()).isEqualTo(2);
        assertThat(Files.size(file)).isZero();
        assertThat(store.list(null, 10)).isEmpty();
    }

    @Test
    void listFiltersAndLimits() {
        store.save(entry("a"));
        store.save(entry("b"));
        store.save(entry("c"));
        store.claim(1, T0, T0.plusSeconds(30));

        assertThat(store.list(DeadLetterStatus.PENDING, 10)).extracting(DeadLetterEntry::getMessageId)
                .containsExactly("b", "c");
        assertThat(store.list(null, 2)).hasSize(2);
    }

    @Test
    void failedDeleteKeepsEntryInMemoryAndOnDisk() throws Exception {
        store.save(entry("a"));
        store.save(entry("b"));
        // 临时文件位置被目录占住, 重写必然失败
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.createDirectories(tmp);
        Files.write(tmp.resolve("blocker"), new byte[]{1});

        assertThatThrownBy(() -> store.delete("a")).isInstanceOf(DeadLetterStoreException.class);

        assertThat(store.find("a")).isPresent();
        assertThat(new LocalFileDeadLetterStore(file, serializer).list(null, 10))
                .extracting(DeadLetterEntry::getMessageId).containsExactly("a", "b");
    }

    @Test
    void concurrentSendersGetDistinctIdsAndNoLostWrites() throws Exception {
        int senders = 32;
        DeadLetterQueue dlq = new DeadLetterQueue(store, serializer, new GuardDeadLetterProperties(),
                GuardMetrics.simple(), null, Clock.systemUTC());
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Optional<String>>> futures = new ArrayList<>();
            for (int i = 0; i < senders; i++) {
                int n = i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return dlq.sendToDlq("payment", Map.of("orderId", n),
                            ErrorInfo.builder().kind("RETRY_EXHAUSTED").timestamp(T0).build());
                }));
            }
            start.countDown();
            Set<String> ids = new HashSet<>();
            for (Future<Optional<String>> f : futures) {
                ids.add(f.get(10, TimeUnit.SECONDS).orElseThrow());
            }

            assertThat(ids).hasSize(senders);
            assertThat(Files.readAllLines(file)).hasSize(senders);
            store.recover();
            assertThat(store.list(null, 100)).extracting(DeadLetterEntry::getMessageId)
                    .containsExactlyInAnyOrderElementsOf(ids);
        } finally {
            pool.shutdownNow();
        }
    }
}
