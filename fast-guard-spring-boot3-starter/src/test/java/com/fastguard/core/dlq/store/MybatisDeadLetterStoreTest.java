package com.fastguard.core.dlq.store;

import com.fastguard.core.serializer.JacksonPayloadSerializer;
import com.fastguard.mapper.DeadLetterMapper;
import com.fastguard.model.DeadLetterEntry;
import com.fastguard.model.ErrorInfo;
import com.fastguard.model.entity.DeadLetterEntity;
import com.fastguard.model.enums.DeadLetterStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MybatisDeadLetterStoreTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private DeadLetterMapper mapper;
    private MybatisDeadLetterStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        mapper = mock(DeadLetterMapper.class);
        TransactionTemplate tt = mock(TransactionTemplate.class);
        when(tt.execute(any())).thenAnswer(inv ->
                ((TransactionCallback<Object>) inv.getArgument(0)).doInTransaction(mock(TransactionStatus.class)));
        store = new MybatisDeadLetterStore(mapper, tt, new JacksonPayloadSerializer());
    }

    private static DeadLetterEntry entry() {
        return DeadLetterEntry.builder()
                .messageId("m-1")
                .dependency("payment")
                .payload("{\"orderId\":42}")
                .errorInfo(ErrorInfo.builder().kind("RETRY_EXHAUSTED").message("timeout").timestamp(NOW).build()
                        .with("attempts", 6))
                .status(DeadLetterStatus.PENDING)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    @Test
    void entityMappingKeepsAllFields() {
        DeadLetterEntity entity = store.toEntity(entry());
        entity.setId(7L);

        assertThat(entity.getStatus()).isEqualTo(DeadLetterStatus.PENDING.getCode());
        assertThat(entity.getErrorTime()).isEqualTo(LocalDateTime.of(2024, 1, 1, 0, 0));

        DeadLetterEntry back = store.toEntry(entity);
        assertThat(back).usingRecursiveComparison().isEqualTo(entry());
    }

    @Test
    void saveInsertsEntity() {
        store.save(entry());

        ArgumentCaptor<DeadLetterEntity> captor = ArgumentCaptor.forClass(DeadLetterEntity.class);
        verify(mapper).insert(captor.capture());
        assertThat(captor.getValue().getMessageId()).isEqualTo("m-1");
        assertThat(captor.getValue().getErrorAttributes()).contains("\"attempts\":\"6\"");
    }

    @Test
    void claimLocksThenMarksInFlightInOneTransaction() {
        DeadLetterEntity row = store.toEntity(entry());
        row.setId(11L);
        when(mapper.lockReceivable(any(), eq(5))).thenReturn(List.of(row));
        when(mapper.markInFlightBatch(any(), any(), any())).thenReturn(1);
        Instant lease = NOW.plusSeconds(30);

        List<DeadLetterEntry> claimed = store.claim(5, NOW, lease);

        assertThat(claimed).hasSize(1);
        assertThat(claimed.get(0).getStatus()).isEqualTo(DeadLetterStatus.IN_FLIGHT);
        assertThat(claimed.get(0).getVisibleAfter()).isEqualTo(lease);
        assertThat(claimed.get(0).getVersion()).isEqualTo(1);
        verify(mapper).markInFlightBatch(List.of(11L), LocalDateTime.ofInstant(lease, ZoneOffset.UTC),
                LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @Test
    void claimWithNothingReceivableSkipsUpdate() {
        when(mapper.lockReceivable(any(), anyInt())).thenReturn(List.of());

        assertThat(store.claim(5, NOW, NOW.plusSeconds(30))).isEmpty();
        verify(mapper, never()).markInFlightBatch(any(), any(), any());
    }

    @Test
    void updateBumpsVersionOnlyWhenRowMatched() {
        DeadLetterEntry e = entry();
        when(mapper.updateState(eq("m-1"), eq(0L), anyInt(), anyInt(), any(), any(), any())).thenReturn(1);
        assertThat(store.update(e)).isTrue();
        assertThat(e.getVersion()).isEqualTo(1);

        when(mapper.updateState(eq("m-1"), eq(1L), anyInt(), anyInt(), any(), any(), any())).thenReturn(0);
        assertThat(store.update(e)).isFalse();
        assertThat(e.getVersion()).isEqualTo(1);
    }

    @Test
    void countByStatusFillsMissingWithZero() {
        when(mapper.countGroupByStatus()).thenReturn(List.of(
                Map.<String, Object>of("status", 0, "cnt", 3L),
                Map.<String, Object>of("status", 3, "cnt", 1L)));

        assertThat(store.countByStatus())
                .containsEntry(DeadLetterStatus.PENDING, 3L)
                .containsEntry(DeadLetterStatus.DEAD, 1L)
                .containsEntry(DeadLetterStatus.IN_FLIGHT, 0L)
                .containsEntry(DeadLetterStatus.REPROCESSED, 0L);
    }

    @Test
    void deleteAndListDelegate() {
        when(mapper.deleteByMessageId(anyString())).thenReturn(1);
        when(mapper.selectByStatus(eq(DeadLetterStatus.DEAD.getCode()), eq(10))).thenReturn(List.of());

        assertThat(store.delete("m-1")).isTrue();
        assertThat(store.list(DeadLetterStatus.DEAD, 10)).isEmpty();
        verify(mapper, never()).updateState(anyString(), anyLong(), anyInt(), anyInt(), any(), any(), any());
    }
}
