package com.fastguard.core.dlq.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fastguard.core.spi.PayloadSerializer;
import com.fastguard.core.spi.dlq.DeadLetterStore;
import com.fastguard.mapper.DeadLetterMapper;
import com.fastguard.model.DeadLetterEntry;
import com.fastguard.model.ErrorInfo;
import com.fastguard.model.entity.DeadLetterEntity;
import com.fastguard.model.enums.DeadLetterStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 数据库死信表 guard_dead_letter
 * 认领走 FOR UPDATE SKIP LOCKED, 多实例并发拉取互不阻塞; 状态写回以 version 做乐观锁
 */
public class MybatisDeadLetterStore implements DeadLetterStore {

    private static final Logger log = LoggerFactory.getLogger(MybatisDeadLetterStore.class);

    private static final TypeReference<LinkedHashMap<String, String>> ATTRS_TYPE = new TypeReference<>() {};

    private final DeadLetterMapper mapper;

    private final TransactionTemplate tt;

    private final PayloadSerializer serializer;

    public MybatisDeadLetterStore(DeadLetterMapper mapper, TransactionTemplate tt, PayloadSerializer serializer) {
        this.mapper = mapper;
        this.tt = tt;
        this.serializer = serializer;
    }

    @Override
    public String name() {
        return "database:guard_dead_letter";
    }

    @Override
    public void save(DeadLetterEntry entry) {
        mapper.insert(toEntity(entry));
    }

    @Override
    public Optional<DeadLetterEntry> find(String messageId) {
        return Optional.ofNullable(mapper.selectByMessageId(messageId)).map(this::toEntry);
    }

    @Override
    public List<DeadLetterEntry> claim(int max, Instant now, Instant leaseUntil) {
        List<DeadLetterEntry> claimed = tt.execute(status -> {
            // 加行锁获取条目
            List<DeadLetterEntity> locked = mapper.lockReceivable(toLocal(now), max);
            if (locked == null || locked.isEmpty()) {
                return List.of();
            }
            // 同一事务下加行锁后更新状态IN_FLIGHT
            List<Long> ids = locked.stream().map(DeadLetterEntity::getId).collect(Collectors.toList());
            int n = mapper.markInFlightBatch(ids, toLocal(leaseUntil), toLocal(now));
            if (n != ids.size()) {
                log.warn("[DLQ] claim marked {} of {} locked rows", n, ids.size());
            }
            return locked.stream().map(e -> {
                DeadLetterEntry d = toEntry(e);
                d.setStatus(DeadLetterStatus.IN_FLIGHT);
                d.setVisibleAfter(leaseUntil);
                d.setUpdatedAt(now);
                d.setVersion(d.getVersion() + 1);
                return d;
            }).collect(Collectors.toList());
        });
        return claimed == null ? List.of() : claimed;
    }

    @Override
    public boolean update(DeadLetterEntry entry) {
        int n = mapper.updateState(entry.getMessageId(), entry.getVersion(), entry.getStatus().getCode(),
                entry.getAttemptCount(), toLocal(entry.getVisibleAfter()), entry.getLastReprocessError(),
                toLocal(entry.getUpdatedAt()));
        if (n == 1) {
            entry.setVersion(entry.getVersion() + 1);
            return true;
        }
        return false;
    }

    @Override
    public boolean delete(String messageId) {
        return mapper.deleteByMessageId(messageId) > 0;
    }

    @Override
    public List<DeadLetterEntry> list(DeadLetterStatus status, int limit) {
        return mapper.selectByStatus(status == null ? null : status.getCode(), Math.max(0, limit))
                .stream().map(this::toEntry).collect(Collectors.toList());
    }

    @Override
    public Map<DeadLetterStatus, Long> countByStatus() {
        Map<DeadLetterStatus, Long> counts = new EnumMap<>(DeadLetterStatus.class);
        for (DeadLetterStatus s : DeadLetterStatus.values()) {
            counts.put(s, 0L);
        }
        for (Map<String, Object> row : mapper.countGroupByStatus()) {
            Number code = (Number) row.get("status");
            Number cnt = (Number) row.get("cnt");
            if (code != null && cnt != null) {
                counts.put(DeadLetterStatus.ofCode(code.intValue()), cnt.longValue());
            }
        }
        return counts;
    }

    @Override
    public int purge() {
        return mapper.deleteAll();
    }

    DeadLetterEntity toEntity(DeadLetterEntry e) {
        DeadLetterEntity entity = new DeadLetterEntity();
        entity.setMessageId(e.getMessageId());
        entity.setDependency(e.getDependency());
        entity.setPayload(e.getPayload());
        ErrorInfo err = e.getErrorInfo();
        if (err != null) {
            entity.setErrorKind(err.getKind());
            entity.setErrorMessage(err.getMessage());
            entity.setErrorAttributes(serializer.serialize(err.getAttributes()));
            entity.setErrorTime(toLocal(err.getTimestamp()));
        }
        entity.setAttemptCount(e.getAttemptCount());
        entity.setStatus(e.getStatus().getCode());
        entity.setVisibleAfter(toLocal(e.getVisibleAfter()));
        entity.setLastReprocessError(e.getLastReprocessError());
        entity.setVersion(e.getVersion());
        entity.setCreatedAt(toLocal(e.getCreatedAt()));
        entity.setUpdatedAt(toLocal(e.getUpdatedAt()));
        return entity;
    }

    DeadLetterEntry toEntry(DeadLetterEntity e) {
        ErrorInfo err = null;
        if (e.getErrorKind() != null || e.getErrorMessage() != null) {
            Map<String, String> attrs = serializer.deserialize(e.getErrorAttributes(), ATTRS_TYPE);
            err = ErrorInfo.builder()
                    .kind(e.getErrorKind())
                    .message(e.getErrorMessage())
                    .timestamp(toInstant(e.getErrorTime()))
                    .attributes(attrs == null ? new LinkedHashMap<>() : attrs)
                    .build();
        }
        return DeadLetterEntry.builder()
                .messageId(e.getMessageId())
                .dependency(e.getDependency())
                .payload(e.getPayload())
                .errorInfo(err)
                .attemptCount(e.getAttemptCount() == null ? 0 : e.getAttemptCount())
                .status(DeadLetterStatus.ofCode(e.getStatus()))
                .visibleAfter(toInstant(e.getVisibleAfter()))
                .lastReprocessError(e.getLastReprocessError())
                .version(e.getVersion() == null ? 0 : e.getVersion())
                .createdAt(toInstant(e.getCreatedAt()))
                .updatedAt(toInstant(e.getUpdatedAt()))
                .build();
    }

    private static LocalDateTime toLocal(Instant i) {
        return i == null ? null : LocalDateTime.ofInstant(i, ZoneOffset.UTC);
    }

    private static Instant toInstant(LocalDateTime t) {
        return t == null ? null : t.toInstant(ZoneOffset.UTC);
    }
}
