package com.fastguard.core.dlq.store;

import com.fastguard.core.spi.PayloadSerializer;
import com.fastguard.core.spi.dlq.DeadLetterStore;
import com.fastguard.exception.DeadLetterStoreException;
import com.fastguard.model.DeadLetterEntry;
import com.fastguard.model.enums.DeadLetterStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 本地 JSON-lines 死信文件
 * <p>
 * 只追加: 每次变更写一行完整快照, 同一 messageId 以最后一行为准.
 * 启动时全量扫描重建索引, 末尾被截断的半行直接丢弃.
 * 写入由进程内锁串行化, 并在文件上加排他锁后 force 落盘.
 * 索引常驻内存, 同一文件只应由一个进程持有读写.
 */
public class LocalFileDeadLetterStore implements DeadLetterStore {

    private static final Logger log = LoggerFactory.getLogger(LocalFileDeadLetterStore.class);

    private final Path path;

    private final PayloadSerializer serializer;

    private final ReentrantLock lock = new ReentrantLock();

    /** messageId -> 最新快照, 按首次写入排序; 仅在 lock 内访问 */
    private final Map<String, DeadLetterEntry> index = new LinkedHashMap<>();

    public LocalFileDeadLetterStore(Path path, PayloadSerializer serializer) {
        this.path = path;
        this.serializer = serializer;
        recover();
    }

    @Override
    public String name() {
        return "local-file:" + path;
    }

    /**
     * 扫描文件重建索引
     */
    void recover() {
        lock.lock();
        try {
            index.clear();
            if (!Files.exists(path)) {
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                return;
            }
            byte[] bytes = Files.readAllBytes(path);
            int end = lastNewline(bytes) + 1;
            if (end < bytes.length) {
                // 上次写到一半进程退出
                log.warn("[DLQ] drop torn tail of {} ({} bytes)", path, bytes.length - end);
                try (FileChannel ch = FileChannel.open(path, StandardOpenOption.WRITE)) {
                    ch.truncate(end);
                    ch.force(true);
                }
            }
            int lines = 0, skipped = 0;
            for (String line : new String(bytes, 0, end, StandardCharsets.UTF_8).split("\n")) {
                if (line.isBlank()) {
                    continue;
                }
                lines++;
                try {
                    DeadLetterEntry e = serializer.deserialize(line, DeadLetterEntry.class);
                    if (e == null || e.getMessageId() == null) {
                        skipped++;
                        continue;
                    }
                    index.put(e.getMessageId(), e);
                } catch (IllegalStateException ex) {
                    skipped++;
                    log.warn("[DLQ] skip unreadable line in {}: {}", path, ex.getMessage());
                }
            }
            log.info("[DLQ] recovered {} entries from {} ({} lines, {} skipped)", index.size(), path, lines, skipped);
        } catch (IOException e) {
            throw new DeadLetterStoreException("failed to recover dead letter file " + path, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void save(DeadLetterEntry entry) {
        lock.lock();
        try {
            if (index.containsKey(entry.getMessageId())) {
                throw new DeadLetterStoreException("duplicate messageId " + entry.getMessageId());
            }
            DeadLetterEntry snapshot = entry.copy();
            append(List.of(snapshot));
            index.put(snapshot.getMessageId(), snapshot);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<DeadLetterEntry> find(String messageId) {
        lock.lock();
        try {
            DeadLetterEntry e = index.get(messageId);
            return Optional.ofNullable(e == null ? null : e.copy());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<DeadLetterEntry> claim(int max, Instant now, Instant leaseUntil) {
        lock.lock();
        try {
            List<DeadLetterEntry> claimed = new ArrayList<>();
            for (DeadLetterEntry e : index.values()) {
                if (claimed.size() >= max) {
                    break;
                }
                if (!e.isReceivable(now)) {
                    continue;
                }
                DeadLetterEntry next = e.copy();
                next.setStatus(DeadLetterStatus.IN_FLIGHT);
                next.setVisibleAfter(leaseUntil);
                next.setUpdatedAt(now);
                next.setVersion(e.getVersion() + 1);
                claimed.add(next);
            }
            if (claimed.isEmpty()) {
                return claimed;
            }
            append(claimed);
            claimed.forEach(c -> index.put(c.getMessageId(), c));
            return claimed.stream().map(DeadLetterEntry::copy).collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean update(DeadLetterEntry entry) {
        lock.lock();
        try {
            DeadLetterEntry cur = index.get(entry.getMessageId());
            if (cur == null || cur.getVersion() != entry.getVersion()) {
                return false;
            }
            DeadLetterEntry next = entry.copy();
            next.setVersion(entry.getVersion() + 1);
            append(List.of(next));
            index.put(next.getMessageId(), next);
            entry.setVersion(next.getVersion());
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String messageId) {
        lock.lock();
        try {
            if (!index.containsKey(messageId)) {
                return false;
            }
            // 追加日志无法表达删除, 按剩余条目重写; 文件替换成功后才改内存索引
            List<DeadLetterEntry> remaining = new ArrayList<>(index.size());
            for (DeadLetterEntry e : index.values()) {
                if (!e.getMessageId().equals(messageId)) {
                    remaining.add(e);
                }
            }
            rewrite(remaining);
            index.remove(messageId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<DeadLetterEntry> list(DeadLetterStatus status, int limit) {
        lock.lock();
        try {
            return index.values().stream()
                    .filter(e -> status == null || e.getStatus() == status)
                    .limit(Math.max(0, limit))
                    .map(DeadLetterEntry::copy)
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<DeadLetterStatus, Long> countByStatus() {
        lock.lock();
        try {
            Map<DeadLetterStatus, Long> counts = new EnumMap<>(DeadLetterStatus.class);
            for (DeadLetterStatus s : DeadLetterStatus.values()) {
                counts.put(s, 0L);
            }
            index.values().forEach(e -> counts.merge(e.getStatus(), 1L, Long::sum));
            return counts;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int purge() {
        lock.lock();
        try {
            int n = index.size();
            if (Files.exists(path)) {
                try (FileChannel ch = FileChannel.open(path, StandardOpenOption.WRITE);
                     FileLock ignored = ch.lock()) {
                    ch.truncate(0);
                    ch.force(true);
                } catch (IOException e) {
                    throw new DeadLetterStoreException("failed to purge " + path, e);
                }
            }
            index.clear();
            log.info("[DLQ] purged {} entries from {}", n, path);
            return n;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 压缩: 每个 messageId 只保留最新一行
     */
    public void compact() {
        lock.lock();
        try {
            rewrite(new ArrayList<>(index.values()));
            log.info("[DLQ] compacted {} to {} entries", path, index.size());
        } finally {
            lock.unlock();
        }
    }

    public Path getPath() {
        return path;
    }

    private void rewrite(List<DeadLetterEntry> entries) {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                writeFully(ch, render(entries));
                ch.force(true);
            }
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new DeadLetterStoreException("failed to rewrite " + path, e);
        }
    }

    private void append(List<DeadLetterEntry> entries) {
        ByteBuffer buf = render(entries);
        try (FileChannel ch = FileChannel.open(path, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.APPEND);
             FileLock ignored = ch.lock()) {
            writeFully(ch, buf);
            ch.force(false);
        } catch (IOException e) {
            throw new DeadLetterStoreException("failed to append to " + path, e);
        }
    }

    private ByteBuffer render(List<DeadLetterEntry> entries) {
        StringBuilder sb = new StringBuilder();
        for (DeadLetterEntry e : entries) {
            sb.append(serializer.serialize(e)).append('\n');
        }
        return ByteBuffer.wrap(sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    private static void writeFully(FileChannel ch, ByteBuffer buf) throws IOException {
        while (buf.hasRemaining()) {
            ch.write(buf);
        }
    }

    private static int lastNewline(byte[] bytes) {
        for (int i = bytes.length - 1; i >= 0; i--) {
            if (bytes[i] == '\n') {
                return i;
            }
        }
        return -1;
    }
}
