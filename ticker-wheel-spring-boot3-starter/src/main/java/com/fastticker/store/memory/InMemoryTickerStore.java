package com.fastticker.store.memory;

import com.fastticker.core.spi.TickerStore;
import com.fastticker.exception.TickerStoreException;
import com.fastticker.model.ExecutionRecord;
import com.fastticker.model.entity.BaseTickerEntity;
import com.fastticker.model.entity.CronTickerEntity;
import com.fastticker.model.entity.CronTickerOccurrenceEntity;
import com.fastticker.model.entity.TimeTickerEntity;
import com.fastticker.model.enums.TickerStatus;
import com.fastticker.model.enums.TickerType;
import org.springframework.beans.BeanUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 进程内存储
 * 所有状态迁移在同一把锁内完成, 对外只返回副本
 * 适用于单机、测试, 以及多个引擎实例共享同一个 store 的场景
 */
public class InMemoryTickerStore implements TickerStore {

    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, TimeTickerEntity> timeTickers = new LinkedHashMap<>();

    private final Map<String, CronTickerOccurrenceEntity> occurrences = new LinkedHashMap<>();

    private final Map<String, CronTickerEntity> cronTickers = new LinkedHashMap<>();

    private final Clock clock;

    public InMemoryTickerStore() {
        this(Clock.systemUTC());
    }

    public InMemoryTickerStore(Clock clock) {
        this.clock = clock;
    }

    // ----------------- 调度 -----------------

    @Override
    public List<BaseTickerEntity> findDue(TickerType type, Instant now, int limit) {
        return locked(() -> rows(type).values().stream()
                .filter(t -> isDue(t, now))
                .sorted(Comparator.comparing(BaseTickerEntity::dueAt))
                .limit(limit)
                .map(InMemoryTickerStore::copy)
                .toList());
    }

    @Override
    public List<CronTickerEntity> findDueCronTickers(Instant now, int limit) {
        return locked(() -> cronTickers.values().stream()
                .filter(c -> c.getNextOccurrence() != null && !c.getNextOccurrence().isAfter(now))
                .sorted(Comparator.comparing(CronTickerEntity::getNextOccurrence))
                .limit(limit)
                .map(InMemoryTickerStore::copy)
                .toList());
    }

    @Override
    public boolean tryClaim(TickerType type, String id, String nodeId, Instant now) {
        return locked(() -> {
            BaseTickerEntity t = rows(type).get(id);
            if (t == null || !t.getStatus().isClaimable() || t.getLockedBy() != null) {
                return false;
            }
            t.setStatus(TickerStatus.IN_PROGRESS);
            t.setLockedBy(nodeId);
            t.setLockedAt(now);
            touch(t);
            return true;
        });
    }

    @Override
    public boolean release(TickerType type, String id, String nodeId) {
        return locked(() -> {
            BaseTickerEntity t = ownedInProgress(type, id, nodeId);
            if (t == null) {
                return false;
            }
            t.setStatus(TickerStatus.QUEUED);
            unlock(t);
            return true;
        });
    }

    @Override
    public boolean reschedule(TickerType type, String id, String nodeId, Instant nextDue,
                              TickerStatus newStatus, int retryCount, String lastError) {
        return locked(() -> {
            BaseTickerEntity t = ownedInProgress(type, id, nodeId);
            if (t == null) {
                return false;
            }
            t.setStatus(newStatus);
            t.setNextDueAt(nextDue);
            t.setRetryCount(retryCount);
            t.setExceptionMessage(lastError);
            unlock(t);
            return true;
        });
    }

    @Override
    public boolean setTerminal(TickerType type, String id, String nodeId, TickerStatus status, ExecutionRecord record) {
        return locked(() -> {
            BaseTickerEntity t = ownedInProgress(type, id, nodeId);
            if (t == null) {
                return false;
            }
            t.setStatus(status);
            if (record.getExecutedAt() != null) t.setExecutedAt(record.getExecutedAt());
            if (record.getElapsedMillis() != null) t.setElapsedMillis(record.getElapsedMillis());
            if (record.getExceptionMessage() != null) t.setExceptionMessage(record.getExceptionMessage());
            if (record.getSkippedReason() != null) t.setSkippedReason(record.getSkippedReason());
            unlock(t);
            return true;
        });
    }

    @Override
    public int releaseAllLockedBy(String nodeId) {
        return locked(() -> {
            int n = 0;
            for (BaseTickerEntity t : allRows()) {
                if (t.getStatus() == TickerStatus.IN_PROGRESS && nodeId.equals(t.getLockedBy())) {
                    t.setStatus(TickerStatus.QUEUED);
                    unlock(t);
                    n++;
                }
            }
            return n;
        });
    }

    // ----------------- cron -----------------

    @Override
    public CronTickerOccurrenceEntity upsertOccurrence(CronTickerEntity cron, Instant boundary) {
        return locked(() -> {
            for (CronTickerOccurrenceEntity o : occurrences.values()) {
                if (o.getCronTickerId().equals(cron.getId()) && o.getExecutionTime().equals(boundary)) {
                    return copy(o);
                }
            }
            CronTickerOccurrenceEntity o = newOccurrence(cron, boundary, clock.instant());
            occurrences.put(o.getId(), o);
            return copy(o);
        });
    }

    @Override
    public boolean advanceCronTicker(String cronTickerId, Instant expectedNext, Instant newNext) {
        return locked(() -> {
            CronTickerEntity c = cronTickers.get(cronTickerId);
            if (c == null || !Objects.equals(c.getNextOccurrence(), expectedNext)) {
                return false;
            }
            c.setNextOccurrence(newNext);
            c.setUpdatedAt(clock.instant());
            return true;
        });
    }

    @Override
    public boolean existsNewerDueOccurrence(String cronTickerId, Instant boundary, Instant now) {
        return locked(() -> occurrences.values().stream()
                .anyMatch(o -> o.getCronTickerId().equals(cronTickerId)
                        && o.getExecutionTime().isAfter(boundary)
                        && !o.getExecutionTime().isAfter(now)
                        && !o.getStatus().isTerminal()));
    }

    @Override
    public boolean existsRunningOccurrenceBefore(String cronTickerId, Instant boundary) {
        return locked(() -> occurrences.values().stream()
                .anyMatch(o -> o.getCronTickerId().equals(cronTickerId)
                        && o.getExecutionTime().isBefore(boundary)
                        && o.getStatus() == TickerStatus.IN_PROGRESS));
    }

    // ----------------- 父子链 -----------------

    @Override
    public List<TimeTickerEntity> findChildren(String parentId) {
        return locked(() -> timeTickers.values().stream()
                .filter(t -> parentId.equals(t.getParentId()))
                .map(InMemoryTickerStore::copy)
                .toList());
    }

    @Override
    public boolean queueChild(String childId, Instant dueAt) {
        return locked(() -> {
            TimeTickerEntity t = timeTickers.get(childId);
            if (t == null || t.getStatus() != TickerStatus.IDLE) {
                return false;
            }
            t.setStatus(TickerStatus.QUEUED);
            if (t.getExecutionTime() == null) {
                t.setExecutionTime(dueAt);
            }
            touch(t);
            return true;
        });
    }

    @Override
    public boolean expedite(String timeTickerId, Instant now) {
        return locked(() -> {
            TimeTickerEntity t = timeTickers.get(timeTickerId);
            if (t == null || !t.getStatus().isClaimable() || t.getLockedBy() != null) {
                return false;
            }
            t.setExecutionTime(now);
            t.setNextDueAt(null);
            t.setStatus(TickerStatus.QUEUED);
            touch(t);
            return true;
        });
    }

    // ----------------- 管理 -----------------

    @Override
    public BaseTickerEntity get(TickerType type, String id) {
        return locked(() -> {
            BaseTickerEntity t = rows(type).get(id);
            return t == null ? null : copy(t);
        });
    }

    @Override
    public TimeTickerEntity getTimeTicker(String id) {
        return (TimeTickerEntity) get(TickerType.TIME, id);
    }

    @Override
    public CronTickerEntity getCronTicker(String id) {
        return locked(() -> {
            CronTickerEntity c = cronTickers.get(id);
            return c == null ? null : copy(c);
        });
    }

    @Override
    public CronTickerEntity findSeededCronTicker(String function) {
        return locked(() -> cronTickers.values().stream()
                .filter(c -> Boolean.TRUE.equals(c.getSeeded()) && function.equals(c.getFunction()))
                .findFirst()
                .map(InMemoryTickerStore::copy)
                .orElse(null));
    }

    @Override
    public int addTimeTickers(List<TimeTickerEntity> tickers) {
        return locked(() -> {
            for (TimeTickerEntity t : tickers) {
                if (timeTickers.containsKey(t.getId())) {
                    throw new TickerStoreException("duplicate time ticker id " + t.getId());
                }
            }
            Instant now = clock.instant();
            for (TimeTickerEntity t : tickers) {
                TimeTickerEntity stored = copy(t);
                stored.setCreatedAt(now);
                stored.setUpdatedAt(now);
                timeTickers.put(stored.getId(), stored);
            }
            return tickers.size();
        });
    }

    @Override
    public int updateTimeTickers(List<TimeTickerEntity> tickers) {
        return locked(() -> {
            int n = 0;
            for (TimeTickerEntity t : tickers) {
                TimeTickerEntity existing = timeTickers.get(t.getId());
                if (existing == null || !existing.getStatus().isClaimable() || existing.getLockedBy() != null) {
                    continue;
                }
                TimeTickerEntity stored = copy(t);
                stored.setCreatedAt(existing.getCreatedAt());
                stored.setUpdatedAt(clock.instant());
                stored.setLockedBy(null);
                stored.setLockedAt(null);
                timeTickers.put(stored.getId(), stored);
                n++;
            }
            return n;
        });
    }

    @Override
    public int deleteTimeTickers(Collection<String> ids) {
        return locked(() -> {
            int n = 0;
            for (String id : ids) {
                if (timeTickers.remove(id) != null) {
                    n++;
                }
            }
            return n;
        });
    }

    @Override
    public int addCronTickers(List<CronTickerEntity> tickers) {
        return locked(() -> {
            for (CronTickerEntity c : tickers) {
                if (cronTickers.containsKey(c.getId())) {
                    throw new TickerStoreException("duplicate cron ticker id " + c.getId());
                }
            }
            Instant now = clock.instant();
            for (CronTickerEntity c : tickers) {
                CronTickerEntity stored = copy(c);
                stored.setCreatedAt(now);
                stored.setUpdatedAt(now);
                cronTickers.put(stored.getId(), stored);
            }
            return tickers.size();
        });
    }

    @Override
    public int updateCronTickers(List<CronTickerEntity> tickers) {
        return locked(() -> {
            int n = 0;
            for (CronTickerEntity c : tickers) {
                CronTickerEntity existing = cronTickers.get(c.getId());
                if (existing == null) {
                    continue;
                }
                CronTickerEntity stored = copy(c);
                stored.setCreatedAt(existing.getCreatedAt());
                stored.setUpdatedAt(clock.instant());
                cronTickers.put(stored.getId(), stored);
                n++;
            }
            return n;
        });
    }

    @Override
    public int deleteCronTickers(Collection<String> ids) {
        return locked(() -> {
            int n = 0;
            for (String id : ids) {
                if (cronTickers.remove(id) != null) {
                    n++;
                    occurrences.values().removeIf(o -> o.getCronTickerId().equals(id)
                            && o.getStatus() != TickerStatus.IN_PROGRESS);
                }
            }
            return n;
        });
    }

    /** 测试辅助: 某个 cron 的全部 occurrence */
    public List<CronTickerOccurrenceEntity> occurrencesOf(String cronTickerId) {
        return locked(() -> occurrences.values().stream()
                .filter(o -> o.getCronTickerId().equals(cronTickerId))
                .sorted(Comparator.comparing(BaseTickerEntity::getExecutionTime))
                .map(InMemoryTickerStore::copy)
                .toList());
    }

    // ----------------- 内部 -----------------

    static CronTickerOccurrenceEntity newOccurrence(CronTickerEntity cron, Instant boundary, Instant now) {
        CronTickerOccurrenceEntity o = new CronTickerOccurrenceEntity();
        o.setId(UUID.randomUUID().toString());
        o.setCronTickerId(cron.getId());
        o.setFunction(cron.getFunction());
        o.setStatus(TickerStatus.IDLE);
        o.setPriority(cron.getPriority());
        o.setRetries(cron.getRetries());
        o.setRetryCount(0);
        o.setRetryIntervals(cron.getRetryIntervals());
        o.setRequestPayload(cron.getRequestPayload());
        o.setExecutionTime(boundary);
        o.setCreatedAt(now);
        o.setUpdatedAt(now);
        return o;
    }

    private static boolean isDue(BaseTickerEntity t, Instant now) {
        if (t.dueAt() == null || t.dueAt().isAfter(now) || t.getLockedBy() != null) {
            return false;
        }
        if (t.getStatus() == TickerStatus.QUEUED) {
            return true;
        }
        // 等待父任务放行的子任务不可直接执行
        return t.getStatus() == TickerStatus.IDLE
                && !(t instanceof TimeTickerEntity tt && tt.getParentId() != null);
    }

    private BaseTickerEntity ownedInProgress(TickerType type, String id, String nodeId) {
        BaseTickerEntity t = rows(type).get(id);
        if (t == null || t.getStatus() != TickerStatus.IN_PROGRESS || !Objects.equals(nodeId, t.getLockedBy())) {
            return null;
        }
        return t;
    }

    private void unlock(BaseTickerEntity t) {
        t.setLockedBy(null);
        t.setLockedAt(null);
        touch(t);
    }

    private void touch(BaseTickerEntity t) {
        t.setUpdatedAt(clock.instant());
    }

    @SuppressWarnings("unchecked")
    private Map<String, BaseTickerEntity> rows(TickerType type) {
        return (Map<String, BaseTickerEntity>) (Map<String, ? extends BaseTickerEntity>)
                (type == TickerType.TIME ? timeTickers : occurrences);
    }

    private List<BaseTickerEntity> allRows() {
        List<BaseTickerEntity> all = new ArrayList<>(timeTickers.values());
        all.addAll(occurrences.values());
        return all;
    }

    @SuppressWarnings("unchecked")
    private static <T> T copy(T source) {
        T target = (T) BeanUtils.instantiateClass(source.getClass());
        BeanUtils.copyProperties(source, target);
        return target;
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
