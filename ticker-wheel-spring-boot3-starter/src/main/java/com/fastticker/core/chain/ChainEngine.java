package com.fastticker.core.chain;

import com.fastticker.core.spi.TickerStore;
import com.fastticker.exception.TickerValidationException;
import com.fastticker.model.entity.BaseTickerEntity;
import com.fastticker.model.entity.TimeTickerEntity;
import com.fastticker.model.enums.RunCondition;
import com.fastticker.model.enums.TickerStatus;
import com.fastticker.model.enums.TickerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 父子链
 * 父任务进入 IN_PROGRESS 或终态时, 按子任务的 RunCondition 放行（IDLE → QUEUED）
 * 未满足条件的子任务永久保持 IDLE
 */
public class ChainEngine {

    private static final Logger log = LoggerFactory.getLogger(ChainEngine.class);

    private final TickerStore store;

    private final Clock clock;

    private final int maxDepth;

    public ChainEngine(TickerStore store, Clock clock, int maxDepth) {
        this.store = store;
        this.clock = clock;
        this.maxDepth = maxDepth;
    }

    /**
     * 父任务开始执行, 放行 IN_PROGRESS 条件的子任务
     */
    public int onInProgress(BaseTickerEntity parent) {
        if (parent.type() != TickerType.TIME) {
            return 0;
        }
        return release(parent.getId(), c -> c == RunCondition.IN_PROGRESS, "IN_PROGRESS");
    }

    /**
     * 父任务到达终态, 放行条件满足的子任务
     */
    public int onTerminal(BaseTickerEntity parent, TickerStatus terminal) {
        if (parent.type() != TickerType.TIME || !terminal.isTerminal()) {
            return 0;
        }
        return release(parent.getId(), c -> c != null && c.matches(terminal), terminal.name());
    }

    /**
     * 把 childId 挂到 proposedParentId 下之前校验: 不成环, 深度不超限
     *
     * @param childId          已存在的任务 id, 新建时为 null
     * @param proposedParentId 新的父任务 id
     * @param subtreeHeight    child 自身及其后代的层数, 至少为 1
     */
    public void validateAncestry(String childId, String proposedParentId, int subtreeHeight) {
        if (proposedParentId == null) {
            if (subtreeHeight > maxDepth) {
                throw new TickerValidationException("chain depth " + subtreeHeight + " exceeds max depth " + maxDepth);
            }
            return;
        }
        if (proposedParentId.equals(childId)) {
            throw new TickerValidationException("ticker " + childId + " cannot be its own parent");
        }
        Set<String> visited = new HashSet<>();
        int ancestors = 0;
        String cursor = proposedParentId;
        while (cursor != null) {
            if (cursor.equals(childId) || !visited.add(cursor)) {
                throw new TickerValidationException("parent " + proposedParentId + " would introduce a cycle at " + cursor);
            }
            TimeTickerEntity node = store.getTimeTicker(cursor);
            if (node == null) {
                if (ancestors == 0) {
                    throw new TickerValidationException("parent ticker " + proposedParentId + " not found");
                }
                // 祖先已被删除, 链在此断开
                break;
            }
            ancestors++;
            cursor = node.getParentId();
        }
        if (ancestors + subtreeHeight > maxDepth) {
            throw new TickerValidationException("chain depth " + (ancestors + subtreeHeight)
                    + " exceeds max depth " + maxDepth);
        }
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    private int release(String parentId, Predicate<RunCondition> condition, String trigger) {
        Instant now = clock.instant();
        int queued = 0;
        for (TimeTickerEntity child : store.findChildren(parentId)) {
            if (child.getStatus() != TickerStatus.IDLE || !condition.test(child.getRunCondition())) {
                continue;
            }
            if (store.queueChild(child.getId(), now)) {
                queued++;
                log.info("[Chain] child={} of parent={} queued on {}", child.getId(), parentId, trigger);
            }
        }
        return queued;
    }
}
