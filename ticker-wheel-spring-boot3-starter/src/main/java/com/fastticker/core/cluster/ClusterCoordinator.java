package com.fastticker.core.cluster;

import com.fastticker.core.metric.TickerMetrics;
import com.fastticker.core.notify.NotifyContexts;
import com.fastticker.core.notify.NotifyingFacade;
import com.fastticker.core.spi.ClusterStore;
import com.fastticker.core.spi.TickerStore;
import com.fastticker.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 节点心跳与宕机回收
 * 回收只保证活性: 互斥始终由存储层的抢占 CAS 保证
 */
public class ClusterCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ClusterCoordinator.class);

    private final String nodeId;

    private final ClusterStore clusterStore;

    private final TickerStore tickerStore;

    private final Duration nodeTtl;

    private final TickerMetrics metrics;

    private final NotifyingFacade notifyService;

    private final Clock clock;

    /** 本节点最近一次成功写入的心跳 */
    private volatile Instant lastHeartbeat;

    public ClusterCoordinator(String nodeId, ClusterStore clusterStore, TickerStore tickerStore, Duration nodeTtl,
                              TickerMetrics metrics, NotifyingFacade notifyService, Clock clock) {
        this.nodeId = nodeId;
        this.clusterStore = clusterStore;
        this.tickerStore = tickerStore;
        this.nodeTtl = nodeTtl;
        this.metrics = metrics;
        this.notifyService = notifyService;
        this.clock = clock;
    }

    public void heartbeat() {
        Instant now = clock.instant();
        clusterStore.heartbeat(nodeId, now);
        lastHeartbeat = now;
    }

    /**
     * 找出心跳超过 TTL 的节点, 把它们持有的 IN_PROGRESS 行退回 QUEUED
     *
     * @return 释放的行数
     */
    public int reclaimDeadNodes() {
        Instant now = clock.instant();
        List<String> dead = clusterStore.listDeadNodes(nodeTtl, now);
        int total = 0;
        for (String deadNode : dead) {
            if (deadNode.equals(nodeId)) {
                // 自己的心跳过期说明本节点曾长时间停顿, 不回收自己
                continue;
            }
            int released = tickerStore.releaseAllLockedBy(deadNode);
            clusterStore.remove(deadNode);
            total += released;
            metrics.incReclaimed(released);
            log.warn("[Cluster] node={} considered dead (ttl={}), released {} tickers", deadNode, nodeTtl, released);
            notifyService.fire(NotifyContexts.ctxForReclaimed(nodeId, deadNode, released, clock),
                    released > 0 ? Severity.WARNING : Severity.INFO);
        }
        return total;
    }

    /**
     * 心跳 + 回收, 供时间轮周期调用, 异常只记录
     */
    public void tick() {
        try {
            heartbeat();
            reclaimDeadNodes();
        } catch (RuntimeException e) {
            log.error("[Cluster] heartbeat/reclaim of node={} failed", nodeId, e);
            notifyService.fire(NotifyContexts.ctxForEngineError(nodeId, "cluster-heartbeat", e, clock), Severity.ERROR);
        }
    }

    /**
     * 正常下线: 删除自己的心跳行
     */
    public void leave() {
        try {
            clusterStore.remove(nodeId);
            lastHeartbeat = null;
            log.info("[Cluster] node={} left the cluster", nodeId);
        } catch (RuntimeException e) {
            log.warn("[Cluster] node={} failed to remove heartbeat, it will expire after {}", nodeId, nodeTtl, e);
        }
    }

    /**
     * 本节点心跳仍在 TTL 内才允许抢占, 避免被其他节点判死后继续抢任务
     */
    public boolean isSelfAlive() {
        Instant hb = lastHeartbeat;
        return hb != null && !hb.plus(nodeTtl).isBefore(clock.instant());
    }

    public String getNodeId() {
        return nodeId;
    }

    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }
}
