package com.fastticker.core.spi;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 节点心跳存储
 * 每个节点只覆盖写自己的行, 无需跨节点加锁
 */
public interface ClusterStore {

    void heartbeat(String nodeId, Instant now);

    /** 最近心跳早于 now - ttl 的节点 */
    List<String> listDeadNodes(Duration ttl, Instant now);

    void remove(String nodeId);
}
