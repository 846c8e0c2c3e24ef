package com.fastticker.store.memory;

import com.fastticker.core.spi.ClusterStore;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryClusterStore implements ClusterStore {

    private final Map<String, Instant> heartbeats = new ConcurrentHashMap<>();

    @Override
    public void heartbeat(String nodeId, Instant now) {
        heartbeats.put(nodeId, now);
    }

    @Override
    public List<String> listDeadNodes(Duration ttl, Instant now) {
        Instant threshold = now.minus(ttl);
        return heartbeats.entrySet().stream()
                .filter(e -> e.getValue().isBefore(threshold))
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    @Override
    public void remove(String nodeId) {
        heartbeats.remove(nodeId);
    }

    /** 最近一次心跳, 没有则为 null */
    public Instant lastHeartbeat(String nodeId) {
        return heartbeats.get(nodeId);
    }
}
