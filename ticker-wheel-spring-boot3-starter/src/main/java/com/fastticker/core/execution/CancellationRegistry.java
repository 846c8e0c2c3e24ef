package com.fastticker.core.execution;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本节点正在执行的任务的取消信号
 */
public class CancellationRegistry {

    private final Map<String, CancellationToken> running = new ConcurrentHashMap<>();

    public CancellationToken register(String tickerId) {
        CancellationToken token = new CancellationToken();
        running.put(tickerId, token);
        return token;
    }

    public void unregister(String tickerId, CancellationToken token) {
        running.remove(tickerId, token);
    }

    /**
     * @return true=任务正在本节点执行且信号已发出
     */
    public boolean request(String tickerId) {
        CancellationToken token = running.get(tickerId);
        if (token == null) {
            return false;
        }
        token.request();
        return true;
    }

    public Set<String> runningIds() {
        return Set.copyOf(running.keySet());
    }
}
