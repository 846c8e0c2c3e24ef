package com.fastticker.store.mybatis;

import com.baomidou.mybatisplus.core.toolkit.Wrappers;
import com.fastticker.core.spi.ClusterStore;
import com.fastticker.exception.TickerStoreException;
import com.fastticker.mapper.NodeHeartbeatMapper;
import com.fastticker.model.entity.NodeHeartbeatEntity;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public class MybatisClusterStore implements ClusterStore {

    private final NodeHeartbeatMapper mapper;

    public MybatisClusterStore(NodeHeartbeatMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void heartbeat(String nodeId, Instant now) {
        try {
            if (mapper.touch(nodeId, now) == 1) {
                return;
            }
            NodeHeartbeatEntity e = new NodeHeartbeatEntity();
            e.setNodeId(nodeId);
            e.setLastHeartbeat(now);
            e.setStartedAt(now);
            try {
                mapper.insert(e);
            } catch (DuplicateKeyException dup) {
                mapper.touch(nodeId, now);
            }
        } catch (DataAccessException e) {
            throw new TickerStoreException("heartbeat of node " + nodeId + " failed", e);
        }
    }

    @Override
    public List<String> listDeadNodes(Duration ttl, Instant now) {
        try {
            return mapper.selectList(Wrappers.<NodeHeartbeatEntity>lambdaQuery()
                            .lt(NodeHeartbeatEntity::getLastHeartbeat, now.minus(ttl))
                            .orderByAsc(NodeHeartbeatEntity::getNodeId))
                    .stream()
                    .map(NodeHeartbeatEntity::getNodeId)
                    .toList();
        } catch (DataAccessException e) {
            throw new TickerStoreException("list dead nodes failed", e);
        }
    }

    @Override
    public void remove(String nodeId) {
        try {
            mapper.deleteById(nodeId);
        } catch (DataAccessException e) {
            throw new TickerStoreException("remove node " + nodeId + " failed", e);
        }
    }
}
