package com.fastticker.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.fastticker.model.entity.NodeHeartbeatEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;

@Mapper
public interface NodeHeartbeatMapper extends BaseMapper<NodeHeartbeatEntity> {

    @Update("""
        UPDATE ticker_node
           SET last_heartbeat = #{now}
         WHERE node_id = #{nodeId}
        """)
    int touch(@Param("nodeId") String nodeId, @Param("now") Instant now);
}
