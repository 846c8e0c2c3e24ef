package com.fastticker.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.Instant;

/**
 * 节点心跳, 每个节点只写自己的一行
 */
@TableName("ticker_node")
@Data
public class NodeHeartbeatEntity {

    @TableId(type = IdType.INPUT)
    private String nodeId;

    private Instant lastHeartbeat;

    private Instant startedAt;
}
