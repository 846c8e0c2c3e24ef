package com.fastticker.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.fastticker.model.entity.TimeTickerEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;

@Mapper
public interface TimeTickerMapper extends BaseMapper<TimeTickerEntity> {

    /**
     * 抢占：IDLE(0)/QUEUED(1) -> IN_PROGRESS(2)，单行 CAS
     */
    @Update("""
        UPDATE time_ticker
           SET status = 2,                               -- IN_PROGRESS
               locked_by = #{nodeId},
               locked_at = #{now},
               updated_at = #{now}
         WHERE id = #{id}
           AND status IN (0, 1)                          -- IDLE or QUEUED
           AND locked_by IS NULL
        """)
    int tryClaim(@Param("id") String id, @Param("nodeId") String nodeId, @Param("now") Instant now);

    /**
     * 释放：IN_PROGRESS(2) -> QUEUED(1)，仅持有者
     */
    @Update("""
        UPDATE time_ticker
           SET status = 1,
               locked_by = NULL,
               locked_at = NULL,
               updated_at = #{now}
         WHERE id = #{id}
           AND status = 2
           AND locked_by = #{nodeId}
        """)
    int release(@Param("id") String id, @Param("nodeId") String nodeId, @Param("now") Instant now);

    /**
     * 失败后待重试, lastError 截断至 4000 字符
     */
    @Update("""
        UPDATE time_ticker
           SET status = #{status},
               next_due_at = #{nextDue},
               retry_count = #{retryCount},
               exception_message = LEFT(#{lastError}, 4000),
               locked_by = NULL,
               locked_at = NULL,
               updated_at = #{now}
         WHERE id = #{id}
           AND status = 2
           AND locked_by = #{nodeId}
        """)
    int reschedule(@Param("id") String id, @Param("nodeId") String nodeId, @Param("status") int status,
                   @Param("nextDue") Instant nextDue, @Param("retryCount") int retryCount,
                   @Param("lastError") String lastError, @Param("now") Instant now);

    /**
     * 终态写回：IN_PROGRESS(2) -> DONE/DUE_DONE/FAILED/CANCELLED/SKIPPED
     */
    @Update("""
        UPDATE time_ticker
           SET status = #{status},
               executed_at = COALESCE(#{executedAt}, executed_at),
               elapsed_millis = COALESCE(#{elapsedMillis}, elapsed_millis),
               exception_message = COALESCE(LEFT(#{error}, 4000), exception_message),
               skipped_reason = COALESCE(#{skippedReason}, skipped_reason),
               locked_by = NULL,
               locked_at = NULL,
               updated_at = #{now}
         WHERE id = #{id}
           AND status = 2
           AND locked_by = #{nodeId}
        """)
    int setTerminal(@Param("id") String id, @Param("nodeId") String nodeId, @Param("status") int status,
                    @Param("executedAt") Instant executedAt, @Param("elapsedMillis") Long elapsedMillis,
                    @Param("error") String error, @Param("skippedReason") String skippedReason,
                    @Param("now") Instant now);

    /**
     * 回收宕机节点持有的行
     */
    @Update("""
        UPDATE time_ticker
           SET status = 1,
               locked_by = NULL,
               locked_at = NULL,
               updated_at = #{now}
         WHERE status = 2
           AND locked_by = #{nodeId}
        """)
    int releaseAllLockedBy(@Param("nodeId") String nodeId, @Param("now") Instant now);

    /**
     * 子任务放行：IDLE(0) -> QUEUED(1)
     */
    @Update("""
        UPDATE time_ticker
           SET status = 1,
               execution_time = COALESCE(execution_time, #{dueAt}),
               updated_at = #{dueAt}
         WHERE id = #{id}
           AND status = 0
        """)
    int queueChild(@Param("id") String id, @Param("dueAt") Instant dueAt);

    /**
     * 立即执行：未被抢占的行到期时间提前到 now
     */
    @Update("""
        UPDATE time_ticker
           SET status = 1,
               execution_time = #{now},
               next_due_at = NULL,
               updated_at = #{now}
         WHERE id = #{id}
           AND status IN (0, 1)
           AND locked_by IS NULL
        """)
    int expedite(@Param("id") String id, @Param("now") Instant now);
}
