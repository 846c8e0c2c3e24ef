package com.fastticker.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.fastticker.model.entity.CronTickerOccurrenceEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;

@Mapper
public interface CronTickerOccurrenceMapper extends BaseMapper<CronTickerOccurrenceEntity> {

    /**
     * 抢占：IDLE(0)/QUEUED(1) -> IN_PROGRESS(2)
     */
    @Update("""
        UPDATE cron_ticker_occurrence
           SET status = 2,
               locked_by = #{nodeId},
               locked_at = #{now},
               updated_at = #{now}
         WHERE id = #{id}
           AND status IN (0, 1)
           AND locked_by IS NULL
        """)
    int tryClaim(@Param("id") String id, @Param("nodeId") String nodeId, @Param("now") Instant now);

    @Update("""
        UPDATE cron_ticker_occurrence
           SET status = 1,
               locked_by = NULL,
               locked_at = NULL,
               updated_at = #{now}
         WHERE id = #{id}
           AND status = 2
           AND locked_by = #{nodeId}
        """)
    int release(@Param("id") String id, @Param("nodeId") String nodeId, @Param("now") Instant now);

    @Update("""
        UPDATE cron_ticker_occurrence
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

    @Update("""
        UPDATE cron_ticker_occurrence
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

    @Update("""
        UPDATE cron_ticker_occurrence
           SET status = 1,
               locked_by = NULL,
               locked_at = NULL,
               updated_at = #{now}
         WHERE status = 2
           AND locked_by = #{nodeId}
        """)
    int releaseAllLockedBy(@Param("nodeId") String nodeId, @Param("now") Instant now);
}
