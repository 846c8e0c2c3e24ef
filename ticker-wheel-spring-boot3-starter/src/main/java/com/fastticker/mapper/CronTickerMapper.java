package com.fastticker.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.fastticker.model.entity.CronTickerEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;

@Mapper
public interface CronTickerMapper extends BaseMapper<CronTickerEntity> {

    /**
     * 推进下一个边界, 以旧值做 CAS, 多节点只有一个成功
     */
    @Update("""
        UPDATE cron_ticker
           SET next_occurrence = #{newNext},
               updated_at = #{now}
         WHERE id = #{id}
           AND next_occurrence = #{expectedNext}
        """)
    int advance(@Param("id") String id, @Param("expectedNext") Instant expectedNext,
                @Param("newNext") Instant newNext, @Param("now") Instant now);
}
