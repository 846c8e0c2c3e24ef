package com.fastticker.autoconfig;

import com.baomidou.mybatisplus.extension.spring.MybatisSqlSessionFactoryBean;
import com.fastticker.core.spi.ClusterStore;
import com.fastticker.core.spi.TickerStore;
import com.fastticker.mapper.CronTickerMapper;
import com.fastticker.mapper.CronTickerOccurrenceMapper;
import com.fastticker.mapper.NodeHeartbeatMapper;
import com.fastticker.mapper.TimeTickerMapper;
import com.fastticker.store.mybatis.MybatisClusterStore;
import com.fastticker.store.mybatis.MybatisTickerStore;
import org.apache.ibatis.session.SqlSessionFactory;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * 有数据源时使用 MyBatis-Plus 持久化, 否则回落到内存存储
 */
@AutoConfiguration(
        after = TickerTxAutoConfiguration.class,
        afterName = {
                "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration",
                "com.baomidou.mybatisplus.autoconfigure.MybatisPlusAutoConfiguration"
        })
@ConditionalOnClass({
        SqlSessionFactory.class,
        MybatisSqlSessionFactoryBean.class
})
@ConditionalOnBean({DataSource.class, TransactionTemplate.class})
@MapperScan(basePackages = "com.fastticker.mapper")
public class TickerWheelMybatisAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(TickerStore.class)
    public TickerStore mybatisTickerStore(TimeTickerMapper timeMapper,
                                          CronTickerOccurrenceMapper occurrenceMapper,
                                          CronTickerMapper cronMapper,
                                          TransactionTemplate tt) {
        return new MybatisTickerStore(timeMapper, occurrenceMapper, cronMapper, tt, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean(ClusterStore.class)
    public ClusterStore mybatisClusterStore(NodeHeartbeatMapper mapper) {
        return new MybatisClusterStore(mapper);
    }
}
