package com.work.federation.config;

import com.work.federation.repository.NegotiationRunRepository;
import com.work.federation.repository.impl.MybatisNegotiationRunRepository;
import com.work.federation.repository.mapper.FederationRunMapper;
import com.work.federation.repository.mapper.FederationRunStepMapper;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * federation.storage=postgres 时启用：扫描 Mapper 并以 PostgreSQL 保存运行记录。
 * 需要同时激活 postgres profile（见 application.yml）以启用数据源自动配置。
 */
@Configuration
@ConditionalOnProperty(prefix = "federation", name = "storage", havingValue = "postgres")
@MapperScan("com.work.federation.repository.mapper")
public class PersistenceConfiguration {

    @Bean
    public NegotiationRunRepository mybatisNegotiationRunRepository(FederationRunMapper runMapper,
                                                                    FederationRunStepMapper stepMapper) {
        return new MybatisNegotiationRunRepository(runMapper, stepMapper);
    }
}
