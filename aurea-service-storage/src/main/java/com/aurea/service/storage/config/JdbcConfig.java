package com.aurea.service.storage.config;

import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@Slf4j
@Configuration
@ConditionalOnClass(NamedParameterJdbcTemplate.class)
public class JdbcConfig {

    @Bean
    @ConditionalOnMissingBean
    public JdbcTemplate jdbcTemplate(DataSource dataSource, StorageProperties storage) {
        JdbcTemplate template = new JdbcTemplate(dataSource);
        tune(template, storage);
        log.info(
                "Analytics JDBC template queryTimeoutSeconds={} fetchSize={}",
                storage.getQueryTimeoutSeconds(),
                storage.getFetchSize());
        return template;
    }

    @Bean
    @ConditionalOnMissingBean
    public NamedParameterJdbcTemplate namedParameterJdbcTemplate(JdbcTemplate jdbcTemplate) {
        return new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    static void tune(JdbcTemplate template, StorageProperties storage) {
        if (storage.getQueryTimeoutSeconds() > 0) {
            template.setQueryTimeout(storage.getQueryTimeoutSeconds());
        }
        if (storage.getFetchSize() > 0) {
            template.setFetchSize(storage.getFetchSize());
        }
    }
}
