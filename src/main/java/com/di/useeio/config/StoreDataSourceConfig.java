package com.di.useeio.config;

import com.di.useeio.schema.SchemaMigrator;
import com.di.useeio.util.HikariPools;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Connection pool, JDBC template, transactions and Flyway for the USEEIO store,
 * all built from {@link StoreProperties}.
 */
@Configuration(proxyBeanMethods = false)
public class StoreDataSourceConfig {

    @Bean(destroyMethod = "close")
    public HikariDataSource storeDataSource(StoreProperties properties) {
        return HikariPools.create(properties.getDatasource().toDbConfigSnapshot());
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public SchemaMigrator schemaMigrator(DataSource dataSource, StoreProperties properties) {
        return new SchemaMigrator(dataSource, properties.getMigration());
    }
}
