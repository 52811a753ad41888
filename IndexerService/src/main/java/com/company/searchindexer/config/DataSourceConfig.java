package com.company.searchindexer.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Dos orígenes de datos: el principal (PostgreSQL) guarda los procesos vía JPA,
 * el de publicaciones (MySQL) es de solo lectura y se consulta con JdbcTemplate.
 */
@Configuration
public class DataSourceConfig {

    @Bean
    @Primary
    @ConfigurationProperties("spring.datasource")
    public DataSourceProperties jobStoreDataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    @Primary
    public DataSource jobStoreDataSource(DataSourceProperties jobStoreDataSourceProperties) {
        return jobStoreDataSourceProperties.initializeDataSourceBuilder().build();
    }

    @Bean
    @ConfigurationProperties("app.source.datasource")
    public DataSourceProperties publicationDataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    public DataSource publicationDataSource(
            @Qualifier("publicationDataSourceProperties") DataSourceProperties properties) {
        return properties.initializeDataSourceBuilder().build();
    }

    @Bean
    public JdbcTemplate publicationJdbcTemplate(@Qualifier("publicationDataSource") DataSource dataSource) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout(60);
        return jdbcTemplate;
    }
}
