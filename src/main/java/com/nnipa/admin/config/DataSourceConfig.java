package com.nnipa.admin.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Connection pool configuration.
 *
 * The pool is the only shared mutable resource of the service. It is built once on
 * startup and closed on shutdown; everything else reaches it through the unit of work
 * manager.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class DataSourceConfig {

    private final AdminProperties adminProperties;

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource() {
        AdminProperties.Datasource props = adminProperties.getDatasource();

        HikariConfig config = new HikariConfig();
        config.setPoolName(props.getPoolName());
        config.setJdbcUrl(props.getUrl());
        config.setUsername(props.getUsername());
        config.setPassword(props.getPassword());
        if (StringUtils.hasText(props.getDriverClassName())) {
            config.setDriverClassName(props.getDriverClassName());
        }

        // Hikari has no overflow notion: the steady size stays warm, overflow connections idle out
        config.setMinimumIdle(props.getPoolSize());
        config.setMaximumPoolSize(props.getPoolSize() + props.getMaxOverflow());
        config.setConnectionTimeout(props.getConnectionTimeoutMs());
        config.setIdleTimeout(props.getIdleTimeoutMs());
        config.setMaxLifetime(props.getMaxLifetimeMs());
        config.setKeepaliveTime(props.getKeepaliveTimeMs());
        config.setValidationTimeout(props.getValidationTimeoutMs());
        if (StringUtils.hasText(props.getConnectionTestQuery())) {
            config.setConnectionTestQuery(props.getConnectionTestQuery());
        }

        log.info("Initializing connection pool '{}' (size={}, maxOverflow={}, maxLifetimeMs={})",
                props.getPoolName(), props.getPoolSize(), props.getMaxOverflow(), props.getMaxLifetimeMs());

        return new HikariDataSource(config);
    }
}
