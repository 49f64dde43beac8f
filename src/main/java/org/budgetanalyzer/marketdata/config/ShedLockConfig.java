package org.budgetanalyzer.marketdata.config;

import javax.sql.DataSource;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;

/**
 * ShedLock configuration for the market data import job.
 *
 * <p>The import reads a row, decides, then writes it, and that sequence is not atomic against the
 * store. Holding the {@code marketDataImport} lock in the {@code shedlock} table keeps a second
 * instance from reconciling the same (series type, date) keys at the same time.
 *
 * <p>The {@code shedlock} table is created by Flyway migration V2.
 *
 * @see net.javacrumbs.shedlock.spring.annotation.SchedulerLock
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "10m")
public class ShedLockConfig {

  @Bean
  public LockProvider lockProvider(DataSource dataSource) {
    return new JdbcTemplateLockProvider(
        JdbcTemplateLockProvider.Configuration.builder()
            .withJdbcTemplate(new JdbcTemplate(dataSource))
            .usingDbTime()
            .build());
  }
}
