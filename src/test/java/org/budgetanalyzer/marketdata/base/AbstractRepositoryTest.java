package org.budgetanalyzer.marketdata.base;

import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

import org.budgetanalyzer.marketdata.config.TestContainersConfig;

/**
 * Base class for repository tests with PostgreSQL TestContainer.
 *
 * <p>Uses {@code @DataJpaTest}: only JPA components are loaded, Flyway migrations are applied, and
 * each test runs in a transaction that is rolled back afterwards. Runs against real PostgreSQL so
 * the unique constraint and jsonb mapping are exercised.
 *
 * @see org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest
 */
@DataJpaTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(TestContainersConfig.class)
public abstract class AbstractRepositoryTest {}
