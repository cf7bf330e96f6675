package com.mifinca.backend.global.config;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Repositories live under each module's {@code infrastructure.persistence} package. Auditing only
 * fills {@code created_at}/{@code updated_at}; owner, recorder and grantor columns are set by the
 * services because access checks read them.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.mifinca.backend.modules")
@EnableJpaAuditing(dateTimeProviderRef = "auditingDateTimeProvider")
public class JpaConfig {

    /**
     * Audit timestamps come from the same UTC clock the services use for event dates.
     */
    @Bean
    public DateTimeProvider auditingDateTimeProvider(Clock clock) {
        return () -> Optional.of(OffsetDateTime.now(clock));
    }
}
