package com.baykanat.signoff.config;

import com.baykanat.signoff.domain.engine.ComplianceEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.ZoneId;

/** Engine, as-of saat ve koşu executor bean'leri. Uygulamada "şimdi" yalnızca bu Clock'tan okunur. */
@Configuration
public class ComplianceEngineConfig {

    @Bean
    public Clock complianceClock(AppProperties appProperties) {
        return Clock.system(ZoneId.of(appProperties.getCompliance().getZone()));
    }

    @Bean
    public ComplianceEngine complianceEngine(AppProperties appProperties) {
        AppProperties.ComplianceProperties compliance = appProperties.getCompliance();
        return new ComplianceEngine(compliance.getDeferredMethodId(), compliance.getHierarchyEmailDomain());
    }

    /** Koşular tek thread'de sırayla çalışır; kuyruk dolarsa yeni koşu reddedilir. */
    @Bean
    public ThreadPoolTaskExecutor complianceRunExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(4);
        executor.setThreadNamePrefix("compliance-run-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
