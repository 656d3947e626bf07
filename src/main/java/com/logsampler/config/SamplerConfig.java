package com.logsampler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsampler.core.Sampler;
import com.logsampler.core.SamplerStats;
import com.logsampler.core.SamplerStatsReporter;
import com.logsampler.core.SamplingPolicy;
import com.logsampler.facility.Slf4jFacility;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Configuration for the sampled logging facility. Deferred count resets and
 * {@code @Scheduled} reporting run on separate schedulers.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(SamplerProperties.class)
public class SamplerConfig implements SchedulingConfigurer {

    /**
     * Scheduler that fires the deferred count resets
     */
    @Bean
    public ThreadPoolTaskScheduler samplerResetScheduler() {
        return daemonScheduler("log-sampler-reset-");
    }

    /**
     * Scheduler for {@code @Scheduled} methods such as the stats report
     */
    @Bean
    public ThreadPoolTaskScheduler samplerReportScheduler() {
        return daemonScheduler("log-sampler-report-");
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.setScheduler(samplerReportScheduler());
    }

    @Bean
    public SamplerStats samplerStats() {
        return new SamplerStats();
    }

    /**
     * Root sampled facility writing to the configured SLF4J logger
     */
    @Bean
    public Sampler sampler(SamplerProperties properties,
                           @Qualifier("samplerResetScheduler") ThreadPoolTaskScheduler resetScheduler,
                           SamplerStats samplerStats) {
        Slf4jFacility facility = new Slf4jFacility(
                properties.getLoggerName(), properties.getLevel(), new ObjectMapper().findAndRegisterModules());
        return Sampler.builder()
                .facility(facility)
                .policy(new SamplingPolicy(properties.getTick(), properties.getFirst(), properties.getThereafter()))
                .counterMode(properties.getCounterMode())
                .shardedWidth(properties.getShardedWidth())
                .shardedGroupSize(properties.getShardedGroupSize())
                .resetScheduler(resetScheduler)
                .listener(samplerStats)
                .build();
    }

    @Bean
    public SamplerStatsReporter samplerStatsReporter(SamplerStats samplerStats) {
        return new SamplerStatsReporter(samplerStats);
    }

    private static ThreadPoolTaskScheduler daemonScheduler(String threadNamePrefix) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setDaemon(true);
        scheduler.setThreadNamePrefix(threadNamePrefix);
        return scheduler;
    }
}
