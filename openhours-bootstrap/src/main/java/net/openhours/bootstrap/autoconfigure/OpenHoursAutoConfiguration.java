package net.openhours.bootstrap.autoconfigure;

import net.openhours.bootstrap.props.OpenHoursProperties;
import net.openhours.core.config.EngineConfig;
import net.openhours.core.config.RetentionConfig;
import net.openhours.core.maintenance.RetentionService;
import net.openhours.core.service.AvailabilityEngine;
import net.openhours.core.service.BlackoutService;
import net.openhours.core.service.BookingAdmissionCheck;
import net.openhours.core.service.WeekOperationService;
import net.openhours.core.spi.AuditRepository;
import net.openhours.core.spi.AvailabilityCache;
import net.openhours.core.spi.BlackoutRepository;
import net.openhours.core.spi.Clock;
import net.openhours.core.spi.DayStore;
import net.openhours.core.spi.InstructorZoneResolver;
import net.openhours.core.spi.OutboxRepository;
import net.openhours.core.spi.TxRunner;
import net.openhours.integration.spring.OpenHoursSpringConfig;
import net.openhours.integration.spring.cache.CaffeineAvailabilityCache;
import net.openhours.integration.spring.sched.RetentionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.time.ZoneId;

@AutoConfiguration
@EnableConfigurationProperties(OpenHoursProperties.class)
@Import(OpenHoursSpringConfig.class) // integration-spring: repos/tx wiring
public class OpenHoursAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(OpenHoursAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean
    public Clock openHoursClock() {
        return Instant::now;
    }

    @Bean
    @ConditionalOnMissingBean
    public InstructorZoneResolver instructorZoneResolver(OpenHoursProperties props) {
        return InstructorZoneResolver.fixed(ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean(AvailabilityCache.class)
    @ConditionalOnProperty(prefix = "openhours.cache", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CaffeineAvailabilityCache availabilityCache(OpenHoursProperties props) {
        return new CaffeineAvailabilityCache(props.getCache().getMaximumSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public EngineConfig engineConfig(OpenHoursProperties props) {
        var g = props.getGuardrails();
        var c = props.getCache();
        return EngineConfig.builder()
                .forbidPastEdits(g.isForbidPastEdits())
                .pastEditWindowDays(g.getPastEditWindowDays())
                .clampCopyToFuture(g.isClampCopyToFuture())
                .suppressPastEvents(g.isSuppressPastEvents())
                .requireBaseVersion(g.isRequireBaseVersion())
                .slotMinutes(g.getSlotMinutes())
                .auditEnabled(props.getAudit().isEnabled())
                .hotTtl(c.getHotTtl())
                .warmTtl(c.getWarmTtl())
                .build();
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public AvailabilityEngine availabilityEngine(DayStore store,
                                                 TxRunner tx,
                                                 Clock clock,
                                                 InstructorZoneResolver zones,
                                                 EngineConfig config,
                                                 ObjectProvider<AvailabilityCache> cache,
                                                 AuditRepository audits,
                                                 OutboxRepository outbox,
                                                 BlackoutRepository blackouts) {
        log.info("OpenHours engine: {}", config);
        return new AvailabilityEngine(store, tx, clock, zones, config,
                cache.getIfAvailable(), audits, outbox, blackouts);
    }

    @Bean
    @ConditionalOnMissingBean
    public BookingAdmissionCheck bookingAdmissionCheck(AvailabilityEngine engine,
                                                       BlackoutRepository blackouts,
                                                       TxRunner tx) {
        return new BookingAdmissionCheck(engine, blackouts, tx);
    }

    @Bean
    @ConditionalOnMissingBean
    public BlackoutService blackoutService(AvailabilityEngine engine,
                                           DayStore store,
                                           BlackoutRepository blackouts,
                                           TxRunner tx,
                                           Clock clock) {
        return new BlackoutService(engine, store, blackouts, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public WeekOperationService weekOperationService(AvailabilityEngine engine) {
        return new WeekOperationService(engine);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetentionService retentionService(DayStore store, TxRunner tx, Clock clock, OpenHoursProperties props) {
        var r = props.getRetention();
        return new RetentionService(store, tx, clock, new RetentionConfig(
                r.isEnabled(), r.getRetentionDays(), r.getKeepRecentDays(), r.isDryRun(), ZoneId.of("UTC")));
    }

    // --- 스케줄러 등록 (주기는 openhours.retention.delay-ms) ---
    @Bean
    @ConditionalOnProperty(prefix = "openhours.retention", name = "enabled", havingValue = "true")
    public RetentionScheduler retentionScheduler(RetentionService retention) {
        return new RetentionScheduler(retention);
    }
}
