package net.openhours.bootstrap.autoconfigure;

import net.openhours.core.config.EngineConfig;
import net.openhours.core.maintenance.RetentionService;
import net.openhours.core.service.AvailabilityEngine;
import net.openhours.core.service.BlackoutService;
import net.openhours.core.service.BookingAdmissionCheck;
import net.openhours.core.service.WeekOperationService;
import net.openhours.core.spi.AvailabilityCache;
import net.openhours.core.spi.Clock;
import net.openhours.core.spi.InstructorZoneResolver;
import net.openhours.core.spi.TxRunner;
import net.openhours.integration.spring.cache.CaffeineAvailabilityCache;
import net.openhours.integration.spring.sched.RetentionScheduler;
import net.openhours.integration.spring.tx.SpringTxRunner;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class OpenHoursAutoConfigurationTest {

    // 빈 생성만 확인: 커넥션은 열지 않는다
    @Configuration(proxyBeanMethods = false)
    static class DataSourceConfig {
        @Bean
        DataSource dataSource() {
            return new DriverManagerDataSource("jdbc:oracle:thin:@//localhost:1521/XEPDB1");
        }

        @Bean
        PlatformTransactionManager transactionManager(DataSource ds) {
            return new DataSourceTransactionManager(ds);
        }
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(OpenHoursAutoConfiguration.class))
            .withUserConfiguration(DataSourceConfig.class);

    @Test
    void defaults_wireEngineAndServices() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(AvailabilityEngine.class);
            assertThat(ctx).hasSingleBean(BookingAdmissionCheck.class);
            assertThat(ctx).hasSingleBean(BlackoutService.class);
            assertThat(ctx).hasSingleBean(WeekOperationService.class);
            assertThat(ctx).hasSingleBean(RetentionService.class);
            assertThat(ctx).hasSingleBean(CaffeineAvailabilityCache.class);
            assertThat(ctx).doesNotHaveBean(RetentionScheduler.class);
            assertThat(ctx.getBean(TxRunner.class)).isInstanceOf(SpringTxRunner.class);
            assertThat(ctx.getBean(EngineConfig.class)).isEqualTo(EngineConfig.defaults());
            assertThat(ctx.getBean(InstructorZoneResolver.class).zoneOf("any")).isEqualTo(ZoneId.of("UTC"));
        });
    }

    @Test
    void properties_mapToEngineConfig() {
        runner.withPropertyValues(
                "openhours.zone=Asia/Seoul",
                "openhours.guardrails.forbid-past-edits=false",
                "openhours.guardrails.past-edit-window-days=3",
                "openhours.guardrails.require-base-version=true",
                "openhours.guardrails.slot-minutes=60",
                "openhours.cache.hot-ttl=2m",
                "openhours.cache.warm-ttl=3h",
                "openhours.audit.enabled=false"
        ).run(ctx -> {
            EngineConfig config = ctx.getBean(EngineConfig.class);
            assertThat(config.forbidPastEdits()).isFalse();
            assertThat(config.pastEditWindowDays()).isEqualTo(3);
            assertThat(config.requireBaseVersion()).isTrue();
            assertThat(config.slotMinutes()).isEqualTo(60);
            assertThat(config.hotTtl()).isEqualTo(Duration.ofMinutes(2));
            assertThat(config.warmTtl()).isEqualTo(Duration.ofHours(3));
            assertThat(config.auditEnabled()).isFalse();
            assertThat(ctx.getBean(InstructorZoneResolver.class).zoneOf("any")).isEqualTo(ZoneId.of("Asia/Seoul"));
        });
    }

    @Test
    void cacheCanBeDisabled() {
        runner.withPropertyValues("openhours.cache.enabled=false").run(ctx -> {
            assertThat(ctx).doesNotHaveBean(AvailabilityCache.class);
            assertThat(ctx).hasSingleBean(AvailabilityEngine.class);
        });
    }

    @Test
    void retentionEnabled_registersScheduler() {
        runner.withPropertyValues("openhours.retention.enabled=true", "openhours.retention.retention-days=90")
                .run(ctx -> assertThat(ctx).hasSingleBean(RetentionScheduler.class));
    }

    @Test
    void userClock_winsOverDefault() {
        Instant fixed = Instant.parse("2025-03-05T03:00:00Z");
        runner.withBean(Clock.class, () -> Clock.fixed(fixed)).run(ctx -> {
            assertThat(ctx).hasSingleBean(Clock.class);
            assertThat(ctx.getBean(Clock.class).now()).isEqualTo(fixed);
        });
    }
}
