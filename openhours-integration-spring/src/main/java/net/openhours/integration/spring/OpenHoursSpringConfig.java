package net.openhours.integration.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.openhours.adapter.jdbc.json.AvailabilityJson;
import net.openhours.adapter.jdbc.repo.JdbcAuditRepository;
import net.openhours.adapter.jdbc.repo.JdbcBlackoutRepository;
import net.openhours.adapter.jdbc.repo.JdbcDayStore;
import net.openhours.adapter.jdbc.repo.JdbcOutboxRepository;
import net.openhours.core.spi.AuditRepository;
import net.openhours.core.spi.BlackoutRepository;
import net.openhours.core.spi.DayStore;
import net.openhours.core.spi.OutboxRepository;
import net.openhours.core.spi.TxRunner;
import net.openhours.integration.spring.tx.SpringTxRunner;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class OpenHoursSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // 앱의 ObjectMapper 가 있으면 그걸 쓴다
    @Bean
    public AvailabilityJson availabilityJson(ObjectProvider<ObjectMapper> mapper) {
        return new AvailabilityJson(mapper.getIfAvailable(ObjectMapper::new));
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public DayStore dayStore() { return new JdbcDayStore(); }
    @Bean public BlackoutRepository blackoutRepository() { return new JdbcBlackoutRepository(); }
    @Bean public AuditRepository auditRepository(AvailabilityJson json) { return new JdbcAuditRepository(json); }
    @Bean public OutboxRepository outboxRepository(AvailabilityJson json) { return new JdbcOutboxRepository(json); }
}
