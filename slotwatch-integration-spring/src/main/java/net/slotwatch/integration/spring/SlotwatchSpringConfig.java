package net.slotwatch.integration.spring;

import net.slotwatch.adapter.jdbc.repo.JdbcMonitoringRepository;
import net.slotwatch.adapter.jdbc.repo.JdbcOwnerCredentialRepository;
import net.slotwatch.core.spi.Clock;
import net.slotwatch.core.spi.MonitoringRepository;
import net.slotwatch.core.spi.OwnerCredentialRepository;
import net.slotwatch.core.spi.TxRunner;
import net.slotwatch.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class SlotwatchSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public MonitoringRepository monitoringRepository() { return new JdbcMonitoringRepository(); }
    @Bean public OwnerCredentialRepository ownerCredentialRepository() { return new JdbcOwnerCredentialRepository(); }

    @Bean public Clock systemClock() { return java.time.Instant::now; }
}
