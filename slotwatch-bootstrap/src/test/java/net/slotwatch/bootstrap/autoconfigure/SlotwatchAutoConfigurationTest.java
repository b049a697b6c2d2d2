package net.slotwatch.bootstrap.autoconfigure;

import net.slotwatch.adapter.http.HttpBookingAction;
import net.slotwatch.adapter.http.HttpCoefficientQuery;
import net.slotwatch.bootstrap.notify.LoggingNotificationSink;
import net.slotwatch.core.maintenance.StartupSweepService;
import net.slotwatch.core.model.BookingResult;
import net.slotwatch.core.service.MonitoringCommands;
import net.slotwatch.core.service.MonitoringSupervisor;
import net.slotwatch.core.service.StoredSessionProvider;
import net.slotwatch.core.service.WorkerFactory;
import net.slotwatch.core.spi.BookingAction;
import net.slotwatch.core.spi.CoefficientQuery;
import net.slotwatch.core.spi.NotificationSink;
import net.slotwatch.core.spi.TxRunner;
import net.slotwatch.integration.spring.sched.SlotwatchSchedulers;
import org.junit.jupiter.api.Test;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SlotwatchAutoConfigurationTest {

    private static final DataSource DS = new DriverManagerDataSource("jdbc:h2:mem:autoconfig");

    // 컨텍스트 생성만 확인하므로 DB 에는 접속하지 않는다
    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SlotwatchAutoConfiguration.class))
            .withBean(DataSource.class, () -> DS)
            .withBean(PlatformTransactionManager.class, () -> new DataSourceTransactionManager(DS));

    @Test
    void wiresEngineWithHttpAdaptersByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(TxRunner.class);
            assertThat(context).hasSingleBean(HttpCoefficientQuery.class);
            assertThat(context).hasSingleBean(HttpBookingAction.class);
            assertThat(context).hasSingleBean(StoredSessionProvider.class);
            assertThat(context).hasSingleBean(LoggingNotificationSink.class);
            assertThat(context).hasSingleBean(WorkerFactory.class);
            assertThat(context).hasSingleBean(MonitoringSupervisor.class);
            assertThat(context).hasSingleBean(MonitoringCommands.class);
            assertThat(context).hasSingleBean(StartupSweepService.class);
            assertThat(context).hasSingleBean(SlotwatchSchedulers.class);
            assertThat(context).hasSingleBean(ApplicationRunner.class);
            assertThat(context.getBean(MonitoringSupervisor.class).isStarted()).isFalse();
        });
    }

    @Test
    void userAdaptersReplaceHttpOnes() {
        CoefficientQuery query = (credential, ids) -> List.of();
        BookingAction booking = (session, orderRef, date, warehouseId) -> BookingResult.succeeded("ok");
        NotificationSink sink = n -> { };

        contextRunner
                .withBean(CoefficientQuery.class, () -> query)
                .withBean(BookingAction.class, () -> booking)
                .withBean(NotificationSink.class, () -> sink)
                .run(context -> {
                    assertThat(context).doesNotHaveBean(HttpCoefficientQuery.class);
                    assertThat(context).doesNotHaveBean(HttpBookingAction.class);
                    assertThat(context).doesNotHaveBean(LoggingNotificationSink.class);
                    assertThat(context.getBean(CoefficientQuery.class)).isSameAs(query);
                });
    }

    @Test
    void disabledSupervisorHasNoSchedule() {
        contextRunner
                .withPropertyValues("slotwatch.supervisor.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(SlotwatchSchedulers.class));
    }
}
