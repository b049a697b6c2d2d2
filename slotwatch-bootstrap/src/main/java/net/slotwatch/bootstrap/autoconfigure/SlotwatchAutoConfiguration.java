package net.slotwatch.bootstrap.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.slotwatch.adapter.http.HttpBookingAction;
import net.slotwatch.adapter.http.HttpCoefficientQuery;
import net.slotwatch.bootstrap.notify.LoggingNotificationSink;
import net.slotwatch.bootstrap.props.SlotwatchProperties;
import net.slotwatch.core.maintenance.StartupSweepService;
import net.slotwatch.core.service.*;
import net.slotwatch.core.spi.*;
import net.slotwatch.integration.spring.SlotwatchSpringConfig;
import net.slotwatch.integration.spring.sched.SlotwatchSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.ZoneId;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@AutoConfiguration
@EnableConfigurationProperties(SlotwatchProperties.class)
@Import(SlotwatchSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class SlotwatchAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(SlotwatchAutoConfiguration.class);

    // --- 업스트림 어댑터 (없으면 HTTP 구현) ---

    @Bean
    @ConditionalOnMissingBean(CoefficientQuery.class)
    @ConditionalOnProperty(prefix = "slotwatch.upstream", name = "enabled", havingValue = "true", matchIfMissing = true)
    public HttpCoefficientQuery httpCoefficientQuery(ObjectProvider<ObjectMapper> json, SlotwatchProperties props) {
        return new HttpCoefficientQuery(json.getIfAvailable(ObjectMapper::new), props.getUpstream().toSettings());
    }

    @Bean
    @ConditionalOnMissingBean(BookingAction.class)
    @ConditionalOnProperty(prefix = "slotwatch.upstream", name = "enabled", havingValue = "true", matchIfMissing = true)
    public HttpBookingAction httpBookingAction(ObjectProvider<ObjectMapper> json, SlotwatchProperties props) {
        return new HttpBookingAction(json.getIfAvailable(ObjectMapper::new), props.getUpstream().toSettings());
    }

    @Bean
    @ConditionalOnMissingBean(NotificationSink.class)
    public LoggingNotificationSink loggingNotificationSink() {
        return new LoggingNotificationSink();
    }

    @Bean
    @ConditionalOnMissingBean(SessionProvider.class)
    public StoredSessionProvider storedSessionProvider(OwnerCredentialRepository credentials, TxRunner tx, Clock clock) {
        return new StoredSessionProvider(credentials, tx, clock);
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public CandidateEvaluator candidateEvaluator(SlotwatchProperties props) {
        return new CandidateEvaluator(ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimiter rateLimiter(SlotwatchProperties props) {
        return new RateLimiter(props.getRateLimiter().getMinInterval());
    }

    @Bean
    @ConditionalOnMissingBean
    public OwnerSessionLeases ownerSessionLeases() {
        return new OwnerSessionLeases();
    }

    @Bean
    @ConditionalOnMissingBean
    public Notifier notifier(NotificationSink sink) {
        return new Notifier(sink);
    }

    @Bean
    @ConditionalOnMissingBean
    public BookingOrchestrator bookingOrchestrator(BookingAction booking,
                                                   SessionProvider sessions,
                                                   OwnerSessionLeases leases,
                                                   MonitoringRepository monitorings,
                                                   TxRunner tx,
                                                   Notifier notifier,
                                                   Clock clock,
                                                   SlotwatchProperties props) {
        SlotwatchProperties.Booking b = props.getBooking();
        return new BookingOrchestrator(booking, sessions, leases, monitorings, tx, notifier, clock,
                RetryPolicy.fixed(b.getRetryDelay()), b.getMaxAttempts());
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerFactory workerFactory(MonitoringRepository monitorings,
                                       TxRunner tx,
                                       SessionProvider sessions,
                                       CoefficientQuery query,
                                       RateLimiter rateLimiter,
                                       CandidateEvaluator evaluator,
                                       BookingOrchestrator orchestrator,
                                       Notifier notifier,
                                       Clock clock,
                                       SlotwatchProperties props) {
        SlotwatchProperties.Worker w = props.getWorker();
        // 모든 워커가 같은 게이트를 지난다
        CoefficientQuery gated = new RateLimitedCoefficientQuery(query, rateLimiter);
        return new WorkerFactory(monitorings, tx, sessions, gated, evaluator, orchestrator, notifier, clock,
                new WorkerSettings(w.getPollInterval(), w.getRateLimitPause(), w.getErrorPause()));
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public MonitoringSupervisor monitoringSupervisor(MonitoringRepository monitorings,
                                                     TxRunner tx,
                                                     WorkerFactory workers,
                                                     Clock clock,
                                                     SlotwatchProperties props) {
        SlotwatchProperties.Supervisor s = props.getSupervisor();
        return new MonitoringSupervisor(monitorings, tx, workers, Executors.newCachedThreadPool(workerThreads()),
                clock, s.getFailureBackoff(), s.getShutdownTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public MonitoringCommands monitoringCommands(MonitoringRepository monitorings, TxRunner tx, Clock clock) {
        return new MonitoringCommands(monitorings, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public StartupSweepService startupSweepService(MonitoringRepository monitorings,
                                                   TxRunner tx,
                                                   Notifier notifier,
                                                   Clock clock) {
        return new StartupSweepService(monitorings, tx, notifier, clock);
    }

    // --- 스케줄러 등록 (주기는 slotwatch.supervisor.reconcile-delay-ms) ---

    @Bean
    @ConditionalOnProperty(prefix = "slotwatch.supervisor", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SlotwatchSchedulers slotwatchSchedulers(MonitoringSupervisor supervisor) {
        return new SlotwatchSchedulers(supervisor);
    }

    /** 재시작 직후: 남은 ACTIVE 정리 → 감독자 시작 → 즉시 한 번 재조정 */
    @Bean
    public ApplicationRunner slotwatchStartupRunner(StartupSweepService sweep,
                                                    MonitoringSupervisor supervisor,
                                                    SlotwatchProperties props) {
        return args -> {
            if (props.getStartup().isSweepEnabled()) {
                sweep.sweep();
            } else {
                log.info("Startup sweep disabled");
            }
            if (props.getSupervisor().isEnabled()) {
                supervisor.start();
                supervisor.tick();
            } else {
                log.info("Supervisor disabled (slotwatch.supervisor.enabled=false)");
            }
        };
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "slotwatch-pool-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
