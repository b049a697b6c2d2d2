package net.slotwatch.integration.spring.sched;

import net.slotwatch.core.service.MonitoringSupervisor;
import org.springframework.scheduling.annotation.Scheduled;

/** 감독자 재조정 주기 실행. 시작 전이거나 백오프 중이면 tick 이 알아서 건너뛴다. */
public class SlotwatchSchedulers {
    private final MonitoringSupervisor supervisor;

    public SlotwatchSchedulers(MonitoringSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @Scheduled(fixedDelayString = "${slotwatch.supervisor.reconcile-delay-ms:30000}")
    public void reconcile() {
        supervisor.tick();
    }
}
