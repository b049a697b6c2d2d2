package net.slotwatch.core.service;

import net.slotwatch.core.model.CandidateSlot;
import net.slotwatch.core.model.Monitoring;
import net.slotwatch.core.model.Notification;
import net.slotwatch.core.model.Notification.Outcome;
import net.slotwatch.core.spi.NotificationSink;
import net.slotwatch.core.util.MessageSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 알림 발송. 싱크 실패는 로그만 남기고 호출자에게 전파하지 않는다.
 */
public class Notifier {
    private static final Logger log = LoggerFactory.getLogger(Notifier.class);

    private final NotificationSink sink;

    public Notifier(NotificationSink sink) {
        this.sink = sink;
    }

    public void found(Monitoring m, CandidateSlot c) {
        send(m, Outcome.FOUND, c, NotificationMessages.found(m, c));
    }

    public void booking(Monitoring m, CandidateSlot c) {
        send(m, Outcome.BOOKING, c, NotificationMessages.booking(m, c));
    }

    public void retrying(Monitoring m, CandidateSlot c, int nextAttempt, int maxAttempts, String reason) {
        send(m, Outcome.RETRYING, c, NotificationMessages.retrying(m, c, nextAttempt, maxAttempts, reason));
    }

    public void succeeded(Monitoring m, CandidateSlot c) {
        send(m, Outcome.SUCCEEDED, c, NotificationMessages.succeeded(m, c));
    }

    public void failed(Monitoring m, CandidateSlot c, String reason) {
        send(m, Outcome.FAILED, c, NotificationMessages.failed(m, c, reason));
    }

    public void excluded(Monitoring m, CandidateSlot c, String reason) {
        send(m, Outcome.FAILED, c, NotificationMessages.excluded(m, c, reason));
    }

    public void authRequired(Monitoring m, String reason) {
        send(m, Outcome.AUTH_REQUIRED, null, NotificationMessages.authRequired(m, reason));
    }

    public void stoppedOnRestart(Monitoring m) {
        send(m, Outcome.STOPPED_ON_RESTART, null, NotificationMessages.stoppedOnRestart(m));
    }

    private void send(Monitoring m, Outcome outcome, CandidateSlot c, String text) {
        Notification n = new Notification(m.id(), m.ownerId(), outcome, c, MessageSanitizer.sanitize(text));
        try {
            sink.deliver(n);
        } catch (InterruptedException e) {
            // 플래그만 되살린다. 진행 중인 예약 에피소드는 다음 대기 지점에서 INTERRUPTED 로 끝난다
            Thread.currentThread().interrupt();
            log.warn("Notification {} for monitoring {} interrupted", outcome, m.id());
        } catch (Exception e) {
            log.warn("Notification {} for monitoring {} not delivered: {}", outcome, m.id(), e.toString());
        }
    }
}
