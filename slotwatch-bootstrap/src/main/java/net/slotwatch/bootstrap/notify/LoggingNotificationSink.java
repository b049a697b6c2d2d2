package net.slotwatch.bootstrap.notify;

import net.slotwatch.core.model.Notification;
import net.slotwatch.core.spi.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 기본 알림 출력. 메신저 연동이 없을 때 로그로만 남긴다. */
public class LoggingNotificationSink implements NotificationSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void deliver(Notification n) {
        log.info("[notify] owner={} monitoring={} outcome={} {}",
                n.ownerId(), n.monitoringId(), n.outcome(), n.message());
    }
}
