package net.slotwatch.core.spi;

import net.slotwatch.core.model.Notification;

public interface NotificationSink {
    void deliver(Notification notification) throws Exception;
}
