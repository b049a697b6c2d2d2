package net.slotwatch.core.fake;

import net.slotwatch.core.model.Notification;
import net.slotwatch.core.spi.NotificationSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class RecordingNotificationSink implements NotificationSink {
    private final List<Notification> delivered = new CopyOnWriteArrayList<>();

    @Override
    public void deliver(Notification notification) {
        delivered.add(notification);
    }

    public List<Notification> delivered() {
        return List.copyOf(delivered);
    }

    public List<Notification.Outcome> outcomes() {
        return delivered.stream().map(Notification::outcome).toList();
    }
}
