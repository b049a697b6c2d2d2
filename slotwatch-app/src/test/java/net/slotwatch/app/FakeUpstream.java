package net.slotwatch.app;

import net.slotwatch.core.model.BookingResult;
import net.slotwatch.core.model.Notification;
import net.slotwatch.core.model.SessionHandle;
import net.slotwatch.core.model.SlotOffer;
import net.slotwatch.core.spi.BookingAction;
import net.slotwatch.core.spi.CoefficientQuery;
import net.slotwatch.core.spi.NotificationSink;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 테스트용 업스트림. 창고별로 제안 목록을 두고,
 * 주문번호+날짜별로 예약 결과를 정한다 (지정 없으면 성공).
 */
class FakeUpstream implements CoefficientQuery, BookingAction, NotificationSink {

    record Booked(String orderRef, LocalDate date, long warehouseId) {}

    private final Map<Long, List<SlotOffer>> offers = new ConcurrentHashMap<>();
    private final Map<String, BookingResult> results = new ConcurrentHashMap<>();
    final List<Booked> bookings = new CopyOnWriteArrayList<>();
    final List<Notification> notifications = new CopyOnWriteArrayList<>();

    void offer(long warehouseId, SlotOffer... list) {
        offers.put(warehouseId, List.of(list));
    }

    void bookingResult(String orderRef, LocalDate date, BookingResult r) {
        results.put(orderRef + "@" + date, r);
    }

    @Override
    public List<SlotOffer> query(String credential, Set<Long> warehouseIds) {
        return warehouseIds.stream()
                .flatMap(id -> offers.getOrDefault(id, List.of()).stream())
                .toList();
    }

    @Override
    public BookingResult book(SessionHandle session, String orderRef, LocalDate date, long warehouseId) {
        bookings.add(new Booked(orderRef, date, warehouseId));
        return results.getOrDefault(orderRef + "@" + date, BookingResult.succeeded("ok"));
    }

    @Override
    public void deliver(Notification notification) {
        notifications.add(notification);
    }

    List<Notification.Outcome> outcomesFor(long monitoringId) {
        return notifications.stream()
                .filter(n -> n.monitoringId() != null && n.monitoringId() == monitoringId)
                .map(Notification::outcome)
                .toList();
    }
}
