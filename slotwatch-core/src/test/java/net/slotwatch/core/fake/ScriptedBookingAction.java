package net.slotwatch.core.fake;

import net.slotwatch.core.model.BookingResult;
import net.slotwatch.core.model.SessionHandle;
import net.slotwatch.core.spi.BookingAction;

import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 미리 넣어둔 결과를 순서대로 돌려준다. 바닥나면 마지막 기본값 사용.
 * 결과 대신 Exception을 넣으면 던진다.
 */
public final class ScriptedBookingAction implements BookingAction {
    public record Call(String orderRef, LocalDate date, long warehouseId) {}

    private final Deque<Object> script = new ArrayDeque<>();
    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private volatile BookingResult fallback = BookingResult.terminal("no scripted result");

    public synchronized ScriptedBookingAction then(BookingResult result) {
        script.add(result);
        return this;
    }

    public synchronized ScriptedBookingAction thenThrow(Exception e) {
        script.add(e);
        return this;
    }

    public ScriptedBookingAction otherwise(BookingResult result) {
        this.fallback = result;
        return this;
    }

    @Override
    public BookingResult book(SessionHandle session, String orderRef, LocalDate date, long warehouseId) throws Exception {
        calls.add(new Call(orderRef, date, warehouseId));
        Object next;
        synchronized (this) {
            next = script.poll();
        }
        if (next == null) return fallback;
        if (next instanceof Exception e) throw e;
        return (BookingResult) next;
    }

    public List<Call> calls() {
        return List.copyOf(calls);
    }
}
