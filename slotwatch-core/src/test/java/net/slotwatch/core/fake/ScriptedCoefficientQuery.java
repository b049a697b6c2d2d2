package net.slotwatch.core.fake;

import net.slotwatch.core.model.SlotOffer;
import net.slotwatch.core.spi.CoefficientQuery;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/** 고정 응답을 돌려주거나 지정한 예외를 던진다. */
public final class ScriptedCoefficientQuery implements CoefficientQuery {
    private volatile List<SlotOffer> offers = List.of();
    private volatile Exception failure;
    private final AtomicInteger calls = new AtomicInteger();
    private final List<Set<Long>> requested = new ArrayList<>();
    private volatile String lastThreadName;

    public void respondWith(List<SlotOffer> offers) {
        this.offers = List.copyOf(offers);
        this.failure = null;
    }

    public void failWith(Exception failure) {
        this.failure = failure;
    }

    @Override
    public List<SlotOffer> query(String credential, Set<Long> warehouseIds) throws Exception {
        calls.incrementAndGet();
        lastThreadName = Thread.currentThread().getName();
        synchronized (requested) {
            requested.add(warehouseIds);
        }
        Exception f = failure;
        if (f != null) throw f;
        return offers;
    }

    public int calls() {
        return calls.get();
    }

    public String lastThreadName() {
        return lastThreadName;
    }

    public List<Set<Long>> requested() {
        synchronized (requested) {
            return List.copyOf(requested);
        }
    }
}
