package net.slotwatch.core.service;

import net.slotwatch.core.model.SlotOffer;
import net.slotwatch.core.spi.CoefficientQuery;

import java.util.List;
import java.util.Set;

public final class RateLimitedCoefficientQuery implements CoefficientQuery {
    private final CoefficientQuery delegate;
    private final RateLimiter limiter;

    public RateLimitedCoefficientQuery(CoefficientQuery delegate, RateLimiter limiter) {
        this.delegate = delegate;
        this.limiter = limiter;
    }

    @Override
    public List<SlotOffer> query(String credential, Set<Long> warehouseIds) throws Exception {
        limiter.acquire();
        return delegate.query(credential, warehouseIds);
    }
}
