package net.slotwatch.core.spi;

import net.slotwatch.core.model.SlotOffer;

import java.util.List;
import java.util.Set;

/**
 * 창고별 수용 계수 조회.
 *
 * @throws net.slotwatch.core.exception.UpstreamRateLimitedException 호출 한도 초과
 * @throws net.slotwatch.core.exception.UpstreamAuthException 토큰 거부
 * @throws net.slotwatch.core.exception.UpstreamException 그 밖의 일시 오류
 */
public interface CoefficientQuery {
    List<SlotOffer> query(String credential, Set<Long> warehouseIds) throws Exception;
}
