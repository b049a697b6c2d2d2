package net.slotwatch.core.spi;

import net.slotwatch.core.model.BookingResult;
import net.slotwatch.core.model.SessionHandle;

import java.time.LocalDate;

/**
 * 슬롯 확보 동작. 던진 예외는 재시도 가능 실패로 취급된다.
 * 단 {@link net.slotwatch.core.exception.UpstreamAuthException} 은 세션 거부로 보고 에피소드를 끝낸다.
 */
public interface BookingAction {
    BookingResult book(SessionHandle session, String orderRef, LocalDate date, long warehouseId) throws Exception;
}
