package net.slotwatch.core.spi;

import net.slotwatch.core.model.SessionHandle;

import java.util.Optional;

public interface SessionProvider {
    /** 조회용 토큰. 없으면 UpstreamAuthException */
    String credential(long ownerId) throws Exception;

    /** 예약 세션. 없으면 empty, 만료면 UpstreamAuthException */
    Optional<SessionHandle> session(long ownerId) throws Exception;
}
