package net.slotwatch.core.service;

import net.slotwatch.core.exception.UpstreamAuthException;
import net.slotwatch.core.model.OwnerCredential;
import net.slotwatch.core.model.SessionHandle;
import net.slotwatch.core.spi.Clock;
import net.slotwatch.core.spi.OwnerCredentialRepository;
import net.slotwatch.core.spi.SessionProvider;
import net.slotwatch.core.spi.TxRunner;

import java.util.Optional;

/** 저장된 소유자 자격 증명을 읽어 토큰과 세션을 내준다. */
public final class StoredSessionProvider implements SessionProvider {
    private final OwnerCredentialRepository credentials;
    private final TxRunner tx;
    private final Clock clock;

    public StoredSessionProvider(OwnerCredentialRepository credentials, TxRunner tx, Clock clock) {
        this.credentials = credentials;
        this.tx = tx;
        this.clock = clock;
    }

    @Override
    public String credential(long ownerId) throws Exception {
        Optional<OwnerCredential> found = tx.required(() -> credentials.find(ownerId));
        if (found.isEmpty() || !found.get().hasApiToken()) {
            throw new UpstreamAuthException("no API token stored for owner " + ownerId);
        }
        return found.get().apiToken();
    }

    @Override
    public Optional<SessionHandle> session(long ownerId) throws Exception {
        Optional<OwnerCredential> found = tx.required(() -> credentials.find(ownerId));
        if (found.isEmpty() || !found.get().hasSession()) return Optional.empty();

        OwnerCredential c = found.get();
        if (c.sessionExpired(clock.now())) {
            throw new UpstreamAuthException("booking session expired at " + c.sessionExpiresAt());
        }
        return Optional.of(new SessionHandle(ownerId, c.apiToken(), c.sessionData()));
    }
}
