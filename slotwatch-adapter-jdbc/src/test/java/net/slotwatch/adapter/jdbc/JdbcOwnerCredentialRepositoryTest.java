package net.slotwatch.adapter.jdbc;

import net.slotwatch.adapter.jdbc.repo.JdbcOwnerCredentialRepository;
import net.slotwatch.core.model.OwnerCredential;
import net.slotwatch.core.spi.OwnerCredentialRepository;
import net.slotwatch.core.spi.TxRunner;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdbcOwnerCredentialRepositoryTest extends TestSupport {

    private TxRunner tx;
    private OwnerCredentialRepository credentials;

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        credentials = new JdbcOwnerCredentialRepository();
    }

    @BeforeEach
    void clean() throws Exception {
        deleteAll(tx);
    }

    @Test
    void saveInsertsThenUpdates() throws Exception {
        Instant t0 = Instant.parse("2025-09-01T09:00:00Z");
        tx.required(() -> { credentials.save(new OwnerCredential(7L, "token-a", null, null, t0)); return null; });

        OwnerCredential first = tx.required(() -> credentials.find(7L)).orElseThrow();
        assertEquals("token-a", first.apiToken());
        assertFalse(first.hasSession());

        Instant expires = t0.plusSeconds(3600);
        tx.required(() -> { credentials.save(new OwnerCredential(7L, "token-b", "cookie=x", expires, t0.plusSeconds(5))); return null; });

        OwnerCredential second = tx.required(() -> credentials.find(7L)).orElseThrow();
        assertEquals("token-b", second.apiToken());
        assertEquals("cookie=x", second.sessionData());
        assertEquals(expires, second.sessionExpiresAt().truncatedTo(ChronoUnit.SECONDS));
    }

    @Test
    void unknownOwnerIsEmpty() throws Exception {
        assertTrue(tx.required(() -> credentials.find(404L)).isEmpty());
    }
}
