package net.slotwatch.adapter.jdbc.repo;

import net.slotwatch.adapter.jdbc.JdbcUtil;
import net.slotwatch.adapter.jdbc.TxContext;
import net.slotwatch.adapter.jdbc.mapper.RowMappers;
import net.slotwatch.core.model.OwnerCredential;
import net.slotwatch.core.spi.OwnerCredentialRepository;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

public final class JdbcOwnerCredentialRepository implements OwnerCredentialRepository {

    @Override
    public Optional<OwnerCredential> find(long ownerId) throws Exception {
        try (var ps = TxContext.require().prepareStatement("SELECT * FROM TB_OWNER_CREDENTIAL WHERE OWNER_ID = ?")) {
            ps.setLong(1, ownerId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toOwnerCredential(rs)) : Optional.empty();
            }
        }
    }

    /** UPDATE 후 없으면 INSERT (DB 간 MERGE 문법 차이 회피) */
    @Override
    public void save(OwnerCredential cred) throws Exception {
        Connection c = TxContext.require();
        Instant updatedAt = cred.updatedAt() == null ? Instant.now() : cred.updatedAt();
        try (var up = c.prepareStatement("""
            UPDATE TB_OWNER_CREDENTIAL
               SET API_TOKEN          = ?,
                   SESSION_DATA       = ?,
                   SESSION_EXPIRES_AT = ?,
                   UPDATED_AT         = ?
             WHERE OWNER_ID = ?
        """)) {
            up.setString(1, cred.apiToken());
            up.setString(2, cred.sessionData());
            up.setTimestamp(3, JdbcUtil.ts(cred.sessionExpiresAt()));
            up.setTimestamp(4, JdbcUtil.ts(updatedAt));
            up.setLong(5, cred.ownerId());
            if (up.executeUpdate() > 0) return;
        }
        try (var ins = c.prepareStatement("""
            INSERT INTO TB_OWNER_CREDENTIAL (OWNER_ID, API_TOKEN, SESSION_DATA, SESSION_EXPIRES_AT, UPDATED_AT)
            VALUES (?, ?, ?, ?, ?)
        """)) {
            ins.setLong(1, cred.ownerId());
            ins.setString(2, cred.apiToken());
            ins.setString(3, cred.sessionData());
            ins.setTimestamp(4, JdbcUtil.ts(cred.sessionExpiresAt()));
            ins.setTimestamp(5, JdbcUtil.ts(updatedAt));
            ins.executeUpdate();
        }
    }
}
