package net.slotwatch.core.spi;

import net.slotwatch.core.model.OwnerCredential;

import java.util.Optional;

public interface OwnerCredentialRepository {
    Optional<OwnerCredential> find(long ownerId) throws Exception;

    void save(OwnerCredential credential) throws Exception; // upsert
}
