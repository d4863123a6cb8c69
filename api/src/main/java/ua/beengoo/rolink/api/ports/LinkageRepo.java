package ua.beengoo.rolink.api.ports;

import ua.beengoo.rolink.api.model.Linkage;

import java.util.Optional;

/**
 * Durable Discord to Roblox identity mapping. One row per Discord user.
 */
public interface LinkageRepo {
    Optional<Linkage> getByRequester(long requesterId);

    Optional<Linkage> getByExternalId(long externalId);

    /** Creates or overwrites the linkage of {@code requesterId}. */
    Linkage upsert(long requesterId, long externalId, String externalDisplayName);

    /** @return {@code true} if a linkage existed and was removed */
    boolean delete(long requesterId);
}
