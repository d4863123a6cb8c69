package ua.beengoo.rolink.api.model;

import java.time.Instant;

public record Linkage(long requesterId, long externalId, String externalDisplayName, Instant linkedAt) {}
