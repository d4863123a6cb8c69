package ua.beengoo.rolink.core.service;

import ua.beengoo.rolink.api.model.Linkage;
import ua.beengoo.rolink.api.model.SyncReport;

import java.util.Optional;

/**
 * Successful callback. The linkage is persisted regardless of what {@code roles} reports.
 */
public record LinkOutcome(Linkage linkage, SyncReport roles, Optional<String> requesterName) {}
