package com.example.voice.domain;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Transitions a call session accepts. Every event names the states it may leave from, so a
 * late event can never move a session out of a terminal state.
 */
public enum CallSessionEvent {
    ACTIVATE(CallSessionStatus.ACTIVE, EnumSet.of(CallSessionStatus.INITIATED)),
    COMPLETE(CallSessionStatus.COMPLETED, CallSessionStatus.OPEN),
    FAIL(CallSessionStatus.FAILED, CallSessionStatus.OPEN),
    TRANSFER(CallSessionStatus.TRANSFERRED, CallSessionStatus.OPEN);

    private final CallSessionStatus target;
    private final Set<CallSessionStatus> sources;

    CallSessionEvent(CallSessionStatus target, Set<CallSessionStatus> sources) {
        this.target = target;
        this.sources = Set.copyOf(sources);
    }

    public CallSessionStatus getTarget() {
        return target;
    }

    public Set<CallSessionStatus> getSources() {
        return sources;
    }

    public boolean canLeave(CallSessionStatus current) {
        return current != null && sources.contains(current);
    }

    /**
     * Maps a provider call status or conversation event name onto a transition.
     */
    public static Optional<CallSessionEvent> fromProviderStatus(String status) {
        if (status == null || status.isBlank()) {
            return Optional.empty();
        }
        return switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "in-progress", "answered", "active", "conversation_started", "call_started" -> Optional.of(ACTIVATE);
            case "completed", "call_ended", "conversation_ended" -> Optional.of(COMPLETE);
            case "failed", "busy", "no-answer", "canceled", "cancelled" -> Optional.of(FAIL);
            case "transferred" -> Optional.of(TRANSFER);
            default -> Optional.empty();
        };
    }
}
