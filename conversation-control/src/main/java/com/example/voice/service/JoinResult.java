package com.example.voice.service;

import com.example.voice.domain.HumanControlSession;

/**
 * Outcome of a join attempt. Losing the race is a normal outcome, not an error.
 */
public record JoinResult(JoinStatus status, HumanControlSession session, String currentOwner) {

    public enum JoinStatus {
        JOINED,
        ALREADY_OWNED,
        CONFLICT
    }

    public static JoinResult joined(HumanControlSession session) {
        return new JoinResult(JoinStatus.JOINED, session, session.getOperatorName());
    }

    public static JoinResult alreadyOwned(HumanControlSession session) {
        return new JoinResult(JoinStatus.ALREADY_OWNED, session, session.getOperatorName());
    }

    public static JoinResult conflict(HumanControlSession owner) {
        return new JoinResult(JoinStatus.CONFLICT, owner, owner.getOperatorName());
    }

    public boolean isSuccess() {
        return status != JoinStatus.CONFLICT;
    }
}
