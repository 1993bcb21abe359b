package com.example.voice.domain;

import java.util.EnumSet;
import java.util.Set;

public enum CallSessionStatus {
    INITIATED,
    ACTIVE,
    COMPLETED,
    FAILED,
    TRANSFERRED;

    public static final Set<CallSessionStatus> OPEN = EnumSet.of(INITIATED, ACTIVE);

    public boolean isTerminal() {
        return !OPEN.contains(this);
    }
}
