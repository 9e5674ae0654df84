package com.example.auditledger.access;

import java.time.Instant;
import lombok.Getter;

/**
 * Proof that the immutability guard is suspended for one chain scope. Only
 * {@link ImmutabilityGuard#withMaintenance} can open a window, and it is closed as soon as the
 * guarded operation returns.
 */
@Getter
public final class MaintenanceWindow {

    private final String id;
    private final String chainScope;
    private final String reason;
    private final String actor;
    private final Instant openedAt;
    private volatile boolean open = true;

    MaintenanceWindow(String id, String chainScope, String reason, String actor, Instant openedAt) {
        this.id = id;
        this.chainScope = chainScope;
        this.reason = reason;
        this.actor = actor;
        this.openedAt = openedAt;
    }

    void close() {
        open = false;
    }

    @Override
    public String toString() {
        return "MaintenanceWindow[" + id + " scope=" + chainScope + " open=" + open + "]";
    }
}
