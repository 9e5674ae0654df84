package com.example.auditledger.access;

import com.example.auditledger.service.AuditLedgerException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Storage-boundary guard for committed audit history. {@link AuditLedgerAccess} has no update
 * or delete operation; the only destructive path, archival, must present an open
 * {@link MaintenanceWindow} for the scope it touches. Opening and closing a window is reported
 * to the registered listeners so the suspension is itself recorded in the chain.
 */
@Component
@Slf4j
public class ImmutabilityGuard {

    private final Clock clock;
    private final Map<String, MaintenanceWindow> openWindows = new ConcurrentHashMap<>();
    private final List<MaintenanceListener> listeners = new CopyOnWriteArrayList<>();

    public ImmutabilityGuard(Clock clock) {
        this.clock = clock;
    }

    public void register(MaintenanceListener listener) {
        listeners.add(listener);
    }

    /**
     * Runs {@code work} with the guard suspended for {@code chainScope}. At most one window per
     * scope is open in this process; cross-process exclusion comes from the chain head condition.
     */
    public <T> T withMaintenance(String chainScope,
                                 String reason,
                                 String actor,
                                 Function<MaintenanceWindow, T> work) {
        MaintenanceWindow window = new MaintenanceWindow(
                UUID.randomUUID().toString(), chainScope, reason, actor, clock.instant());
        if (openWindows.putIfAbsent(chainScope, window) != null) {
            throw AuditLedgerException.writeConflict(chainScope, "maintenance already in progress");
        }

        boolean started = false;
        boolean succeeded = false;
        try {
            for (MaintenanceListener listener : listeners) {
                listener.maintenanceStarted(window);
            }
            started = true;
            log.warn("Immutability guard suspended for chain {} (window={}, actor={}, reason={})",
                    chainScope, window.getId(), actor, reason);

            T result = work.apply(window);
            succeeded = true;
            return result;
        } finally {
            window.close();
            openWindows.remove(chainScope, window);
            if (started) {
                log.info("Immutability guard restored for chain {} (window={}, succeeded={})",
                        chainScope, window.getId(), succeeded);
                recordEnd(window, succeeded);
            }
        }
    }

    /**
     * Called by store implementations before any destructive write.
     */
    public void requireMaintenance(MaintenanceWindow window, String chainScope) {
        if (window == null) {
            throw reject(chainScope, "no maintenance window");
        }
        if (!window.isOpen() || openWindows.get(window.getChainScope()) != window) {
            throw reject(chainScope, "maintenance window " + window.getId() + " is closed");
        }
        if (!window.getChainScope().equals(chainScope)) {
            throw reject(chainScope, "maintenance window " + window.getId()
                    + " was opened for chain " + window.getChainScope());
        }
    }

    /**
     * Reports an attempted overwrite of a committed record.
     */
    public AuditLedgerException rejectOverwrite(String chainScope, String recordId) {
        return reject(chainScope, "record " + recordId + " is already committed");
    }

    private AuditLedgerException reject(String chainScope, String detail) {
        AuditLedgerException violation = AuditLedgerException.immutabilityViolation(chainScope, detail);
        log.error("Rejected mutation of audit history in chain {}: {}", chainScope, detail);
        for (MaintenanceListener listener : listeners) {
            try {
                listener.violationRejected(chainScope, detail);
            } catch (RuntimeException ex) {
                log.warn("Failed to record immutability violation on chain {}", chainScope, ex);
                violation.addSuppressed(ex);
            }
        }
        return violation;
    }

    private void recordEnd(MaintenanceWindow window, boolean succeeded) {
        try {
            for (MaintenanceListener listener : listeners) {
                listener.maintenanceEnded(window, succeeded);
            }
        } catch (RuntimeException ex) {
            if (succeeded) {
                throw ex;
            }
            // the failure of the guarded work is already propagating
            log.error("Failed to record end of maintenance window {} on chain {}",
                    window.getId(), window.getChainScope(), ex);
        }
    }
}
