package com.example.auditledger.service;

import com.example.auditledger.access.ImmutabilityGuard;
import com.example.auditledger.access.MaintenanceListener;
import com.example.auditledger.access.MaintenanceWindow;
import com.example.auditledger.models.ChainScope;
import com.example.auditledger.requests.AuditEventRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Writes guard suspensions and rejected mutations into the affected chain so later
 * verification and review can see them.
 */
@Component
public class MaintenanceAuditRecorder implements MaintenanceListener {

    private final ChainAppender appender;

    public MaintenanceAuditRecorder(ImmutabilityGuard guard, ChainAppender appender) {
        this.appender = appender;
        guard.register(this);
    }

    @Override
    public void maintenanceStarted(MaintenanceWindow window) {
        appender.append(event(window.getChainScope(), AuditActions.MAINTENANCE_STARTED,
                window.getId(), windowDetails(window)));
    }

    @Override
    public void maintenanceEnded(MaintenanceWindow window, boolean succeeded) {
        Map<String, Object> details = windowDetails(window);
        details.put("succeeded", succeeded);
        appender.append(event(window.getChainScope(), AuditActions.MAINTENANCE_ENDED,
                window.getId(), details));
    }

    @Override
    public void violationRejected(String chainScope, String detail) {
        appender.append(event(chainScope, AuditActions.IMMUTABILITY_VIOLATION, null,
                Map.of("detail", detail)));
    }

    private static Map<String, Object> windowDetails(MaintenanceWindow window) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("window_id", window.getId());
        details.put("reason", window.getReason());
        details.put("actor", window.getActor());
        details.put("opened_at", window.getOpenedAt().toString());
        return details;
    }

    private static AuditEventRequest event(String chainScope, String action, String resourceId,
                                           Map<String, Object> details) {
        return new AuditEventRequest(null, ChainScope.workspaceIdOf(chainScope), action,
                AuditActions.LEDGER_RESOURCE_TYPE, resourceId, details, null, null, Boolean.TRUE);
    }
}
