package com.example.auditledger.access;

/**
 * Receives guard lifecycle events so they can be written to the chain itself.
 */
public interface MaintenanceListener {

    /**
     * Called before the guarded work runs. Throwing aborts the maintenance operation.
     */
    void maintenanceStarted(MaintenanceWindow window);

    void maintenanceEnded(MaintenanceWindow window, boolean succeeded);

    void violationRejected(String chainScope, String detail);
}
