package com.example.auditledger.models;

/**
 * Chain scope naming. Every workspace has its own independent chain; events without a
 * workspace share the tenant-global chain.
 */
public final class ChainScope {

    public static final String GLOBAL = "global";

    private static final String WORKSPACE_PREFIX = "ws:";

    private ChainScope() {
    }

    public static String of(String workspaceId) {
        if (workspaceId == null || workspaceId.isBlank()) {
            return GLOBAL;
        }
        return WORKSPACE_PREFIX + workspaceId;
    }

    /**
     * @return the workspace id a scope was derived from, or {@code null} for the global chain
     */
    public static String workspaceIdOf(String chainScope) {
        if (chainScope != null && chainScope.startsWith(WORKSPACE_PREFIX)) {
            return chainScope.substring(WORKSPACE_PREFIX.length());
        }
        return null;
    }
}
