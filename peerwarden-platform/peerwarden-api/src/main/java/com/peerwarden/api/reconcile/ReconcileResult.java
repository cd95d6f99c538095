package com.peerwarden.api.reconcile;

public record ReconcileResult(boolean success, String message, int cleanedCount) {

    public static ReconcileResult of(int cleanedCount) {
        return new ReconcileResult(true, "Cleaned up " + cleanedCount + " orphaned peer records", cleanedCount);
    }
}
