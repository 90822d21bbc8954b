package de.entwicklertraining.api.resilient;

import de.entwicklertraining.api.resilient.concurrency.ConcurrencyGate.Permit;
import de.entwicklertraining.api.resilient.retry.DiagnosticsAccumulator;
import java.util.Objects;

/**
 * Mutable state of one logical request while {@link ApiClient} runs its attempts.
 * <p>
 * The concurrency permit is held here as an explicit handle instead of being tied to a scope,
 * because a long wait may give it up and a later re-acquisition may put a different one back.
 * {@link #releasePermit()} is idempotent and is called on every exit path of the client.
 * <p>
 * Instances are confined to the thread running the request.
 */
final class ApiRequestExecutionContext {

    private final DiagnosticsAccumulator diagnostics = new DiagnosticsAccumulator();

    /** The permit currently held; null while the request runs without one */
    private Permit permit;

    /** Whether the one extra server-directed attempt was granted */
    private boolean extensionUsed;

    ApiRequestExecutionContext(Permit permit) {
        this.permit = Objects.requireNonNull(permit, "permit");
    }

    DiagnosticsAccumulator getDiagnostics() {
        return diagnostics;
    }

    boolean hasPermit() {
        return permit != null;
    }

    /**
     * Releases the held permit, if any, and forgets it.
     */
    void releasePermit() {
        if (permit != null) {
            permit.release();
            permit = null;
        }
    }

    /**
     * Installs a newly acquired permit, releasing any permit still held.
     *
     * @param newPermit The permit to hold from now on
     */
    void replacePermit(Permit newPermit) {
        releasePermit();
        this.permit = Objects.requireNonNull(newPermit, "newPermit");
    }

    boolean isExtensionUsed() {
        return extensionUsed;
    }

    void markExtensionUsed() {
        this.extensionUsed = true;
    }
}
