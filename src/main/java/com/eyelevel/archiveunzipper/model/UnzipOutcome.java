package com.eyelevel.archiveunzipper.model;

/**
 * The terminal result of one run, before it is flattened into a {@link TaskStatus}.
 *
 * @param kind             {@code null} on success, otherwise the reason the run stopped.
 * @param message          the error message on failure, {@code null} on success.
 * @param entriesPublished number of entries uploaded and announced before the run ended.
 */
public record UnzipOutcome(UnzipFailureKind kind, String message, int entriesPublished) {

    public static UnzipOutcome success(int entriesPublished) {
        return new UnzipOutcome(null, null, entriesPublished);
    }

    public static UnzipOutcome failure(UnzipFailureKind kind, String message, int entriesPublished) {
        return new UnzipOutcome(kind, message, entriesPublished);
    }

    public boolean isSuccess() {
        return kind == null;
    }

    public String toStatusText() {
        return isSuccess() ? TaskStatus.SUCCEEDED : TaskStatus.ERROR_PREFIX + message;
    }
}
