package org.notevault.engine.exception;

import lombok.Getter;
import org.notevault.engine.enums.RetrievalState;

import java.util.UUID;

/**
 * Terminal failure of a retrieval. {@link #getFailedAt()} is the last state the request
 * reached before the failing transition, {@link #getError()} is the kind of the cause.
 */
@Getter
public class RetrievalFailedException extends AbstractNoteVaultException {

    private final UUID entryId;
    private final RetrievalState failedAt;

    public RetrievalFailedException(UUID entryId, RetrievalState failedAt, Throwable cause) {
        super(String.format("Retrieval of %s failed after %s: %s", entryId, failedAt, cause.getMessage()), cause);
        this.entryId = entryId;
        this.failedAt = failedAt;
    }

    @Override
    public String getError() {
        if (getCause() instanceof AbstractNoteVaultException noteVaultException) {
            return noteVaultException.getError();
        }
        return NoteVaultException.RETRIEVAL;
    }
}
