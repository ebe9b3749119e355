package org.notevault.engine.exception;

/**
 * The download ledger could not durably record a render. Retrievals fail closed on this error.
 */
public class LedgerUnavailableException extends AbstractNoteVaultException {

    public LedgerUnavailableException(String message) {
        super(message);
    }

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getError() {
        return NoteVaultException.LEDGER_UNAVAILABLE;
    }
}
