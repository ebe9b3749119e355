package org.notevault.engine.exception;

public interface NoteVaultException {

    String INTEGRITY = "Integrity";
    String LEDGER_UNAVAILABLE = "LedgerUnavailable";
    String NOT_FOUND = "NotFound";
    String RENDER = "Render";
    String RETRIEVAL = "Retrieval";
    String STORAGE = "Storage";
    String UNSUPPORTED_FORMAT = "UnsupportedFormat";
    String VALIDATION = "Validation";
}
