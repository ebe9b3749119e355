package org.notevault.engine.exception;

import java.util.UUID;

public class NotFoundException extends AbstractNoteVaultException {

    private static final String ENTRY_NOT_FOUND = "Catalog entry not found : ";
    private static final String DOCUMENT_NOT_FOUND = "Document not found : ";
    private static final String LEDGER_ENTRY_NOT_FOUND = "No ledger entry for render fingerprint : ";

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException entry(UUID entryId) {
        return new NotFoundException(ENTRY_NOT_FOUND + entryId);
    }

    public static NotFoundException document(String fingerprint) {
        return new NotFoundException(DOCUMENT_NOT_FOUND + fingerprint);
    }

    public static NotFoundException render(String renderFingerprint) {
        return new NotFoundException(LEDGER_ENTRY_NOT_FOUND + renderFingerprint);
    }

    @Override
    public String getError() {
        return NoteVaultException.NOT_FOUND;
    }
}
