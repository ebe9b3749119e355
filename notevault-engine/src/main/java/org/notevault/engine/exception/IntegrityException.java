package org.notevault.engine.exception;

/**
 * Stored bytes no longer hash to the fingerprint they were stored under.
 */
public class IntegrityException extends AbstractNoteVaultException {

    private final String fingerprint;

    public IntegrityException(String fingerprint, String actualHash) {
        super(String.format("Stored document %s fails integrity check, content now hashes to %s", fingerprint, actualHash));
        this.fingerprint = fingerprint;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    @Override
    public String getError() {
        return NoteVaultException.INTEGRITY;
    }
}
