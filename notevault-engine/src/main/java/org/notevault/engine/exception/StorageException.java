package org.notevault.engine.exception;

public class StorageException extends AbstractNoteVaultException {
    public StorageException(Throwable cause) {
        super(cause);
    }

    @Override
    public String getError() {
        return NoteVaultException.STORAGE;
    }

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
