package org.notevault.engine.exception;

public abstract class AbstractNoteVaultException extends RuntimeException {

    public AbstractNoteVaultException(String message) {
        super(message);
    }

    public AbstractNoteVaultException(String message, Throwable cause) {
        super(message, cause);
    }

    public AbstractNoteVaultException(Throwable cause) {
        super(cause);
    }

    public abstract String getError();

}
