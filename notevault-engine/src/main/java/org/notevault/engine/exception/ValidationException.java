package org.notevault.engine.exception;

public class ValidationException extends AbstractNoteVaultException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getError() {
        return NoteVaultException.VALIDATION;
    }
}
