package org.notevault.engine.exception;

public class UnsupportedFormatException extends AbstractNoteVaultException {

    public UnsupportedFormatException(String message) {
        super(message);
    }

    public UnsupportedFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getError() {
        return NoteVaultException.UNSUPPORTED_FORMAT;
    }
}
