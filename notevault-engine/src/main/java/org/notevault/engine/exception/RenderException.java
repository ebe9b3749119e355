package org.notevault.engine.exception;

public class RenderException extends AbstractNoteVaultException {

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getError() {
        return NoteVaultException.RENDER;
    }
}
