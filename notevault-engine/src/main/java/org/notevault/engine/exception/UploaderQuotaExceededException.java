package org.notevault.engine.exception;

public class UploaderQuotaExceededException extends ValidationException {

    public UploaderQuotaExceededException(String uploader, long activeNotes, int maxNotes) {
        super(String.format("Uploader '%s' has reached the maximum of %d notes (currently %d active)",
                uploader, maxNotes, activeNotes));
    }
}
