package org.notevault.engine.service;

import org.notevault.engine.dto.RenderedDocument;
import org.notevault.engine.dto.WatermarkMark;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Produces per-recipient copies of a document. Implementations never modify the input bytes and
 * never write to any store, so they can run concurrently.
 */
public interface WatermarkRenderer {

    String RECIPIENT_KEY = "NoteVault-Recipient";
    String TIMESTAMP_KEY = "NoteVault-Timestamp";
    String MARK_KEY = "NoteVault-Mark";
    String DOCUMENT_KEY = "NoteVault-Document";
    String WATERMARK_KEY = "NoteVault-Watermark";

    /**
     * Renders a copy carrying a visible mark on every page and an embedded metadata mark.
     * Identical inputs give identical bytes.
     *
     * @throws org.notevault.engine.exception.UnsupportedFormatException if the bytes are not a supported document
     * @throws org.notevault.engine.exception.RenderException on any other failure, no partial output is returned
     */
    RenderedDocument render(byte[] documentBytes, String recipient, OffsetDateTime timestamp);

    /**
     * Reads the embedded mark of a rendered copy, if it still carries one.
     */
    Optional<WatermarkMark> inspect(byte[] renderedBytes);
}
