package org.notevault.engine.utils;

import lombok.experimental.UtilityClass;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.io.IOUtils;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.notevault.engine.exception.UnsupportedFormatException;

import java.io.IOException;

@UtilityClass
public class PdfSupport {

    public static final String PDF_CONTENT_TYPE = "application/pdf";

    /**
     * Opens a PDF that the engine is able to watermark: readable, not encrypted, at least one page.
     * The caller owns the returned document and must close it.
     */
    public static PDDocument load(byte[] content) {
        PDDocument document;
        try {
            document = Loader.loadPDF(content);
        } catch (InvalidPasswordException e) {
            throw new UnsupportedFormatException("Password protected PDF documents are not supported", e);
        } catch (IOException e) {
            throw new UnsupportedFormatException("Content is not a readable PDF document: " + e.getMessage(), e);
        }
        try {
            if (document.isEncrypted()) {
                throw new UnsupportedFormatException("Encrypted PDF documents are not supported");
            }
            if (document.getNumberOfPages() == 0) {
                throw new UnsupportedFormatException("PDF document has no pages");
            }
            return document;
        } catch (UnsupportedFormatException e) {
            IOUtils.closeQuietly(document);
            throw e;
        }
    }
}
