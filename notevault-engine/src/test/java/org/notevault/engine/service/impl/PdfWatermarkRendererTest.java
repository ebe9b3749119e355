package org.notevault.engine.service.impl;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.notevault.engine.config.WatermarkProperties;
import org.notevault.engine.dto.RenderedDocument;
import org.notevault.engine.dto.WatermarkMark;
import org.notevault.engine.exception.UnsupportedFormatException;
import org.notevault.engine.service.WatermarkRenderer;
import org.notevault.engine.support.TestPdfs;
import org.notevault.engine.utils.FingerprintUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PdfWatermarkRendererTest {

    private static final OffsetDateTime AT = OffsetDateTime.of(2024, 3, 1, 10, 15, 30, 123_000_000, ZoneOffset.UTC);

    private PdfWatermarkRenderer renderer;
    private byte[] original;

    @BeforeEach
    void setUp() {
        renderer = new PdfWatermarkRenderer(new WatermarkProperties());
        original = TestPdfs.pdf("Chapter 1: Limits", "Chapter 2: Derivatives");
    }

    @Test
    void render_sameInputs_produceIdenticalBytes() {
        RenderedDocument first = renderer.render(original, "alice", AT);
        RenderedDocument second = renderer.render(original, "alice", AT);

        assertArrayEquals(first.content(), second.content());
        assertEquals(first.renderFingerprint(), second.renderFingerprint());
    }

    @Test
    void render_differentRecipientOrTimestamp_produceDistinctCopies() {
        RenderedDocument alice = renderer.render(original, "alice", AT);
        RenderedDocument bob = renderer.render(original, "bob", AT);
        RenderedDocument aliceLater = renderer.render(original, "alice", AT.plusNanos(1_000_000));

        assertNotEquals(alice.renderFingerprint(), bob.renderFingerprint());
        assertNotEquals(alice.renderFingerprint(), aliceLater.renderFingerprint());
        assertNotEquals(alice.mark().markId(), aliceLater.mark().markId());
    }

    @Test
    void render_neverModifiesInput() {
        byte[] snapshot = original.clone();

        renderer.render(original, "alice", AT);

        assertArrayEquals(snapshot, original);
    }

    @Test
    void render_outputDiffersFromOriginal() {
        RenderedDocument rendered = renderer.render(original, "alice", AT);

        assertFalse(Arrays.equals(original, rendered.content()));
        assertEquals(FingerprintUtils.sha256(rendered.content()), rendered.renderFingerprint());
        assertEquals(FingerprintUtils.sha256(original), rendered.mark().documentFingerprint());
    }

    @Test
    void render_markIdIsDerivedFromDocumentRecipientAndMillis() {
        RenderedDocument rendered = renderer.render(original, "alice", AT);

        String expected = FingerprintUtils.sha256(FingerprintUtils.sha256(original) + "|alice|" + AT.toInstant().toEpochMilli());
        assertEquals(expected, rendered.mark().markId());
    }

    @Test
    void render_drawsRecipientOnEveryPage() throws IOException {
        RenderedDocument rendered = renderer.render(original, "alice", AT);

        try (PDDocument document = Loader.loadPDF(rendered.content())) {
            assertEquals(2, document.getNumberOfPages());
            PDFTextStripper stripper = new PDFTextStripper();
            for (int page = 1; page <= document.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String text = stripper.getText(document).replaceAll("\\s+", "");
                assertTrue(text.contains("Downloadedby:alice"), "footer missing on page " + page);
                assertTrue(text.contains("ID:" + rendered.mark().markId().substring(0, 8)), "mark id missing on page " + page);
            }
        }
    }

    @Test
    void render_embedsMarkInDocumentInformation() throws IOException {
        RenderedDocument rendered = renderer.render(original, "alice", AT);

        try (PDDocument document = Loader.loadPDF(rendered.content())) {
            PDDocumentInformation info = document.getDocumentInformation();
            assertEquals("alice", info.getCustomMetadataValue(WatermarkRenderer.RECIPIENT_KEY));
            assertEquals("2024-03-01T10:15:30.123Z", info.getCustomMetadataValue(WatermarkRenderer.TIMESTAMP_KEY));
            assertEquals(rendered.mark().markId(), info.getCustomMetadataValue(WatermarkRenderer.MARK_KEY));
            assertEquals(rendered.mark().documentFingerprint(), info.getCustomMetadataValue(WatermarkRenderer.DOCUMENT_KEY));
            assertTrue(info.getCustomMetadataValue(WatermarkRenderer.WATERMARK_KEY).startsWith("{\"document\":"));
        }
    }

    @Test
    void render_nonWinAnsiRecipient_keepsExactValueInMetadata() {
        String recipient = "学生 #42";

        RenderedDocument rendered = renderer.render(original, recipient, AT);

        Optional<WatermarkMark> mark = renderer.inspect(rendered.content());
        assertTrue(mark.isPresent());
        assertEquals(recipient, mark.get().recipient());
    }

    @Test
    void render_normalizesTimestampToUtcMillis() {
        OffsetDateTime local = OffsetDateTime.of(2024, 3, 1, 12, 15, 30, 123_456_789, ZoneOffset.ofHours(2));

        RenderedDocument rendered = renderer.render(original, "alice", local);

        assertEquals(AT, rendered.mark().timestamp());
    }

    @Test
    void inspect_readsBackEmbeddedMark() {
        RenderedDocument rendered = renderer.render(original, "alice", AT);

        Optional<WatermarkMark> mark = renderer.inspect(rendered.content());

        assertEquals(Optional.of(rendered.mark()), mark);
    }

    @Test
    void inspect_unmarkedDocument_returnsEmpty() {
        assertTrue(renderer.inspect(original).isEmpty());
    }

    @Test
    void inspect_notAPdf_returnsEmpty() {
        assertTrue(renderer.inspect("plain text".getBytes(StandardCharsets.UTF_8)).isEmpty());
    }

    @Test
    void render_notAPdf_throwsUnsupportedFormat() {
        byte[] text = "plain text".getBytes(StandardCharsets.UTF_8);
        assertThrows(UnsupportedFormatException.class, () -> renderer.render(text, "alice", AT));
    }

    @Test
    void render_encryptedPdf_throwsUnsupportedFormat() {
        byte[] encrypted = TestPdfs.encryptedPdf();
        assertThrows(UnsupportedFormatException.class, () -> renderer.render(encrypted, "alice", AT));
    }

    @Test
    void render_emptyInput_throwsUnsupportedFormat() {
        assertThrows(UnsupportedFormatException.class, () -> renderer.render(new byte[0], "alice", AT));
    }
}
