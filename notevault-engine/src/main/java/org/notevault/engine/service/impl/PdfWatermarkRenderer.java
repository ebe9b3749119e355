package org.notevault.engine.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.state.PDExtendedGraphicsState;
import org.apache.pdfbox.util.Matrix;
import org.notevault.engine.config.WatermarkProperties;
import org.notevault.engine.dto.RenderedDocument;
import org.notevault.engine.dto.WatermarkMark;
import org.notevault.engine.exception.RenderException;
import org.notevault.engine.exception.UnsupportedFormatException;
import org.notevault.engine.service.WatermarkRenderer;
import org.notevault.engine.utils.FingerprintUtils;
import org.notevault.engine.utils.PdfSupport;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.GregorianCalendar;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Watermarks PDF documents with PDFBox.
 * <p>
 * Every page gets a grid of diagonal, semi-transparent labels plus a footer naming the recipient,
 * so cropping one region never removes the mark. The document information dictionary carries the
 * same facts in machine-readable form, which still identifies the copy if the visible text is
 * edited out.
 */
@Slf4j
@Service
public class PdfWatermarkRenderer implements WatermarkRenderer {

    private static final String SEPARATOR = " · ";
    private static final int MARK_ID_PREFIX = 8;

    private final WatermarkProperties properties;
    private final ObjectMapper sortedKeyMapper;

    public PdfWatermarkRenderer(WatermarkProperties properties) {
        this.properties = properties;
        this.sortedKeyMapper = new ObjectMapper();
        this.sortedKeyMapper.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    @Override
    public RenderedDocument render(byte[] documentBytes, String recipient, OffsetDateTime timestamp) {
        if (documentBytes == null || documentBytes.length == 0) {
            throw new UnsupportedFormatException("Empty document");
        }
        OffsetDateTime renderedAt = timestamp.withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
        byte[] workingCopy = documentBytes.clone();
        String documentFingerprint = FingerprintUtils.sha256(workingCopy);
        String markId = FingerprintUtils.sha256(documentFingerprint + "|" + recipient + "|" + renderedAt.toInstant().toEpochMilli());
        WatermarkMark mark = new WatermarkMark(recipient, renderedAt, markId, documentFingerprint);

        try (PDDocument document = PdfSupport.load(workingCopy)) {
            log.debug("Applying watermark to {} pages for recipient {}", document.getNumberOfPages(), recipient);
            PDFont labelFont = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
            PDFont footerFont = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            String visibleRecipient = printable(footerFont, recipient);
            String visibleTimestamp = DateTimeFormatter.ISO_INSTANT.format(renderedAt.truncatedTo(ChronoUnit.SECONDS).toInstant());

            for (PDPage page : document.getPages()) {
                stampPage(document, page, labelFont, footerFont, visibleRecipient, visibleTimestamp, markId);
            }
            embedMark(document, mark);

            ByteArrayOutputStream output = new ByteArrayOutputStream(workingCopy.length + 4096);
            document.save(output);
            byte[] rendered = output.toByteArray();
            if (Arrays.equals(rendered, documentBytes)) {
                throw new RenderException("Rendered copy is identical to the original", null);
            }
            return new RenderedDocument(rendered, FingerprintUtils.sha256(rendered), mark);
        } catch (UnsupportedFormatException | RenderException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            log.error("Error applying watermark for {}: {}", recipient, e.getMessage());
            throw new RenderException("Could not render watermarked copy", e);
        }
    }

    private void stampPage(PDDocument document, PDPage page, PDFont labelFont, PDFont footerFont,
                           String recipient, String timestamp, String markId) throws IOException {
        PDRectangle box = page.getCropBox();
        float width = box.getWidth();
        float height = box.getHeight();
        float originX = box.getLowerLeftX();
        float originY = box.getLowerLeftY();

        PDExtendedGraphicsState labelState = new PDExtendedGraphicsState();
        labelState.setNonStrokingAlphaConstant(properties.getOpacity());
        PDExtendedGraphicsState footerState = new PDExtendedGraphicsState();
        footerState.setNonStrokingAlphaConstant(properties.getFooterOpacity());

        WatermarkProperties.Color color = properties.getColor();
        String label = recipient + SEPARATOR + timestamp;
        float labelWidth = labelFont.getStringWidth(label) / 1000 * properties.getFontSize();
        double angle = Math.atan2(height, width);
        float stepX = width / properties.getColumns();
        float stepY = height / properties.getRows();

        try (PDPageContentStream content = new PDPageContentStream(document, page, PDPageContentStream.AppendMode.APPEND, true, true)) {
            content.saveGraphicsState();
            content.setGraphicsStateParameters(labelState);
            content.setNonStrokingColor(color.getRed(), color.getGreen(), color.getBlue());
            for (int column = 0; column < properties.getColumns(); column++) {
                for (int row = 0; row < properties.getRows(); row++) {
                    float centerX = originX + stepX * column + stepX / 2;
                    float centerY = originY + stepY * row + stepY / 2;
                    content.beginText();
                    content.setFont(labelFont, properties.getFontSize());
                    content.setTextMatrix(Matrix.getRotateInstance(angle, centerX, centerY));
                    content.newLineAtOffset(-labelWidth / 2, 0);
                    content.showText(label);
                    content.endText();
                }
            }
            content.restoreGraphicsState();

            content.saveGraphicsState();
            content.setGraphicsStateParameters(footerState);
            content.setNonStrokingColor(color.getRed() / 2, color.getGreen() / 2, color.getBlue() / 2);
            content.beginText();
            content.setFont(footerFont, properties.getSmallFontSize());
            content.newLineAtOffset(originX + 30, originY + 30);
            content.showText("Downloaded by: " + recipient);
            content.newLineAtOffset(0, -15);
            content.showText(label);
            content.endText();

            if (width > 200) {
                content.beginText();
                content.setFont(footerFont, properties.getSmallFontSize());
                content.newLineAtOffset(originX + width - 200, originY + height - 20);
                content.showText("ID: " + markId.substring(0, MARK_ID_PREFIX));
                content.endText();
            }
            content.restoreGraphicsState();
        }
    }

    private void embedMark(PDDocument document, WatermarkMark mark) throws JsonProcessingException {
        String timestamp = DateTimeFormatter.ISO_INSTANT.format(mark.timestamp().toInstant());
        Map<String, String> fields = new TreeMap<>();
        fields.put("recipient", mark.recipient());
        fields.put("timestamp", timestamp);
        fields.put("markId", mark.markId());
        fields.put("document", mark.documentFingerprint());

        PDDocumentInformation info = document.getDocumentInformation();
        info.setCustomMetadataValue(RECIPIENT_KEY, mark.recipient());
        info.setCustomMetadataValue(TIMESTAMP_KEY, timestamp);
        info.setCustomMetadataValue(MARK_KEY, mark.markId());
        info.setCustomMetadataValue(DOCUMENT_KEY, mark.documentFingerprint());
        info.setCustomMetadataValue(WATERMARK_KEY, sortedKeyMapper.writeValueAsString(fields));
        info.setModificationDate(GregorianCalendar.from(mark.timestamp().toZonedDateTime()));
        document.setDocumentInformation(info);

        // PDFBox derives a missing /ID from the wall clock, pin it to the mark for reproducible output
        byte[] id = Arrays.copyOf(HexFormat.of().parseHex(mark.markId()), 16);
        COSArray idArray = new COSArray();
        idArray.add(new COSString(id));
        idArray.add(new COSString(id));
        document.getDocument().getTrailer().setItem(COSName.ID, idArray);
    }

    @Override
    public Optional<WatermarkMark> inspect(byte[] renderedBytes) {
        try (PDDocument document = PdfSupport.load(renderedBytes)) {
            PDDocumentInformation info = document.getDocumentInformation();
            String json = info.getCustomMetadataValue(WATERMARK_KEY);
            if (json != null) {
                Map<String, String> fields = sortedKeyMapper.readValue(json, new TypeReference<Map<String, String>>() {
                });
                return toMark(fields.get("recipient"), fields.get("timestamp"), fields.get("markId"), fields.get("document"));
            }
            return toMark(info.getCustomMetadataValue(RECIPIENT_KEY), info.getCustomMetadataValue(TIMESTAMP_KEY),
                    info.getCustomMetadataValue(MARK_KEY), info.getCustomMetadataValue(DOCUMENT_KEY));
        } catch (UnsupportedFormatException | IOException e) {
            log.warn("Could not read watermark metadata: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<WatermarkMark> toMark(String recipient, String timestamp, String markId, String document) {
        if (markId == null || !FingerprintUtils.isFingerprint(markId)) {
            return Optional.empty();
        }
        OffsetDateTime parsed = null;
        if (timestamp != null) {
            try {
                parsed = OffsetDateTime.parse(timestamp);
            } catch (DateTimeParseException e) {
                log.warn("Embedded watermark timestamp is malformed: {}", timestamp);
            }
        }
        return Optional.of(new WatermarkMark(recipient, parsed, markId, document));
    }

    /**
     * Standard 14 fonts only cover WinAnsi, anything else is shown as '?'. The metadata mark keeps the exact value.
     */
    private static String printable(PDFont font, String text) {
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            String character = new String(Character.toChars(codePoint));
            try {
                if (Character.isISOControl(codePoint)) {
                    sb.append('?');
                } else {
                    font.encode(character);
                    sb.append(character);
                }
            } catch (IllegalArgumentException | IOException e) {
                sb.append('?');
            }
        });
        return sb.toString();
    }
}
