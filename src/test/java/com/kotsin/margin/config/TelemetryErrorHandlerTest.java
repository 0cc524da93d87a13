package com.kotsin.margin.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TelemetryErrorHandler payload previews
 */
class TelemetryErrorHandlerTest {

    @Test
    @DisplayName("Payload preview decodes multi-byte characters as UTF-8")
    void testPreviewIsUtf8() {
        String payload = "{\"accountId\":\"компания-€\",\"equity\":\"n/a\"}";

        assertEquals(payload, TelemetryErrorHandler.preview(payload.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("Missing or empty payload previews as <empty>")
    void testEmptyPreview() {
        assertEquals("<empty>", TelemetryErrorHandler.preview(null));
        assertEquals("<empty>", TelemetryErrorHandler.preview(new byte[0]));
    }

    @Test
    @DisplayName("Long payloads are cut at the preview limit")
    void testPreviewIsTruncated() {
        byte[] payload = new byte[TelemetryErrorHandler.PREVIEW_BYTES + 100];
        Arrays.fill(payload, (byte) 'x');

        assertEquals(TelemetryErrorHandler.PREVIEW_BYTES, TelemetryErrorHandler.preview(payload).length());
    }
}
