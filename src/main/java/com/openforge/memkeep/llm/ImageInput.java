package com.openforge.memkeep.llm;

import java.util.Base64;

/**
 * An image attached to a reasoning call.
 *
 * @param mimeType e.g. image/png
 * @param data     raw image bytes
 */
public record ImageInput(String mimeType, byte[] data) {

    public ImageInput {
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("image data must not be empty");
        }
        mimeType = mimeType == null || mimeType.isBlank() ? "image/jpeg" : mimeType;
    }

    /** Sniffs the MIME type from the magic bytes; unknown formats are sent as JPEG. */
    public static ImageInput of(byte[] data) {
        return new ImageInput(sniffMimeType(data), data);
    }

    static String sniffMimeType(byte[] d) {
        if (d == null) return null;
        if (d.length >= 4 && (d[0] & 0xFF) == 0x89 && d[1] == 'P' && d[2] == 'N' && d[3] == 'G') return "image/png";
        if (d.length >= 4 && d[0] == 'G' && d[1] == 'I' && d[2] == 'F' && d[3] == '8') return "image/gif";
        if (d.length >= 12 && d[0] == 'R' && d[1] == 'I' && d[2] == 'F' && d[3] == 'F'
                && d[8] == 'W' && d[9] == 'E' && d[10] == 'B' && d[11] == 'P') return "image/webp";
        return "image/jpeg";
    }

    /** RFC 2397 data URL, the form OpenAI-compatible vision endpoints accept. */
    public String toDataUrl() {
        return "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(data);
    }
}
