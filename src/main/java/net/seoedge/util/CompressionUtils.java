package net.seoedge.util;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.ZipException;

/**
 * Gzip helpers for large cached string values.
 */
public final class CompressionUtils {

    private CompressionUtils() {
    }

    /**
     * Compresses the UTF-8 bytes of {@code text}.
     *
     * @param text value to compress, must not be null
     * @return gzip bytes
     */
    public static byte[] gzipUtf8(String text) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             GZIPOutputStream gos = new GZIPOutputStream(baos)) {
            gos.write(text.getBytes(StandardCharsets.UTF_8));
            gos.finish();
            return baos.toByteArray();
        } catch (IOException ex) {
            // in-memory streams only fail on programming errors
            throw new UncheckedIOException("Failed to gzip cache value", ex);
        }
    }

    /**
     * Decodes the provided bytes as gzip-compressed UTF-8. Throws when decompression fails.
     *
     * @param raw byte array expected to contain gzip data
     * @return decoded UTF-8 string, or {@code null} when the payload is empty
     * @throws IOException when decompression fails
     */
    public static String decodeUtf8ExpectingGzip(byte[] raw) throws IOException {
        if (raw == null || raw.length == 0) {
            return null;
        }
        try (GZIPInputStream gis = new GZIPInputStream(new ByteArrayInputStream(raw));
             ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            byte[] buffer = new byte[1024];
            int len;
            while ((len = gis.read(buffer)) > 0) {
                baos.write(buffer, 0, len);
            }
            return baos.toString(StandardCharsets.UTF_8);
        } catch (ZipException ex) {
            throw new IOException("Failed to decompress gzip data", ex);
        }
    }
}
