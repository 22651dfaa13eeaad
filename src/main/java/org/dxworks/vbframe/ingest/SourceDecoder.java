package org.dxworks.vbframe.ingest;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Decodes raw module bytes. A byte-order mark wins. Without one, non-ASCII input that is well-formed UTF-8
 * is read as UTF-8, since stray Windows-1252 text almost never is; anything else is tried strictly against the
 * declared charset (Windows-1252 by default, the VB6 IDE's encoding). Bytes that neither accepts make the
 * file undecodable.
 */
public final class SourceDecoder {

    public static final Charset DEFAULT_CHARSET = Charset.forName("windows-1252");

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    private static final byte[] UTF16LE_BOM = {(byte) 0xFF, (byte) 0xFE};
    private static final byte[] UTF16BE_BOM = {(byte) 0xFE, (byte) 0xFF};

    private final Charset declared;

    public SourceDecoder() {
        this(DEFAULT_CHARSET);
    }

    public SourceDecoder(Charset declared) {
        this.declared = declared == null ? DEFAULT_CHARSET : declared;
    }

    public SourceText decode(byte[] bytes) throws UndecodableSourceException {
        if (startsWith(bytes, UTF8_BOM)) {
            return decodeStrict(bytes, UTF8_BOM.length, StandardCharsets.UTF_8);
        }
        if (startsWith(bytes, UTF16LE_BOM)) {
            return decodeStrict(bytes, UTF16LE_BOM.length, StandardCharsets.UTF_16LE);
        }
        if (startsWith(bytes, UTF16BE_BOM)) {
            return decodeStrict(bytes, UTF16BE_BOM.length, StandardCharsets.UTF_16BE);
        }
        UndecodableSourceException utf8Failure = null;
        if (!isAscii(bytes)) {
            try {
                return decodeStrict(bytes, 0, StandardCharsets.UTF_8);
            } catch (UndecodableSourceException e) {
                utf8Failure = e;
            }
        }
        try {
            return decodeStrict(bytes, 0, declared);
        } catch (UndecodableSourceException declaredFailure) {
            if (declared.equals(StandardCharsets.UTF_8)) {
                throw declaredFailure;
            }
            if (utf8Failure == null) {
                return decodeStrict(bytes, 0, StandardCharsets.UTF_8);
            }
            utf8Failure.addSuppressed(declaredFailure);
            throw new UndecodableSourceException(
                    "Input is not valid " + declared.name() + " or UTF-8", utf8Failure);
        }
    }

    public static String checksum(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static SourceText decodeStrict(byte[] bytes, int offset, Charset charset)
            throws UndecodableSourceException {
        try {
            String text = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes, offset, bytes.length - offset))
                    .toString();
            return new SourceText(text, charset, offset);
        } catch (CharacterCodingException e) {
            throw new UndecodableSourceException("Input is not valid " + charset.name(), e);
        }
    }

    private static boolean isAscii(byte[] bytes) {
        for (byte b : bytes) {
            if (b < 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
