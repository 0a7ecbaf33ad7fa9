package ru.oparin.drawer.util;

import lombok.experimental.UtilityClass;

/**
 * Определение MIME типа изображения по сигнатуре (magic bytes).
 */
@UtilityClass
public class ImageMimeDetector {

    public static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};
    private static final byte[] JPEG_SIGNATURE = {(byte) 0xFF, (byte) 0xD8};
    private static final byte[] GIF_SIGNATURE = {'G', 'I', 'F', '8'};
    private static final byte[] RIFF_SIGNATURE = {'R', 'I', 'F', 'F'};
    private static final byte[] WEBP_SIGNATURE = {'W', 'E', 'B', 'P'};

    /**
     * Определить MIME тип по первым байтам.
     *
     * @param data содержимое изображения
     * @return MIME тип или application/octet-stream, если формат не распознан
     */
    public static String detect(byte[] data) {
        if (data == null) {
            return DEFAULT_MIME_TYPE;
        }
        if (startsWith(data, PNG_SIGNATURE, 0)) {
            return "image/png";
        }
        if (startsWith(data, JPEG_SIGNATURE, 0)) {
            return "image/jpeg";
        }
        if (startsWith(data, GIF_SIGNATURE, 0)) {
            return "image/gif";
        }
        if (startsWith(data, RIFF_SIGNATURE, 0) && startsWith(data, WEBP_SIGNATURE, 8)) {
            return "image/webp";
        }
        return DEFAULT_MIME_TYPE;
    }

    /**
     * Вернуть MIME тип, если он задан явно, иначе определить по содержимому.
     */
    public static String resolve(String declaredMimeType, byte[] data) {
        if (declaredMimeType != null && declaredMimeType.startsWith("image/")) {
            return declaredMimeType;
        }
        return detect(data);
    }

    private static boolean startsWith(byte[] data, byte[] signature, int offset) {
        if (data.length < offset + signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if (data[offset + i] != signature[i]) {
                return false;
            }
        }
        return true;
    }
}
