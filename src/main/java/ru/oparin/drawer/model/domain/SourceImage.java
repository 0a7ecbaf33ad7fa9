package ru.oparin.drawer.model.domain;

import lombok.Value;

import java.util.Base64;

/**
 * Исходное изображение для редактирования (сырые байты + MIME тип).
 */
@Value
public class SourceImage {

    byte[] data;
    String mimeType;

    public String toBase64() {
        return Base64.getEncoder().encodeToString(data);
    }

    /**
     * Представить изображение как data URL: data:image/png;base64,....
     */
    public String toDataUrl() {
        return "data:" + mimeType + ";base64," + toBase64();
    }
}
