package ru.oparin.drawer.model.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Ссылка на изображение, извлеченная из ответа бэкенда: либо base64 данные, либо URL.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ImagePayload {

    String base64Data;
    String url;

    /**
     * MIME тип, если бэкенд его сообщил.
     */
    String mimeType;

    public static ImagePayload ofBase64(String base64Data, String mimeType) {
        return new ImagePayload(base64Data, null, mimeType);
    }

    public static ImagePayload ofUrl(String url) {
        return new ImagePayload(null, url, null);
    }

    public boolean isUrl() {
        return url != null;
    }
}
