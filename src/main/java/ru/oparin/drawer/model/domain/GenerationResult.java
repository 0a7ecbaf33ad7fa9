package ru.oparin.drawer.model.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Результат успешной генерации: байты изображения и сведения о том, кто его выдал.
 */
@Value
@Builder
public class GenerationResult {

    byte[] image;
    String mimeType;
    String channel;

    /**
     * Замаскированный ключ, с которым прошел запрос.
     */
    String credential;

    /**
     * Общее число обращений к бэкендам в рамках запроса, включая успешное.
     */
    int attempts;
}
