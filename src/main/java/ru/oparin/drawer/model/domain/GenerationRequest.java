package ru.oparin.drawer.model.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Логический запрос на генерацию изображения, не зависящий от формата бэкенда.
 */
@Value
@Builder
public class GenerationRequest {

    String prompt;

    /**
     * Исходные изображения в порядке передачи (может быть пустым).
     */
    @Singular
    List<SourceImage> images;

    /**
     * Имя канала, если вызывающий закрепил конкретный канал; null означает автоматический выбор.
     */
    String channel;

    public boolean hasImages() {
        return images != null && !images.isEmpty();
    }

    public boolean isChannelPinned() {
        return channel != null && !channel.isBlank();
    }
}
