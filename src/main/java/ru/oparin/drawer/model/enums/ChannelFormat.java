package ru.oparin.drawer.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Формат API канала генерации изображений.
 * <p>
 * Формат определяет, какой фрагмент обязателен в URL канала и нужно ли
 * передавать имя модели отдельно от URL.
 */
@Getter
@RequiredArgsConstructor
public enum ChannelFormat {
    /**
     * OpenAI-совместимый формат chat completions (сторонние прокси, самостоятельно развернутые бэкенды).
     */
    CHAT_COMPLETIONS("CHAT_COMPLETIONS", "OpenAI Chat", "/chat/completions", true),

    /**
     * Нативный формат Google Gemini. Модель зашита в URL: /models/{model}:generateContent.
     */
    GENERATE_CONTENT("GENERATE_CONTENT", "Gemini", ":generateContent", false),

    /**
     * Формат images/generations (Doubao Seedream и совместимые).
     */
    IMAGE_GENERATIONS("IMAGE_GENERATIONS", "Images API", "/images/generations", true);

    private final String code;
    private final String displayName;

    /**
     * Фрагмент, который обязан присутствовать в URL канала этого формата.
     */
    private final String requiredUrlFragment;

    /**
     * Требуется ли имя модели отдельно от URL.
     */
    private final boolean modelRequired;

    /**
     * Проверить, подходит ли URL под формат.
     *
     * @param url URL канала
     * @return true если URL содержит обязательный фрагмент
     */
    public boolean matchesUrl(String url) {
        return url != null && url.contains(requiredUrlFragment);
    }

    /**
     * Найти формат по коду (без учета регистра, допускаются дефисы вместо подчеркиваний).
     *
     * @param code код формата
     * @return формат или null, если код не распознан
     */
    public static ChannelFormat fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim().replace('-', '_');
        for (ChannelFormat format : values()) {
            if (format.code.equalsIgnoreCase(normalized)) {
                return format;
            }
        }
        return null;
    }
}
