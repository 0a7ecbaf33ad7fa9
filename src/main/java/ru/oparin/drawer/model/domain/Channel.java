package ru.oparin.drawer.model.domain;

import lombok.Builder;
import lombok.Value;
import ru.oparin.drawer.model.enums.ChannelFormat;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Канал генерации изображений: конкретный бэкенд (формат API + endpoint).
 * <p>
 * Неизменяемый объект. Любое изменение канала в реестре создает новый экземпляр
 * через {@code toBuilder()}, поэтому читатели никогда не видят наполовину обновленный канал.
 */
@Value
@Builder(toBuilder = true)
public class Channel {

    private static final Pattern GEMINI_MODEL_PATTERN = Pattern.compile("/models/([^/:?]+):");

    /**
     * Уникальное имя канала.
     */
    String name;

    ChannelFormat format;

    /**
     * Полный URL endpoint'а (для GENERATE_CONTENT включает имя модели).
     */
    String url;

    /**
     * Имя модели. Для GENERATE_CONTENT всегда null: модель зашита в URL.
     */
    String model;

    @Builder.Default
    boolean enabled = true;

    @Builder.Default
    boolean streaming = false;

    /**
     * Приоритет при автоматическом выборе канала: меньше значение, раньше попытка.
     */
    @Builder.Default
    int priority = 0;

    /**
     * Модель, с которой реально работает канал: отдельное поле или часть URL.
     *
     * @return имя модели или null, если определить не удалось
     */
    public String getEffectiveModel() {
        if (format != ChannelFormat.GENERATE_CONTENT) {
            return model;
        }
        if (url == null) {
            return null;
        }
        Matcher matcher = GEMINI_MODEL_PATTERN.matcher(url);
        return matcher.find() ? matcher.group(1) : null;
    }
}
