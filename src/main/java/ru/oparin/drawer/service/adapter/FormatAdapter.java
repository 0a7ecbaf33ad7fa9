package ru.oparin.drawer.service.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import ru.oparin.drawer.model.domain.Channel;
import ru.oparin.drawer.model.domain.GenerationRequest;
import ru.oparin.drawer.model.domain.ImagePayload;
import ru.oparin.drawer.model.domain.WireRequest;
import ru.oparin.drawer.model.enums.ChannelFormat;

/**
 * Преобразование логического запроса в формат конкретного API и разбор ответа.
 * Реализация выбирается по {@link ChannelFormat} канала.
 */
public interface FormatAdapter {

    /**
     * Формат API, который обслуживает адаптер.
     */
    ChannelFormat getFormat();

    /**
     * Построить запрос к бэкенду.
     *
     * @param channel   канал
     * @param secret    API ключ (может быть пустым для бэкендов без авторизации)
     * @param request   логический запрос
     * @param streaming запрашивать ли потоковый ответ
     * @return URL, заголовки и тело запроса
     */
    WireRequest encode(Channel channel, String secret, GenerationRequest request, boolean streaming);

    /**
     * Найти изображение в полном ответе.
     *
     * @return изображение или null, если его нет
     */
    default ImagePayload decode(JsonNode body) {
        return ImageContentParser.extract(body);
    }

    /**
     * Найти изображение в одном событии потока.
     *
     * @return изображение или null, если в событии его нет
     */
    default ImagePayload decodeChunk(JsonNode chunk) {
        return decode(chunk);
    }
}
