package ru.oparin.drawer.model.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Запрос в формате конкретного бэкенда: URL, заголовки и тело.
 */
@Value
@Builder
public class WireRequest {

    String url;

    @Singular
    Map<String, String> headers;

    /**
     * Тело запроса (DTO, сериализуемый Jackson).
     */
    Object body;

    boolean streaming;
}
