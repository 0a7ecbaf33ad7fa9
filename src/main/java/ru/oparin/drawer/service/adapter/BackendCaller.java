package ru.oparin.drawer.service.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import ru.oparin.drawer.config.properties.DrawerProperties;
import ru.oparin.drawer.exception.BackendFailureException;
import ru.oparin.drawer.exception.ChannelValidationException;
import ru.oparin.drawer.model.domain.Channel;
import ru.oparin.drawer.model.domain.GeneratedImage;
import ru.oparin.drawer.model.domain.GenerationRequest;
import ru.oparin.drawer.model.domain.ImagePayload;
import ru.oparin.drawer.model.domain.WireRequest;
import ru.oparin.drawer.model.enums.BackendErrorType;
import ru.oparin.drawer.model.enums.ChannelFormat;

import java.net.URI;
import java.util.Map;

/**
 * Выполнение одного обращения к бэкенду: кодирование запроса адаптером формата,
 * отправка (обычная или потоковая SSE), поиск изображения в ответе и получение его байтов.
 * <p>
 * Любая ошибка на выходе приведена к {@link BackendFailureException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackendCaller {

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient backendWebClient;
    private final Map<ChannelFormat, FormatAdapter> formatAdapters;
    private final BackendErrorClassifier errorClassifier;
    private final ImagePayloadResolver payloadResolver;
    private final ObjectMapper objectMapper;
    private final DrawerProperties properties;

    /**
     * Отправить запрос в канал с указанным ключом.
     *
     * @param channel канал
     * @param secret  API ключ
     * @param request логический запрос
     * @return изображение или ошибка {@link BackendFailureException}
     */
    public Mono<GeneratedImage> call(Channel channel, String secret, GenerationRequest request) {
        return Mono.defer(() -> {
                    FormatAdapter adapter = resolveAdapter(channel);
                    WireRequest wireRequest = adapter.encode(channel, secret, request, channel.isStreaming());
                    log.debug("Запрос в канал {} ({}), streaming={}, изображений: {}",
                            channel.getName(), channel.getFormat(), wireRequest.isStreaming(), request.getImages().size());
                    Mono<ImagePayload> payload = wireRequest.isStreaming()
                            ? sendStreaming(wireRequest, adapter)
                            : sendPlain(wireRequest, adapter);
                    return payload.flatMap(payloadResolver::resolve);
                })
                .onErrorMap(error -> !(error instanceof ChannelValidationException), errorClassifier::classify);
    }

    private FormatAdapter resolveAdapter(Channel channel) {
        FormatAdapter adapter = formatAdapters.get(channel.getFormat());
        if (adapter == null) {
            throw new ChannelValidationException("Неподдерживаемый формат канала: " + channel.getFormat());
        }
        return adapter;
    }

    private Mono<ImagePayload> sendPlain(WireRequest wireRequest, FormatAdapter adapter) {
        return prepare(wireRequest)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(properties.getHttp().getRequestTimeout())
                .switchIfEmpty(Mono.error(() -> new BackendFailureException(
                        "Пустой ответ от бэкенда", BackendErrorType.EMPTY_RESPONSE, null)))
                .map(body -> {
                    if (body.isBlank()) {
                        throw new BackendFailureException("Пустой ответ от бэкенда", BackendErrorType.EMPTY_RESPONSE, null);
                    }
                    ImagePayload payload = adapter.decode(parse(body));
                    if (payload == null) {
                        log.warn("Ответ бэкенда не содержит изображения: {}", abbreviate(body));
                        throw new BackendFailureException("Не найдено изображения в ответе бэкенда",
                                BackendErrorType.NO_IMAGE_IN_RESPONSE, null);
                    }
                    return payload;
                });
    }

    /**
     * События потока разбираются по одному до первого изображения или маркера [DONE].
     */
    private Mono<ImagePayload> sendStreaming(WireRequest wireRequest, FormatAdapter adapter) {
        return prepare(wireRequest)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .retrieve()
                .bodyToFlux(SSE_TYPE)
                .mapNotNull(ServerSentEvent::data)
                .map(String::trim)
                .takeWhile(data -> !AdapterConstants.STREAM_DONE.equals(data) && !"DONE".equals(data))
                .filter(data -> !data.isEmpty())
                .mapNotNull(data -> decodeChunkQuietly(adapter, data))
                .next()
                .timeout(properties.getHttp().getStreamTimeout())
                .switchIfEmpty(Mono.error(() -> new BackendFailureException(
                        "Поток бэкенда завершился без изображения", BackendErrorType.NO_IMAGE_IN_RESPONSE, null)));
    }

    private WebClient.RequestHeadersSpec<?> prepare(WireRequest wireRequest) {
        return backendWebClient.post()
                .uri(URI.create(wireRequest.getUrl()))
                .headers(headers -> wireRequest.getHeaders().forEach(headers::set))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(wireRequest.getBody());
    }

    private JsonNode parse(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new BackendFailureException("Ответ бэкенда не является JSON: " + abbreviate(body),
                    BackendErrorType.MALFORMED_RESPONSE, null, e);
        }
    }

    private ImagePayload decodeChunkQuietly(FormatAdapter adapter, String data) {
        try {
            return adapter.decodeChunk(objectMapper.readTree(data));
        } catch (JsonProcessingException e) {
            log.debug("Пропущено событие потока, не являющееся JSON: {}", abbreviate(data));
            return null;
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 300 ? text.substring(0, 300) + "..." : text;
    }
}
