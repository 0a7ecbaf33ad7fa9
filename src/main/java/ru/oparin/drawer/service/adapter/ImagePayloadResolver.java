package ru.oparin.drawer.service.adapter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import ru.oparin.drawer.config.properties.DrawerProperties;
import ru.oparin.drawer.exception.BackendFailureException;
import ru.oparin.drawer.model.domain.GeneratedImage;
import ru.oparin.drawer.model.domain.ImagePayload;
import ru.oparin.drawer.model.enums.BackendErrorType;
import ru.oparin.drawer.util.ImageMimeDetector;

import java.net.URI;
import java.util.Base64;

/**
 * Получение байтов изображения из ответа бэкенда: декодирование base64 или загрузка по URL.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImagePayloadResolver {

    private final WebClient backendWebClient;
    private final DrawerProperties properties;

    public Mono<GeneratedImage> resolve(ImagePayload payload) {
        if (payload.isUrl()) {
            return download(payload.getUrl());
        }
        return Mono.fromCallable(() -> decodeBase64(payload));
    }

    private GeneratedImage decodeBase64(ImagePayload payload) {
        String data = payload.getBase64Data();
        int separator = data.indexOf(AdapterConstants.DATA_URL_SEPARATOR);
        if (data.startsWith(AdapterConstants.DATA_URL_PREFIX) && separator > 0) {
            data = data.substring(separator + AdapterConstants.DATA_URL_SEPARATOR.length());
        }
        byte[] bytes;
        try {
            bytes = Base64.getMimeDecoder().decode(data);
        } catch (IllegalArgumentException e) {
            throw new BackendFailureException("Некорректные base64 данные изображения в ответе бэкенда",
                    BackendErrorType.MALFORMED_RESPONSE, null, e);
        }
        if (bytes.length == 0) {
            throw new BackendFailureException("Бэкенд вернул пустое изображение",
                    BackendErrorType.EMPTY_RESPONSE, null);
        }
        return new GeneratedImage(bytes, ImageMimeDetector.resolve(payload.getMimeType(), bytes));
    }

    private Mono<GeneratedImage> download(String url) {
        log.debug("Загрузка изображения по ссылке из ответа бэкенда: {}", url);
        return backendWebClient.get()
                .uri(URI.create(url))
                .retrieve()
                .toEntity(byte[].class)
                .timeout(properties.getHttp().getRequestTimeout())
                .map(this::toImage)
                .onErrorMap(error -> !(error instanceof BackendFailureException),
                        error -> new BackendFailureException(
                                String.format("Не удалось загрузить изображение по ссылке %s: %s", url, error.getMessage()),
                                BackendErrorType.IMAGE_DOWNLOAD_FAILED, null, error));
    }

    private GeneratedImage toImage(ResponseEntity<byte[]> response) {
        byte[] bytes = response.getBody();
        if (bytes == null || bytes.length == 0) {
            throw new BackendFailureException("По ссылке из ответа бэкенда получен пустой файл",
                    BackendErrorType.IMAGE_DOWNLOAD_FAILED, null);
        }
        MediaType contentType = response.getHeaders().getContentType();
        String declared = contentType != null ? contentType.getType() + "/" + contentType.getSubtype() : null;
        return new GeneratedImage(bytes, ImageMimeDetector.resolve(declared, bytes));
    }
}
