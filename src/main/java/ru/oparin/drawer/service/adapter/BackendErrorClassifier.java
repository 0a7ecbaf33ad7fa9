package ru.oparin.drawer.service.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import ru.oparin.drawer.exception.BackendFailureException;
import ru.oparin.drawer.model.enums.BackendErrorType;

import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Классификация ошибок обращения к бэкенду.
 * <p>
 * Повторяемые: таймауты, ошибки подключения, 5xx, 408, 413, 429 (лимит запросов),
 * ответ без изображения, неразборчивый ответ, неизвестные ошибки.
 * <p>
 * Неповторяемые: 401/403 (ключ отклонен), 402 и 429 с признаком исчерпанной квоты,
 * остальные 4xx (запрос некорректен).
 */
@Slf4j
@Component
public class BackendErrorClassifier {

    private static final int MAX_BODY_IN_MESSAGE = 500;

    /**
     * Привести любую ошибку вызова к {@link BackendFailureException}.
     *
     * @param error исходная ошибка
     * @return классифицированная ошибка
     */
    public BackendFailureException classify(Throwable error) {
        if (error instanceof BackendFailureException failure) {
            return failure;
        }
        if (isTimeoutError(error)) {
            return new BackendFailureException(ErrorMessages.TIMEOUT, BackendErrorType.TIMEOUT, null, error);
        }
        if (error instanceof WebClientRequestException) {
            return new BackendFailureException(String.format(ErrorMessages.CONNECTION_TEMPLATE, error.getMessage()),
                    BackendErrorType.CONNECTION_ERROR, null, error);
        }
        if (error instanceof WebClientResponseException webError) {
            return classifyHttpError(webError.getStatusCode().value(), webError.getResponseBodyAsString(), webError);
        }
        if (error instanceof DecodingException || error instanceof JsonProcessingException) {
            return new BackendFailureException(String.format(ErrorMessages.MALFORMED_TEMPLATE, error.getMessage()),
                    BackendErrorType.MALFORMED_RESPONSE, null, error);
        }
        return new BackendFailureException(String.format(ErrorMessages.UNKNOWN_TEMPLATE, error.getMessage()),
                BackendErrorType.UNKNOWN_ERROR, null, error);
    }

    /**
     * Классифицировать HTTP ответ с кодом ошибки.
     *
     * @param statusCode HTTP статус
     * @param body       тело ответа (может быть пустым)
     * @param cause      исходное исключение (может быть null)
     * @return классифицированная ошибка
     */
    public BackendFailureException classifyHttpError(int statusCode, String body, Throwable cause) {
        BackendErrorType type = resolveType(statusCode, body);
        String message = String.format(ErrorMessages.HTTP_TEMPLATE, statusCode, truncate(body));
        return new BackendFailureException(message, type, statusCode, cause);
    }

    BackendErrorType resolveType(int statusCode, String body) {
        HttpStatus status = HttpStatus.resolve(statusCode);
        if (statusCode >= 500) {
            return BackendErrorType.HTTP_5XX;
        }
        if (status == HttpStatus.UNAUTHORIZED || status == HttpStatus.FORBIDDEN) {
            return BackendErrorType.CREDENTIAL_REJECTED;
        }
        if (status == HttpStatus.PAYMENT_REQUIRED) {
            return BackendErrorType.QUOTA_EXHAUSTED;
        }
        if (status == HttpStatus.TOO_MANY_REQUESTS) {
            return isQuotaExhausted(body) ? BackendErrorType.QUOTA_EXHAUSTED : BackendErrorType.RATE_LIMITED;
        }
        if (status == HttpStatus.REQUEST_TIMEOUT) {
            return BackendErrorType.TIMEOUT;
        }
        if (status == HttpStatus.PAYLOAD_TOO_LARGE) {
            return BackendErrorType.PAYLOAD_TOO_LARGE;
        }
        if (statusCode >= 400) {
            return BackendErrorType.REQUEST_REJECTED;
        }
        return BackendErrorType.UNKNOWN_ERROR;
    }

    private boolean isQuotaExhausted(String body) {
        if (body == null) {
            return false;
        }
        String lower = body.toLowerCase(Locale.ROOT);
        return lower.contains("insufficient_quota") || lower.contains("billing");
    }

    private boolean isTimeoutError(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TimeoutException || current instanceof io.netty.handler.timeout.TimeoutException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return error.getMessage() != null && error.getMessage().toLowerCase(Locale.ROOT).contains("timeout");
    }

    private String truncate(String body) {
        if (body == null || body.isBlank()) {
            return "<пусто>";
        }
        return body.length() > MAX_BODY_IN_MESSAGE ? body.substring(0, MAX_BODY_IN_MESSAGE) + "..." : body;
    }

    /**
     * Сообщения об ошибках бэкендов.
     */
    static final class ErrorMessages {
        private ErrorMessages() {
            throw new UnsupportedOperationException("Utility class");
        }

        static final String TIMEOUT = "Превышено время ожидания ответа от бэкенда генерации";
        static final String CONNECTION_TEMPLATE = "Не удалось подключиться к бэкенду генерации: %s";
        static final String HTTP_TEMPLATE = "Бэкенд генерации вернул ошибку. Статус: %d, тело ответа: %s";
        static final String MALFORMED_TEMPLATE = "Не удалось разобрать ответ бэкенда: %s";
        static final String UNKNOWN_TEMPLATE = "Ошибка при обращении к бэкенду генерации: %s";
    }
}
