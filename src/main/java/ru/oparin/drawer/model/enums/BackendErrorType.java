package ru.oparin.drawer.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Типы ошибок бэкендов генерации (для метрик и решения о ротации).
 */
@Getter
@RequiredArgsConstructor
public enum BackendErrorType {
    TIMEOUT(true),
    CONNECTION_ERROR(true),
    RATE_LIMITED(true),
    HTTP_5XX(true),
    PAYLOAD_TOO_LARGE(true),
    EMPTY_RESPONSE(true),
    NO_IMAGE_IN_RESPONSE(true),
    MALFORMED_RESPONSE(true),
    IMAGE_DOWNLOAD_FAILED(true),
    UNKNOWN_ERROR(true),

    CREDENTIAL_REJECTED(false),
    QUOTA_EXHAUSTED(false),
    REQUEST_REJECTED(false);

    /**
     * Можно ли повторить запрос с другим ключом или каналом.
     */
    private final boolean retryable;
}
