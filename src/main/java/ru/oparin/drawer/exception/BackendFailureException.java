package ru.oparin.drawer.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import ru.oparin.drawer.model.enums.BackendErrorType;

/**
 * Ошибка обращения к бэкенду генерации.
 * <p>
 * Повторяемые ошибки (таймаут, лимит запросов, 5xx, ответ без изображения) поглощаются
 * движком и ведут к ротации ключа/канала. Неповторяемые (ключ отклонен, квота исчерпана,
 * запрос отклонен как некорректный) возвращаются вызывающему без дальнейших попыток.
 */
@Getter
public class BackendFailureException extends DrawerException {

    private final BackendErrorType errorType;

    /**
     * HTTP статус, который вернул бэкенд (null для таймаутов и ошибок подключения).
     */
    private final Integer backendStatus;

    public BackendFailureException(String message, BackendErrorType errorType, Integer backendStatus) {
        super(message, HttpStatus.BAD_GATEWAY);
        this.errorType = errorType;
        this.backendStatus = backendStatus;
    }

    public BackendFailureException(String message, BackendErrorType errorType, Integer backendStatus, Throwable cause) {
        super(message, HttpStatus.BAD_GATEWAY, cause);
        this.errorType = errorType;
        this.backendStatus = backendStatus;
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }
}
