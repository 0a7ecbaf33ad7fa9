package ru.oparin.drawer.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Базовое исключение шлюза генерации. Несет HTTP статус для ответа клиенту.
 */
@Getter
public class DrawerException extends RuntimeException {
    private final HttpStatus status;

    public DrawerException(String message, HttpStatus status) {
        super(message);
        this.status = status;
    }

    public DrawerException(String message, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
