package ru.oparin.drawer.exception;

import jakarta.validation.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleAllExceptions(Exception ex) {
        log.error("Неизвестная ошибка: ", ex);

        return Mono.just(ResponseEntity.internalServerError()
                .body(Map.of(
                        "error", "Внутренняя ошибка сервера",
                        "status", 500,
                        "details", ex.getMessage() != null ? ex.getMessage() : "Unknown error"
                )));
    }

    @ExceptionHandler(DrawerException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleDrawerException(DrawerException ex) {
        log.warn("Ошибка обработки запроса [{}]: {}", ex.getStatus().value(), ex.getMessage());

        return Mono.just(ResponseEntity.status(ex.getStatus())
                .body(Map.of(
                        "error", ex.getMessage(),
                        "status", ex.getStatus().value()
                )));
    }

    @ExceptionHandler(BackendFailureException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleBackendFailure(BackendFailureException ex) {
        log.warn("Бэкенд генерации отклонил запрос [{}]: {}", ex.getErrorType(), ex.getMessage());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", ex.getMessage());
        body.put("status", ex.getStatus().value());
        body.put("errorType", ex.getErrorType().name());
        if (ex.getBackendStatus() != null) {
            body.put("details", Map.of("backendStatus", ex.getBackendStatus()));
        }
        return Mono.just(ResponseEntity.status(ex.getStatus()).body(body));
    }

    @ExceptionHandler(AllChannelsExhaustedException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleExhausted(AllChannelsExhaustedException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempts", ex.getAttempts());
        details.put("channelsTried", ex.getChannelsTried());
        details.put("channelsWithoutCredentials", ex.getChannelsWithoutCredentials());
        if (ex.getLastBackendStatus() != null) {
            details.put("lastBackendStatus", ex.getLastBackendStatus());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", ex.getMessage());
        body.put("status", ex.getStatus().value());
        if (ex.getLastErrorType() != null) {
            body.put("errorType", ex.getLastErrorType().name());
        }
        body.put("details", details);
        return Mono.just(ResponseEntity.status(ex.getStatus()).body(body));
    }

    @ExceptionHandler(ValidationException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleValidationException(ValidationException ex) {
        return Mono.just(ResponseEntity.badRequest()
                .body(Map.of(
                        "error", "Ошибка валидации",
                        "status", 400,
                        "details", ex.getMessage()
                )));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleValidationException(WebExchangeBindException ex) {
        Map<String, String> errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        FieldError::getField,
                        fieldError -> fieldError.getDefaultMessage() != null ?
                                fieldError.getDefaultMessage() : "Invalid value",
                        (first, second) -> first
                ));

        return Mono.just(ResponseEntity.badRequest()
                .body(Map.of(
                        "error", "Ошибка валидации данных",
                        "status", 400,
                        "details", errors
                )));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleInputException(ServerWebInputException ex) {
        return Mono.just(ResponseEntity.badRequest()
                .body(Map.of(
                        "error", "Некорректный запрос",
                        "status", 400,
                        "details", ex.getReason() != null ? ex.getReason() : ex.getMessage()
                )));
    }
}
