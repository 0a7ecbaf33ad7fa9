package ru.oparin.drawer.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import ru.oparin.drawer.model.enums.BackendErrorType;

import java.util.List;

/**
 * Все каналы и ключи перебраны, успешного ответа нет.
 * Содержит последнюю повторяемую ошибку и сводку попыток для диагностики.
 */
@Getter
public class AllChannelsExhaustedException extends DrawerException {

    private final BackendErrorType lastErrorType;
    private final Integer lastBackendStatus;
    private final String lastErrorMessage;
    private final int attempts;
    private final List<String> channelsTried;
    private final List<String> channelsWithoutCredentials;

    public AllChannelsExhaustedException(BackendFailureException lastFailure,
                                         int attempts,
                                         List<String> channelsTried,
                                         List<String> channelsWithoutCredentials) {
        super(buildMessage(lastFailure, attempts, channelsTried, channelsWithoutCredentials),
                HttpStatus.SERVICE_UNAVAILABLE, lastFailure);
        this.lastErrorType = lastFailure != null ? lastFailure.getErrorType() : null;
        this.lastBackendStatus = lastFailure != null ? lastFailure.getBackendStatus() : null;
        this.lastErrorMessage = lastFailure != null ? lastFailure.getMessage() : null;
        this.attempts = attempts;
        this.channelsTried = List.copyOf(channelsTried);
        this.channelsWithoutCredentials = List.copyOf(channelsWithoutCredentials);
    }

    private static String buildMessage(BackendFailureException lastFailure, int attempts,
                                       List<String> channelsTried, List<String> channelsWithoutCredentials) {
        if (lastFailure == null) {
            return String.format("Нет доступных каналов генерации: попыток %d, каналы без ключей: %s",
                    attempts, channelsWithoutCredentials);
        }
        return String.format("Все каналы генерации исчерпаны: попыток %d, каналы %s, последняя ошибка [%s]: %s",
                attempts, channelsTried, lastFailure.getErrorType(), lastFailure.getMessage());
    }
}
