package ru.oparin.drawer.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * В пуле канала нет ни одного активного ключа (пул пуст или все ключи отключены).
 * При автоматическом выборе канала содержит все каналы, в которых не нашлось ключа.
 */
@Getter
public class NoAvailableCredentialException extends DrawerException {

    private final List<String> channels;

    public NoAvailableCredentialException(String channel) {
        super(String.format("Нет доступных ключей для канала `%s`", channel), HttpStatus.SERVICE_UNAVAILABLE);
        this.channels = List.of(channel);
    }

    public NoAvailableCredentialException(List<String> channels) {
        super(String.format("Нет доступных ключей ни в одном канале: %s", channels), HttpStatus.SERVICE_UNAVAILABLE);
        this.channels = List.copyOf(channels);
    }

    /**
     * Первый (для закрепленного канала единственный) канал без ключей.
     */
    public String getChannel() {
        return channels.isEmpty() ? null : channels.get(0);
    }
}
