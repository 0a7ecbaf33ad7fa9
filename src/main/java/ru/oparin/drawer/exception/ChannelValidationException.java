package ru.oparin.drawer.exception;

import org.springframework.http.HttpStatus;

/**
 * Некорректное описание канала или ссылка на несуществующий канал/ключ.
 * Всегда возвращается вызывающему сразу, без повторов.
 */
public class ChannelValidationException extends DrawerException {

    public ChannelValidationException(String message) {
        super(message, HttpStatus.BAD_REQUEST);
    }

    public ChannelValidationException(String message, HttpStatus status) {
        super(message, status);
    }

    public static ChannelValidationException unknownChannel(String name) {
        return new ChannelValidationException(
                String.format("Канал `%s` не найден", name), HttpStatus.NOT_FOUND);
    }

    public static ChannelValidationException unknownCredential(String channel, int index) {
        return new ChannelValidationException(
                String.format("В канале `%s` нет ключа с номером %d", channel, index), HttpStatus.NOT_FOUND);
    }
}
