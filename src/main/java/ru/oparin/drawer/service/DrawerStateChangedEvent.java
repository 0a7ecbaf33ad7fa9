package ru.oparin.drawer.service;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Событие изменения состояния каналов, ключей или промптов.
 * По нему состояние сохраняется в хранилище.
 */
@Getter
public class DrawerStateChangedEvent extends ApplicationEvent {

    /**
     * Краткое описание изменения для логов.
     */
    private final String reason;

    public DrawerStateChangedEvent(Object source, String reason) {
        super(source);
        this.reason = reason;
    }
}
