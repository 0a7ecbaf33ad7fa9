package ru.oparin.drawer.repository;

import ru.oparin.drawer.model.state.DrawerState;

import java.util.Optional;

/**
 * Хранилище состояния каналов, ключей и промптов.
 */
public interface DrawerStateStore {

    /**
     * Загрузить сохраненное состояние.
     *
     * @return состояние или пусто, если ничего не сохранено
     */
    Optional<DrawerState> load();

    /**
     * Сохранить состояние целиком.
     */
    void save(DrawerState state);
}
