package ru.oparin.drawer.repository;

import ru.oparin.drawer.model.state.DrawerState;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Хранилище состояния в памяти процесса (когда файл состояния не настроен).
 */
public class InMemoryDrawerStateStore implements DrawerStateStore {

    private final AtomicReference<DrawerState> state = new AtomicReference<>();

    @Override
    public Optional<DrawerState> load() {
        return Optional.ofNullable(state.get());
    }

    @Override
    public void save(DrawerState state) {
        this.state.set(state);
    }
}
