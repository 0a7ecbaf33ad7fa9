package ru.oparin.drawer.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import ru.oparin.drawer.model.state.DrawerState;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Хранилище состояния в JSON файле. Запись идет во временный файл,
 * который затем атомарно заменяет основной.
 */
@Slf4j
public class JsonFileDrawerStateStore implements DrawerStateStore {

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileDrawerStateStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<DrawerState> load() {
        if (!Files.exists(file)) {
            log.info("Файл состояния {} не найден, старт с пустым состоянием", file);
            return Optional.empty();
        }
        try {
            DrawerState state = objectMapper.readValue(file.toFile(), DrawerState.class);
            log.info("Загружено состояние из {}: каналов {}, промптов {}", file,
                    state.getChannels().size(), state.getPrompts().size());
            return Optional.of(state);
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось прочитать файл состояния " + file, e);
        }
    }

    @Override
    public synchronized void save(DrawerState state) {
        Path temp = null;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
            log.debug("Состояние сохранено в {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось сохранить файл состояния " + file, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Не удалось удалить временный файл {}: {}", temp, e.getMessage());
        }
    }
}
