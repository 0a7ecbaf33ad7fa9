package ru.oparin.drawer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import ru.oparin.drawer.config.properties.DrawerProperties;
import ru.oparin.drawer.repository.DrawerStateStore;
import ru.oparin.drawer.repository.InMemoryDrawerStateStore;
import ru.oparin.drawer.repository.JsonFileDrawerStateStore;

import java.nio.file.Path;

/**
 * Выбор хранилища состояния: JSON файл, если задан drawer.state.file, иначе память.
 */
@Slf4j
@Configuration
public class DrawerStateStoreConfig {

    @Bean
    public DrawerStateStore drawerStateStore(DrawerProperties properties, ObjectMapper objectMapper) {
        String file = properties.getState().getFile();
        if (StringUtils.hasText(file)) {
            log.info("Состояние каналов хранится в файле {}", file);
            return new JsonFileDrawerStateStore(Path.of(file), objectMapper);
        }
        log.warn("drawer.state.file не задан, состояние каналов не переживет перезапуск");
        return new InMemoryDrawerStateStore();
    }
}
