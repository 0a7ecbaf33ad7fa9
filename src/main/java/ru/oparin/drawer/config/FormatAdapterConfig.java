package ru.oparin.drawer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.oparin.drawer.model.enums.ChannelFormat;
import ru.oparin.drawer.service.adapter.FormatAdapter;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Конфигурация для регистрации адаптеров форматов API.
 */
@Configuration
public class FormatAdapterConfig {

    /**
     * Создать Map адаптеров по формату канала.
     *
     * @param adapters все адаптеры из контекста
     * @return Map адаптеров
     */
    @Bean
    public Map<ChannelFormat, FormatAdapter> formatAdapters(List<FormatAdapter> adapters) {
        Map<ChannelFormat, FormatAdapter> result = new EnumMap<>(ChannelFormat.class);
        for (FormatAdapter adapter : adapters) {
            FormatAdapter previous = result.put(adapter.getFormat(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Два адаптера для формата " + adapter.getFormat());
            }
        }
        for (ChannelFormat format : ChannelFormat.values()) {
            if (!result.containsKey(format)) {
                throw new IllegalStateException("Нет адаптера для формата " + format);
            }
        }
        return result;
    }
}
