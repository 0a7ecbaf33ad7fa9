package ru.oparin.drawer.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import ru.oparin.drawer.config.properties.DrawerProperties;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Распределение ключей без указанного канала по префиксу: ключи сторонних прокси
 * (по умолчанию начинаются с {@code sk-}) идут в сторонний канал, остальные в основной.
 */
@Component
@RequiredArgsConstructor
public class CredentialClassifier {

    private final DrawerProperties properties;

    /**
     * Определить канал для ключа.
     */
    public String channelFor(String credential) {
        DrawerProperties.Credentials settings = properties.getCredentials();
        String prefix = settings.getThirdPartyPrefix();
        if (prefix != null && !prefix.isEmpty() && credential.startsWith(prefix)) {
            return settings.getThirdPartyChannel();
        }
        return settings.getFirstPartyChannel();
    }

    /**
     * Сгруппировать ключи по каналам, сохраняя порядок. Пустые значения пропускаются.
     */
    public Map<String, List<String>> classify(Collection<String> credentials) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (String raw : credentials) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String value = raw.trim();
            result.computeIfAbsent(channelFor(value), channel -> new ArrayList<>()).add(value);
        }
        return result;
    }
}
