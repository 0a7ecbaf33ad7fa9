package ru.oparin.drawer.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import ru.oparin.drawer.exception.ChannelValidationException;
import ru.oparin.drawer.exception.DrawerException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Именованные промпты (пресеты). Хранятся вместе с каналами и ключами.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromptPresetService {

    private final ApplicationEventPublisher eventPublisher;

    private final Map<String, String> prompts = new LinkedHashMap<>();

    /**
     * Добавить или заменить промпт.
     *
     * @return true если промпт с таким именем уже был и заменен
     */
    public boolean save(String name, String text) {
        if (!StringUtils.hasText(name) || name.trim().chars().anyMatch(Character::isWhitespace)) {
            throw new ChannelValidationException("Имя промпта не может быть пустым или содержать пробелы");
        }
        if (!StringUtils.hasText(text)) {
            throw new ChannelValidationException("Текст промпта не может быть пустым");
        }
        boolean replaced;
        synchronized (prompts) {
            replaced = prompts.put(name.trim(), text.trim()) != null;
        }
        log.info("Промпт {} {}", name.trim(), replaced ? "обновлен" : "добавлен");
        publish("save prompt " + name.trim());
        return replaced;
    }

    public String get(String name) {
        synchronized (prompts) {
            String text = prompts.get(name);
            if (text == null) {
                throw notFound(name);
            }
            return text;
        }
    }

    public Map<String, String> list() {
        synchronized (prompts) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(prompts));
        }
    }

    public void delete(String name) {
        synchronized (prompts) {
            if (prompts.remove(name) == null) {
                throw notFound(name);
            }
        }
        log.info("Промпт {} удален", name);
        publish("delete prompt " + name);
    }

    /**
     * Восстановить промпты из сохраненного состояния без события сохранения.
     */
    public void restore(Map<String, String> saved) {
        if (saved == null) {
            return;
        }
        synchronized (prompts) {
            saved.forEach((name, text) -> {
                if (StringUtils.hasText(name) && text != null) {
                    prompts.put(name, text);
                }
            });
        }
    }

    private DrawerException notFound(String name) {
        return new DrawerException(String.format("Промпт `%s` не найден", name), HttpStatus.NOT_FOUND);
    }

    private void publish(String reason) {
        eventPublisher.publishEvent(new DrawerStateChangedEvent(this, reason));
    }
}
