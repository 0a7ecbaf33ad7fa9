package ru.oparin.drawer.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import ru.oparin.drawer.exception.ChannelValidationException;
import ru.oparin.drawer.model.domain.Channel;
import ru.oparin.drawer.model.enums.ChannelFormat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Реестр каналов генерации.
 * <p>
 * Читатели получают неизменяемый снимок без блокировок, писатели сериализуются
 * на общей блокировке и заменяют снимок целиком.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChannelRegistry {

    private static final Pattern GEMINI_MODEL_SEGMENT = Pattern.compile("(/models/)([^/:?]+)(:)");

    private final ApplicationEventPublisher eventPublisher;

    private final AtomicReference<Map<String, Channel>> snapshot =
            new AtomicReference<>(Collections.emptyMap());

    private final Object writeLock = new Object();

    /**
     * Добавить канал.
     *
     * @return созданный канал
     * @throws ChannelValidationException если имя занято или описание канала некорректно
     */
    public Channel addChannel(String name, ChannelFormat format, String url, String model,
                              boolean streaming, int priority) {
        Channel channel = Channel.builder()
                .name(name != null ? name.trim() : null)
                .format(format)
                .url(url != null ? url.trim() : null)
                .model(StringUtils.hasText(model) ? model.trim() : null)
                .streaming(streaming)
                .priority(priority)
                .build();
        Channel added = register(channel);
        log.info("Добавлен канал {} ({}), url={}, model={}, streaming={}, priority={}",
                added.getName(), format, added.getUrl(), added.getEffectiveModel(), streaming, priority);
        publish("add channel " + added.getName());
        return added;
    }

    /**
     * Восстановить канал из сохраненного состояния (с теми же проверками, без события).
     */
    public Channel restore(Channel channel) {
        return register(channel);
    }

    /**
     * Удалить канал.
     *
     * @return удаленный канал
     */
    public Channel removeChannel(String name) {
        Channel removed;
        synchronized (writeLock) {
            Map<String, Channel> current = snapshot.get();
            removed = current.get(name);
            if (removed == null) {
                throw ChannelValidationException.unknownChannel(name);
            }
            Map<String, Channel> next = new LinkedHashMap<>(current);
            next.remove(name);
            snapshot.set(Collections.unmodifiableMap(next));
        }
        log.info("Удален канал {}", name);
        publish("remove channel " + name);
        return removed;
    }

    public Channel setEnabled(String name, boolean enabled) {
        Channel updated = update(name, channel -> channel.toBuilder().enabled(enabled).build());
        log.info("Канал {} {}", name, enabled ? "включен" : "отключен");
        return updated;
    }

    public Channel setStreaming(String name, boolean streaming) {
        Channel updated = update(name, channel -> channel.toBuilder().streaming(streaming).build());
        log.info("Канал {}: потоковый режим {}", name, streaming ? "включен" : "отключен");
        return updated;
    }

    public Channel setPriority(String name, int priority) {
        Channel updated = update(name, channel -> channel.toBuilder().priority(priority).build());
        log.info("Канал {}: приоритет {}", name, priority);
        return updated;
    }

    /**
     * Сменить модель канала. Для GENERATE_CONTENT модель заменяется в URL.
     */
    public Channel updateModel(String name, String model) {
        if (!StringUtils.hasText(model) || model.trim().chars().anyMatch(Character::isWhitespace)) {
            throw new ChannelValidationException("Имя модели не может быть пустым или содержать пробелы");
        }
        String newModel = model.trim();
        Channel updated = update(name, channel -> {
            if (channel.getFormat() != ChannelFormat.GENERATE_CONTENT) {
                return channel.toBuilder().model(newModel).build();
            }
            Matcher matcher = GEMINI_MODEL_SEGMENT.matcher(channel.getUrl());
            if (!matcher.find()) {
                throw new ChannelValidationException(String.format(
                        "В URL канала `%s` не найден сегмент /models/<модель>:generateContent", name));
            }
            String url = channel.getUrl().substring(0, matcher.start(2)) + newModel
                    + channel.getUrl().substring(matcher.end(2));
            return channel.toBuilder().url(url).build();
        });
        log.info("Канал {}: модель изменена на {}", name, newModel);
        return updated;
    }

    public Optional<Channel> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(snapshot.get().get(name));
    }

    public Channel require(String name) {
        return find(name).orElseThrow(() -> ChannelValidationException.unknownChannel(name));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    /**
     * Все каналы в порядке добавления.
     */
    public List<Channel> list() {
        return List.copyOf(snapshot.get().values());
    }

    /**
     * Включенные каналы в порядке добавления.
     */
    public List<Channel> enabledChannels() {
        return snapshot.get().values().stream()
                .filter(Channel::isEnabled)
                .toList();
    }

    private Channel register(Channel channel) {
        validate(channel);
        synchronized (writeLock) {
            Map<String, Channel> current = snapshot.get();
            if (current.containsKey(channel.getName())) {
                throw new ChannelValidationException(String.format("Канал `%s` уже существует", channel.getName()));
            }
            Map<String, Channel> next = new LinkedHashMap<>(current);
            next.put(channel.getName(), channel);
            snapshot.set(Collections.unmodifiableMap(next));
        }
        return channel;
    }

    private Channel update(String name, UnaryOperator<Channel> change) {
        Channel updated;
        synchronized (writeLock) {
            Map<String, Channel> current = snapshot.get();
            Channel existing = current.get(name);
            if (existing == null) {
                throw ChannelValidationException.unknownChannel(name);
            }
            updated = change.apply(existing);
            Map<String, Channel> next = new LinkedHashMap<>(current);
            next.put(name, updated);
            snapshot.set(Collections.unmodifiableMap(next));
        }
        publish("update channel " + name);
        return updated;
    }

    private void validate(Channel channel) {
        String name = channel.getName();
        if (!StringUtils.hasText(name) || name.chars().anyMatch(Character::isWhitespace)) {
            throw new ChannelValidationException("Имя канала не может быть пустым или содержать пробелы");
        }
        ChannelFormat format = channel.getFormat();
        if (format == null) {
            throw new ChannelValidationException(String.format("Не указан формат канала `%s`", name));
        }
        if (!StringUtils.hasText(channel.getUrl())) {
            throw new ChannelValidationException(String.format("Не указан URL канала `%s`", name));
        }
        if (!format.matchesUrl(channel.getUrl())) {
            throw new ChannelValidationException(String.format(
                    "URL канала `%s` формата %s должен содержать `%s`", name, format, format.getRequiredUrlFragment()));
        }
        boolean hasModel = StringUtils.hasText(channel.getModel());
        if (format.isModelRequired() && !hasModel) {
            throw new ChannelValidationException(String.format("Для канала `%s` формата %s нужно указать модель", name, format));
        }
        if (!format.isModelRequired() && hasModel) {
            throw new ChannelValidationException(String.format(
                    "Для канала `%s` формата %s модель задается в URL, отдельно ее указывать нельзя", name, format));
        }
    }

    private void publish(String reason) {
        eventPublisher.publishEvent(new DrawerStateChangedEvent(this, reason));
    }
}
