package ru.oparin.drawer.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import ru.oparin.drawer.model.domain.Channel;
import ru.oparin.drawer.model.domain.Credential;
import ru.oparin.drawer.model.state.ChannelState;
import ru.oparin.drawer.model.state.CredentialState;
import ru.oparin.drawer.model.state.DrawerState;
import ru.oparin.drawer.repository.DrawerStateStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Синхронизация состояния каналов, ключей и промптов с хранилищем.
 * <p>
 * Каждое изменение публикует {@link DrawerStateChangedEvent}; сохранение выполняется
 * в фоне, изменения, пришедшие во время записи, объединяются в следующую запись.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DrawerStatePersistenceService {

    private final ChannelRegistry channelRegistry;
    private final CredentialPool credentialPool;
    private final PromptPresetService promptPresetService;
    private final DrawerStateStore stateStore;

    private final AtomicBoolean active = new AtomicBoolean(false);
    private final AtomicBoolean dirty = new AtomicBoolean(false);
    private final AtomicBoolean saving = new AtomicBoolean(false);

    /**
     * Включить сохранение (после загрузки исходного состояния).
     */
    public void activate() {
        active.set(true);
    }

    @EventListener
    public void onStateChanged(DrawerStateChangedEvent event) {
        if (!active.get()) {
            return;
        }
        log.debug("Изменение состояния: {}", event.getReason());
        dirty.set(true);
        scheduleSave();
    }

    /**
     * Сохранить текущее состояние немедленно в вызывающем потоке.
     */
    public void saveNow() {
        dirty.set(false);
        stateStore.save(snapshot());
    }

    /**
     * Собрать снимок текущего состояния.
     */
    public DrawerState snapshot() {
        List<ChannelState> channels = new ArrayList<>();
        for (Channel channel : channelRegistry.list()) {
            List<CredentialState> credentials = credentialPool.listCredentials(channel.getName()).stream()
                    .map(this::toState)
                    .toList();
            channels.add(ChannelState.builder()
                    .name(channel.getName())
                    .format(channel.getFormat())
                    .enabled(channel.isEnabled())
                    .streaming(channel.isStreaming())
                    .url(channel.getUrl())
                    .model(channel.getModel())
                    .priority(channel.getPriority())
                    .credentials(new ArrayList<>(credentials))
                    .build());
        }
        return DrawerState.builder()
                .channels(channels)
                .prompts(new LinkedHashMap<>(promptPresetService.list()))
                .build();
    }

    private void scheduleSave() {
        if (!saving.compareAndSet(false, true)) {
            return;
        }
        Mono.fromRunnable(this::drain)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        ignored -> { },
                        error -> log.error("Ошибка при сохранении состояния: {}", error.getMessage(), error));
    }

    private void drain() {
        try {
            while (dirty.getAndSet(false)) {
                stateStore.save(snapshot());
            }
        } finally {
            saving.set(false);
            if (dirty.get()) {
                scheduleSave();
            }
        }
    }

    private CredentialState toState(Credential credential) {
        return CredentialState.builder()
                .value(credential.getValue())
                .threshold(credential.getThreshold())
                .failureCount(credential.getFailureCount())
                .build();
    }
}
