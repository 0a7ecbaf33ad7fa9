package ru.oparin.drawer.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import ru.oparin.drawer.config.properties.DrawerProperties;
import ru.oparin.drawer.exception.DrawerException;
import ru.oparin.drawer.model.domain.Channel;
import ru.oparin.drawer.model.state.ChannelState;
import ru.oparin.drawer.model.state.CredentialState;
import ru.oparin.drawer.model.state.DrawerState;
import ru.oparin.drawer.repository.DrawerStateStore;

/**
 * Загрузка сохраненного состояния при старте и добавление каналов из конфигурации.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DrawerStateInitializer implements ApplicationRunner {

    private final DrawerStateStore stateStore;
    private final ChannelRegistry channelRegistry;
    private final CredentialPool credentialPool;
    private final PromptPresetService promptPresetService;
    private final DrawerStatePersistenceService persistenceService;
    private final DrawerProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        initialize();
    }

    public void initialize() {
        stateStore.load().ifPresent(this::restore);
        persistenceService.activate();
        seedChannels();
        log.info("Каналы генерации готовы: {}", channelRegistry.list().stream()
                .map(channel -> channel.getName() + "(" + credentialPool.activeCount(channel.getName()) + ")")
                .toList());
    }

    private void restore(DrawerState state) {
        for (ChannelState channelState : state.getChannels()) {
            try {
                channelRegistry.restore(Channel.builder()
                        .name(channelState.getName())
                        .format(channelState.getFormat())
                        .url(channelState.getUrl())
                        .model(channelState.getModel())
                        .enabled(channelState.isEnabled())
                        .streaming(channelState.isStreaming())
                        .priority(channelState.getPriority())
                        .build());
            } catch (DrawerException e) {
                log.error("Сохраненный канал {} пропущен: {}", channelState.getName(), e.getMessage());
                continue;
            }
            for (CredentialState credential : channelState.getCredentials()) {
                credentialPool.restoreCredential(channelState.getName(), credential.getValue(),
                        credential.getThreshold(), credential.getFailureCount());
            }
        }
        promptPresetService.restore(state.getPrompts());
    }

    private void seedChannels() {
        for (DrawerProperties.ChannelSeed seed : properties.getChannels()) {
            try {
                if (!channelRegistry.contains(seed.getName())) {
                    channelRegistry.addChannel(seed.getName(), seed.getFormat(), seed.getUrl(), seed.getModel(),
                            seed.isStreaming(), seed.getPriority());
                    if (!seed.isEnabled()) {
                        channelRegistry.setEnabled(seed.getName(), false);
                    }
                }
                credentialPool.addCredentials(seed.getName(), seed.getCredentials());
            } catch (DrawerException e) {
                log.error("Канал {} из конфигурации пропущен: {}", seed.getName(), e.getMessage());
            }
        }
    }
}
