package ru.oparin.drawer.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.oparin.drawer.exception.ChannelValidationException;
import ru.oparin.drawer.mapper.ChannelMapper;
import ru.oparin.drawer.model.domain.Channel;
import ru.oparin.drawer.model.domain.Credential;
import ru.oparin.drawer.model.dto.admin.AddChannelRequest;
import ru.oparin.drawer.model.dto.admin.ChannelDTO;
import ru.oparin.drawer.model.dto.admin.CredentialDTO;
import ru.oparin.drawer.model.dto.admin.CredentialsAddedDTO;
import ru.oparin.drawer.model.enums.ChannelFormat;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Администрирование каналов и ключей: проверка ссылок на каналы и ключи,
 * преобразование в DTO, импорт ключей с распределением по каналам.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChannelAdminService {

    private final ChannelRegistry channelRegistry;
    private final CredentialPool credentialPool;
    private final CredentialClassifier credentialClassifier;
    private final ChannelMapper channelMapper;

    public List<ChannelDTO> listChannels() {
        return channelRegistry.list().stream()
                .map(this::toDTO)
                .toList();
    }

    public ChannelDTO getChannel(String name) {
        return toDTO(channelRegistry.require(name));
    }

    /**
     * Добавить канал и, если переданы, его ключи.
     */
    public ChannelDTO addChannel(AddChannelRequest request) {
        ChannelFormat format = ChannelFormat.fromCode(request.getFormat());
        if (format == null) {
            throw new ChannelValidationException(String.format("Неизвестный формат канала `%s`, допустимые: %s",
                    request.getFormat(), Arrays.toString(ChannelFormat.values())));
        }
        Channel channel = channelRegistry.addChannel(request.getName(), format, request.getUrl(), request.getModel(),
                request.isStreaming(), request.getPriority());
        if (request.getCredentials() != null && !request.getCredentials().isEmpty()) {
            credentialPool.addCredentials(channel.getName(), request.getCredentials());
        }
        return toDTO(channel);
    }

    /**
     * Удалить канал. Запросы, уже получившие ключ этого канала, завершаются.
     */
    public void removeChannel(String name) {
        channelRegistry.removeChannel(name);
        credentialPool.retireChannel(name);
    }

    public ChannelDTO setEnabled(String name, boolean enabled) {
        return toDTO(channelRegistry.setEnabled(name, enabled));
    }

    public ChannelDTO setStreaming(String name, boolean streaming) {
        return toDTO(channelRegistry.setStreaming(name, streaming));
    }

    public ChannelDTO setPriority(String name, int priority) {
        return toDTO(channelRegistry.setPriority(name, priority));
    }

    public ChannelDTO updateModel(String name, String model) {
        return toDTO(channelRegistry.updateModel(name, model));
    }

    public List<CredentialDTO> listCredentials(String channel) {
        channelRegistry.require(channel);
        return channelMapper.toCredentialDTOs(credentialPool.listCredentials(channel));
    }

    public CredentialsAddedDTO addCredentials(String channel, List<String> credentials) {
        int added = credentialPool.addCredentials(channel, credentials);
        return new CredentialsAddedDTO(Map.of(channel, added));
    }

    public void removeCredential(String channel, int index) {
        credentialPool.removeCredential(channel, index);
    }

    public CredentialDTO setThreshold(String channel, int index, int threshold) {
        Credential credential = credentialPool.setThreshold(channel, index, threshold);
        return channelMapper.toCredentialDTO(credential, index);
    }

    /**
     * Сбросить счетчики ошибок ключей канала (одного ключа, если указан номер).
     *
     * @return количество ключей, состояние которых изменилось
     */
    public int resetCredentials(String channel, Integer index) {
        return credentialPool.resetFailures(channel, index);
    }

    public int resetAllCredentials() {
        return credentialPool.resetAll();
    }

    /**
     * Импортировать ключи без указания канала: канал определяется по префиксу ключа.
     * Если какой-либо целевой канал не существует, ничего не добавляется.
     */
    public CredentialsAddedDTO importCredentials(List<String> credentials) {
        Map<String, List<String>> byChannel = credentialClassifier.classify(credentials);
        for (String channel : byChannel.keySet()) {
            if (!channelRegistry.contains(channel)) {
                throw new ChannelValidationException(String.format(
                        "Канал `%s` для импорта ключей не настроен", channel));
            }
        }
        Map<String, Integer> added = new LinkedHashMap<>();
        byChannel.forEach((channel, values) -> added.put(channel, credentialPool.addCredentials(channel, values)));
        log.info("Импорт ключей: {}", added);
        return new CredentialsAddedDTO(added);
    }

    private ChannelDTO toDTO(Channel channel) {
        return channelMapper.toChannelDTO(channel, credentialPool.listCredentials(channel.getName()));
    }
}
