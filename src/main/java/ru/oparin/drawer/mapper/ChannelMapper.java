package ru.oparin.drawer.mapper;

import org.springframework.stereotype.Component;
import ru.oparin.drawer.model.domain.Channel;
import ru.oparin.drawer.model.domain.Credential;
import ru.oparin.drawer.model.dto.admin.ChannelDTO;
import ru.oparin.drawer.model.dto.admin.CredentialDTO;

import java.util.ArrayList;
import java.util.List;

/**
 * Преобразование каналов и ключей в DTO админского API.
 */
@Component
public class ChannelMapper {

    /**
     * @param channel     канал
     * @param credentials ключи канала в порядке добавления
     */
    public ChannelDTO toChannelDTO(Channel channel, List<Credential> credentials) {
        return ChannelDTO.builder()
                .name(channel.getName())
                .format(channel.getFormat())
                .url(channel.getUrl())
                .model(channel.getEffectiveModel())
                .enabled(channel.isEnabled())
                .streaming(channel.isStreaming())
                .priority(channel.getPriority())
                .credentialCount(credentials.size())
                .activeCredentials((int) credentials.stream().filter(Credential::isActive).count())
                .build();
    }

    /**
     * Ключи с номерами (с 1) и замаскированными значениями.
     */
    public List<CredentialDTO> toCredentialDTOs(List<Credential> credentials) {
        List<CredentialDTO> result = new ArrayList<>(credentials.size());
        for (int i = 0; i < credentials.size(); i++) {
            result.add(toCredentialDTO(credentials.get(i), i + 1));
        }
        return result;
    }

    public CredentialDTO toCredentialDTO(Credential credential, int index) {
        return CredentialDTO.builder()
                .index(index)
                .maskedValue(credential.getMaskedValue())
                .failureCount(credential.getFailureCount())
                .threshold(credential.getThreshold())
                .active(credential.isActive())
                .build();
    }
}
