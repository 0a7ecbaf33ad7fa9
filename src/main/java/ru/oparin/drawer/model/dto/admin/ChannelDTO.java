package ru.oparin.drawer.model.dto.admin;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.drawer.model.enums.ChannelFormat;

/**
 * DTO канала для админского API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Канал генерации изображений")
public class ChannelDTO {

    private String name;

    private ChannelFormat format;

    private String url;

    /**
     * Модель канала (для GENERATE_CONTENT извлекается из URL).
     */
    private String model;

    private boolean enabled;

    private boolean streaming;

    private int priority;

    private int credentialCount;

    private int activeCredentials;
}
