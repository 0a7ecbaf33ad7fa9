package ru.oparin.drawer.model.dto.generate;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Результат генерации.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Сгенерированное изображение")
public class GenerateRs {

    @Schema(description = "Изображение в base64")
    private String image;

    @Schema(example = "image/png")
    private String mimeType;

    @Schema(description = "Канал, который выполнил запрос", example = "google")
    private String channel;

    @Schema(description = "Замаскированный ключ", example = "AIzaSyAb...x9Qz")
    private String credential;

    @Schema(description = "Количество попыток", example = "1")
    private int attempts;
}
