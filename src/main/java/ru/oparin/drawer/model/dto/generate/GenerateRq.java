package ru.oparin.drawer.model.dto.generate;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Запрос на генерацию изображения.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Запрос на генерацию изображения")
public class GenerateRq {

    @NotBlank(message = "Промпт не может быть пустым")
    @Schema(description = "Текстовое описание изображения", example = "Кот в космическом скафандре")
    private String prompt;

    @Valid
    @Builder.Default
    @Schema(description = "Исходные изображения для редактирования")
    private List<SourceImageDTO> images = new ArrayList<>();

    @Schema(description = "Имя канала; если не указан, канал выбирается автоматически", example = "google")
    private String channel;

    /**
     * Исходное изображение.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SourceImageDTO {

        @NotBlank(message = "Данные изображения обязательны")
        @Schema(description = "base64 или data URL")
        private String data;

        @Schema(description = "MIME тип; если не указан, определяется по содержимому", example = "image/png")
        private String mimeType;
    }
}
