package ru.oparin.drawer.model.dto.admin;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Запрос на добавление канала.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Новый канал генерации")
public class AddChannelRequest {

    @NotBlank(message = "Имя канала обязательно")
    @Pattern(regexp = "\\S+", message = "Имя канала не может содержать пробелы")
    @Schema(example = "bailili")
    private String name;

    @NotBlank(message = "Формат канала обязателен")
    @Schema(description = "CHAT_COMPLETIONS, GENERATE_CONTENT или IMAGE_GENERATIONS", example = "CHAT_COMPLETIONS")
    private String format;

    @NotBlank(message = "URL канала обязателен")
    @Schema(example = "https://api.example.com/v1/chat/completions")
    private String url;

    @Schema(description = "Модель (не указывается для GENERATE_CONTENT)", example = "gemini-2.5-flash-image")
    private String model;

    private boolean streaming;

    private int priority;

    /**
     * Ключи, добавляемые в канал сразу после создания.
     */
    @Builder.Default
    private List<String> credentials = new ArrayList<>();
}
