package ru.oparin.drawer.model.dto.admin;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Именованный промпт.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Именованный промпт")
public class PromptDTO {

    @NotBlank(message = "Имя промпта обязательно")
    @Schema(example = "figurine")
    private String name;

    @NotBlank(message = "Текст промпта обязателен")
    private String text;
}
