package ru.oparin.drawer.model.dto.admin;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SetThresholdRequest {

    @NotNull(message = "Порог обязателен")
    @Min(value = -1, message = "Порог должен быть неотрицательным или равным -1")
    @Schema(description = "Порог отключения, -1 = без ограничения", example = "5")
    private Integer threshold;
}
