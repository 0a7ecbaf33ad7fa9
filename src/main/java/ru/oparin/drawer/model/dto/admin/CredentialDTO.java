package ru.oparin.drawer.model.dto.admin;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO ключа канала. Значение ключа всегда замаскировано.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "API ключ канала")
public class CredentialDTO {

    @Schema(description = "Номер ключа в канале (с 1)", example = "1")
    private int index;

    @Schema(description = "Замаскированное значение", example = "AIzaSyAb...x9Qz")
    private String maskedValue;

    private int failureCount;

    @Schema(description = "Порог отключения, -1 = без ограничения", example = "5")
    private int threshold;

    private boolean active;
}
