package ru.oparin.drawer.model.dto.admin;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Список ключей для добавления в канал или импорта с распределением по префиксу.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Список API ключей")
public class CredentialsRequest {

    @NotEmpty(message = "Список ключей не может быть пустым")
    private List<String> credentials;
}
