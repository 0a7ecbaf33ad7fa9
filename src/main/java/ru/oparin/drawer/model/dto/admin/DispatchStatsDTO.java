package ru.oparin.drawer.model.dto.admin;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Счетчики диспетчеризации с момента запуска.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Статистика диспетчеризации запросов генерации")
public class DispatchStatsDTO {

    private long totalRequests;

    /**
     * Успешные генерации по каналам.
     */
    private Map<String, Long> successesByChannel;

    /**
     * Ошибки бэкендов по типам.
     */
    private Map<String, Long> failuresByErrorType;

    /**
     * Переключения на следующий канал.
     */
    private long failovers;

    /**
     * Запросы, для которых были перебраны все каналы.
     */
    private long exhausted;

    /**
     * Запросы, прерванные неповторяемой ошибкой.
     */
    private long rejected;
}
