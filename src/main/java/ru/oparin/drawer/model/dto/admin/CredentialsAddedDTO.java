package ru.oparin.drawer.model.dto.admin;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Количество добавленных ключей по каналам (дубликаты не считаются).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CredentialsAddedDTO {
    private Map<String, Integer> added;
}
