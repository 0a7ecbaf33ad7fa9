package ru.oparin.drawer.model.state;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Сохраняемое состояние ключа.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CredentialState {
    private String value;
    private int threshold;
    private int failureCount;
}
