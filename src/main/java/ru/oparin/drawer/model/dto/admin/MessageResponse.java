package ru.oparin.drawer.model.dto.admin;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageResponse {
    private String message;

    /**
     * Количество затронутых объектов (для массовых операций).
     */
    private Integer count;

    public MessageResponse(String message) {
        this.message = message;
    }
}
