package ru.oparin.drawer.model.dto.chat;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Запрос в формате OpenAI chat completions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCompletionRequestDTO {

    private String model;

    @Builder.Default
    private Boolean stream = false;

    private List<Message> messages;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {
        /**
         * Роль отправителя (всегда user).
         */
        private String role;

        private List<ContentPart> content;
    }

    /**
     * Часть содержимого сообщения: текст или изображение.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ContentPart {
        /**
         * Тип части (text или image_url).
         */
        private String type;

        private String text;

        @JsonProperty("image_url")
        private ImageUrl imageUrl;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImageUrl {
        /**
         * data URL с base64 содержимым изображения.
         */
        private String url;
    }
}
