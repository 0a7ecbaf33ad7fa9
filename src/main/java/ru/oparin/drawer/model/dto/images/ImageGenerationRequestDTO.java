package ru.oparin.drawer.model.dto.images;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Запрос к API генерации изображений (images/generations, формат Seedream).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImageGenerationRequestDTO {

    @JsonProperty("model")
    private String model;

    @JsonProperty("prompt")
    private String prompt;

    @JsonProperty("response_format")
    @Builder.Default
    private String responseFormat = "url";

    /**
     * Размер изображения: "2K", "4K" или "WxH".
     */
    @JsonProperty("size")
    @Builder.Default
    private String size = "2K";

    @JsonProperty("stream")
    @Builder.Default
    private Boolean stream = false;

    @JsonProperty("watermark")
    @Builder.Default
    private Boolean watermark = false;

    /**
     * data URL входного изображения или массив data URL (image-to-image).
     */
    @JsonProperty("image")
    private Object image;
}
