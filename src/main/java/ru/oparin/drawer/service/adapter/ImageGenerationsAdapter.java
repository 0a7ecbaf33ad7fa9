package ru.oparin.drawer.service.adapter;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import ru.oparin.drawer.model.domain.Channel;
import ru.oparin.drawer.model.domain.GenerationRequest;
import ru.oparin.drawer.model.domain.SourceImage;
import ru.oparin.drawer.model.domain.WireRequest;
import ru.oparin.drawer.model.dto.images.ImageGenerationRequestDTO;
import ru.oparin.drawer.model.enums.ChannelFormat;

import java.util.List;

/**
 * Адаптер API генерации изображений (images/generations).
 * Одно исходное изображение передается строкой, несколько массивом data URL.
 */
@Component
public class ImageGenerationsAdapter implements FormatAdapter {

    @Override
    public ChannelFormat getFormat() {
        return ChannelFormat.IMAGE_GENERATIONS;
    }

    @Override
    public WireRequest encode(Channel channel, String secret, GenerationRequest request, boolean streaming) {
        ImageGenerationRequestDTO body = ImageGenerationRequestDTO.builder()
                .model(channel.getModel())
                .prompt(request.getPrompt())
                .responseFormat(AdapterConstants.Images.RESPONSE_FORMAT_URL)
                .size(AdapterConstants.Images.DEFAULT_SIZE)
                .stream(streaming)
                .watermark(false)
                .image(buildImageField(request.getImages()))
                .build();

        WireRequest.WireRequestBuilder builder = WireRequest.builder()
                .url(channel.getUrl())
                .body(body)
                .streaming(streaming);
        if (AdapterConstants.hasCredential(secret)) {
            builder.header(HttpHeaders.AUTHORIZATION, AdapterConstants.BEARER_PREFIX + secret);
        }
        return builder.build();
    }

    private Object buildImageField(List<SourceImage> images) {
        if (images == null || images.isEmpty()) {
            return null;
        }
        if (images.size() == 1) {
            return images.get(0).toDataUrl();
        }
        return images.stream().map(SourceImage::toDataUrl).toList();
    }
}
