package ru.oparin.drawer.service.adapter;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import ru.oparin.drawer.model.domain.Channel;
import ru.oparin.drawer.model.domain.GenerationRequest;
import ru.oparin.drawer.model.domain.SourceImage;
import ru.oparin.drawer.model.domain.WireRequest;
import ru.oparin.drawer.model.dto.chat.ChatCompletionRequestDTO;
import ru.oparin.drawer.model.enums.ChannelFormat;

import java.util.ArrayList;
import java.util.List;

/**
 * Адаптер OpenAI-совместимого формата chat completions.
 * Изображения передаются частями image_url с data URL, промпт последней текстовой частью.
 */
@Component
public class ChatCompletionsAdapter implements FormatAdapter {

    @Override
    public ChannelFormat getFormat() {
        return ChannelFormat.CHAT_COMPLETIONS;
    }

    @Override
    public WireRequest encode(Channel channel, String secret, GenerationRequest request, boolean streaming) {
        List<ChatCompletionRequestDTO.ContentPart> content = new ArrayList<>();
        for (SourceImage image : request.getImages()) {
            content.add(ChatCompletionRequestDTO.ContentPart.builder()
                    .type(AdapterConstants.Chat.TYPE_IMAGE_URL)
                    .imageUrl(new ChatCompletionRequestDTO.ImageUrl(image.toDataUrl()))
                    .build());
        }
        content.add(ChatCompletionRequestDTO.ContentPart.builder()
                .type(AdapterConstants.Chat.TYPE_TEXT)
                .text(request.getPrompt())
                .build());

        ChatCompletionRequestDTO body = ChatCompletionRequestDTO.builder()
                .model(channel.getModel())
                .stream(streaming)
                .messages(List.of(ChatCompletionRequestDTO.Message.builder()
                        .role(AdapterConstants.Chat.ROLE_USER)
                        .content(content)
                        .build()))
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
}
