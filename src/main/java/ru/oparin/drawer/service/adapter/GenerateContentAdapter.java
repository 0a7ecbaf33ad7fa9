package ru.oparin.drawer.service.adapter;

import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;
import ru.oparin.drawer.model.domain.Channel;
import ru.oparin.drawer.model.domain.GenerationRequest;
import ru.oparin.drawer.model.domain.SourceImage;
import ru.oparin.drawer.model.domain.WireRequest;
import ru.oparin.drawer.model.dto.gemini.GenerateContentRequestDTO;
import ru.oparin.drawer.model.enums.ChannelFormat;

import java.util.ArrayList;
import java.util.List;

/**
 * Адаптер нативного формата Gemini generateContent.
 * Ключ передается параметром {@code key}, потоковый режим использует
 * {@code :streamGenerateContent} с {@code alt=sse}.
 */
@Component
public class GenerateContentAdapter implements FormatAdapter {

    @Override
    public ChannelFormat getFormat() {
        return ChannelFormat.GENERATE_CONTENT;
    }

    @Override
    public WireRequest encode(Channel channel, String secret, GenerationRequest request, boolean streaming) {
        List<GenerateContentRequestDTO.Part> parts = new ArrayList<>();
        for (SourceImage image : request.getImages()) {
            parts.add(GenerateContentRequestDTO.Part.builder()
                    .inlineData(new GenerateContentRequestDTO.InlineData(image.getMimeType(), image.toBase64()))
                    .build());
        }
        parts.add(GenerateContentRequestDTO.Part.builder()
                .text(request.getPrompt())
                .build());

        List<GenerateContentRequestDTO.SafetySetting> safetySettings = AdapterConstants.Gemini.HARM_CATEGORIES.stream()
                .map(category -> new GenerateContentRequestDTO.SafetySetting(category, AdapterConstants.Gemini.BLOCK_NONE))
                .toList();

        GenerateContentRequestDTO body = GenerateContentRequestDTO.builder()
                .contents(List.of(new GenerateContentRequestDTO.Content(parts)))
                .generationConfig(new GenerateContentRequestDTO.GenerationConfig(AdapterConstants.Gemini.RESPONSE_MODALITIES))
                .safetySettings(safetySettings)
                .build();

        return WireRequest.builder()
                .url(buildUrl(channel.getUrl(), secret, streaming))
                .body(body)
                .streaming(streaming)
                .build();
    }

    /**
     * Построить URL запроса: ключ в параметре key, для потока другой метод и alt=sse.
     */
    String buildUrl(String channelUrl, String secret, boolean streaming) {
        String url = channelUrl;
        if (streaming && !url.contains(AdapterConstants.Gemini.STREAM_GENERATE_SUFFIX)) {
            url = url.replace(AdapterConstants.Gemini.GENERATE_SUFFIX, AdapterConstants.Gemini.STREAM_GENERATE_SUFFIX);
        }
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(url);
        if (AdapterConstants.hasCredential(secret)) {
            builder.replaceQueryParam(AdapterConstants.Gemini.KEY_PARAM, secret);
        }
        if (streaming) {
            builder.replaceQueryParam(AdapterConstants.Gemini.ALT_PARAM, AdapterConstants.Gemini.ALT_SSE);
        }
        return builder.build().toUriString();
    }
}
