package ru.oparin.drawer.service.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import ru.oparin.drawer.model.domain.Channel;
import ru.oparin.drawer.model.domain.GenerationRequest;
import ru.oparin.drawer.model.domain.SourceImage;
import ru.oparin.drawer.model.domain.WireRequest;
import ru.oparin.drawer.model.enums.ChannelFormat;

import static org.assertj.core.api.Assertions.assertThat;

class GenerateContentAdapterTest {

    private static final String URL =
            "https://generativelanguage.googleapis.com/v1beta/models/gemini-2.5-flash-image:generateContent";

    private final GenerateContentAdapter adapter = new GenerateContentAdapter();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final Channel channel = Channel.builder()
            .name("google")
            .format(ChannelFormat.GENERATE_CONTENT)
            .url(URL)
            .build();

    @Test
    void encodesInlineImagesThenPromptWithSafetyOff() {
        GenerationRequest request = GenerationRequest.builder()
                .prompt("add a hat")
                .image(new SourceImage(new byte[]{1, 2, 3}, "image/jpeg"))
                .build();

        WireRequest wire = adapter.encode(channel, "AIzaSy-secret", request, false);
        JsonNode body = objectMapper.valueToTree(wire.getBody());

        assertThat(wire.getHeaders()).isEmpty();
        JsonNode parts = body.path("contents").get(0).path("parts");
        assertThat(parts).hasSize(2);
        assertThat(parts.get(0).path("inline_data").path("mime_type").asText()).isEqualTo("image/jpeg");
        assertThat(parts.get(0).path("inline_data").path("data").asText()).isEqualTo("AQID");
        assertThat(parts.get(1).path("text").asText()).isEqualTo("add a hat");
        assertThat(body.path("generationConfig").path("responseModalities"))
                .extracting(JsonNode::asText)
                .containsExactly("TEXT", "IMAGE");
        assertThat(body.path("safetySettings")).hasSize(4)
                .allSatisfy(setting -> assertThat(setting.path("threshold").asText()).isEqualTo("BLOCK_NONE"));
    }

    @Test
    void plainUrlCarriesKeyParameter() {
        assertThat(adapter.buildUrl(URL, "AIzaSy-secret", false)).isEqualTo(URL + "?key=AIzaSy-secret");
    }

    @Test
    void streamingUrlSwitchesMethodAndAsksForSse() {
        assertThat(adapter.buildUrl(URL, "AIzaSy-secret", true)).isEqualTo(
                "https://generativelanguage.googleapis.com/v1beta/models/gemini-2.5-flash-image"
                        + ":streamGenerateContent?key=AIzaSy-secret&alt=sse");
    }

    @Test
    void existingKeyParameterIsReplaced() {
        assertThat(adapter.buildUrl(URL + "?key=old", "new-key", false)).isEqualTo(URL + "?key=new-key");
    }

    @Test
    void keylessBackendGetsNoKeyParameter() {
        assertThat(adapter.buildUrl(URL, "none", false)).isEqualTo(URL);
    }
}
