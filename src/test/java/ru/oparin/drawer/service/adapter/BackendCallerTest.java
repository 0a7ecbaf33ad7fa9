package ru.oparin.drawer.service.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.drawer.config.properties.DrawerProperties;
import ru.oparin.drawer.exception.BackendFailureException;
import ru.oparin.drawer.model.domain.Channel;
import ru.oparin.drawer.model.domain.GenerationRequest;
import ru.oparin.drawer.model.enums.BackendErrorType;
import ru.oparin.drawer.model.enums.ChannelFormat;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class BackendCallerTest {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n', 7, 7, 7};
    private static final String PNG_BASE64 = Base64.getEncoder().encodeToString(PNG);
    private static final String GEMINI_URL =
            "https://generativelanguage.googleapis.com/v1beta/models/gemini-2.5-flash-image:generateContent";
    private static final String CHAT_URL = "https://proxy.example.com/v1/chat/completions";
    private static final String CDN_URL = "https://cdn.example.com/out/result.png";

    private final List<ClientRequest> requests = new ArrayList<>();
    private Function<ClientRequest, ClientResponse> backend;
    private Function<ClientRequest, Mono<ClientResponse>> exchange;
    private DrawerProperties properties;
    private BackendCaller caller;

    @BeforeEach
    void setUp() {
        exchange = request -> Mono.just(backend.apply(request));
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return exchange.apply(request);
                })
                .build();
        properties = new DrawerProperties();
        Map<ChannelFormat, FormatAdapter> adapters = new EnumMap<>(ChannelFormat.class);
        adapters.put(ChannelFormat.CHAT_COMPLETIONS, new ChatCompletionsAdapter());
        adapters.put(ChannelFormat.GENERATE_CONTENT, new GenerateContentAdapter());
        adapters.put(ChannelFormat.IMAGE_GENERATIONS, new ImageGenerationsAdapter());
        caller = new BackendCaller(webClient, adapters, new BackendErrorClassifier(),
                new ImagePayloadResolver(webClient, properties), new ObjectMapper(), properties);
    }

    @Test
    void geminiInlineImageIsDecoded() {
        backend = request -> json(HttpStatus.OK, "{\"candidates\":[{\"content\":{\"parts\":["
                + "{\"inlineData\":{\"mimeType\":\"image/png\",\"data\":\"" + PNG_BASE64 + "\"}}]}}]}");

        StepVerifier.create(caller.call(gemini(), "AIzaSy-secret", request()))
                .assertNext(image -> {
                    assertThat(image.getData()).isEqualTo(PNG);
                    assertThat(image.getMimeType()).isEqualTo("image/png");
                })
                .verifyComplete();

        ClientRequest sent = requests.get(0);
        assertThat(sent.method()).isEqualTo(HttpMethod.POST);
        assertThat(sent.url().toString()).isEqualTo(GEMINI_URL + "?key=AIzaSy-secret");
    }

    @Test
    void chatAnswerWithImageLinkIsDownloaded() {
        backend = request -> {
            if (request.url().toString().equals(CDN_URL)) {
                return ClientResponse.create(HttpStatus.OK)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_OCTET_STREAM_VALUE)
                        .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(PNG)))
                        .build();
            }
            return json(HttpStatus.OK, "{\"choices\":[{\"message\":{\"content\":\"![img](" + CDN_URL + ")\"}}]}");
        };

        StepVerifier.create(caller.call(chat(false), "sk-secret", request()))
                .assertNext(image -> {
                    assertThat(image.getData()).isEqualTo(PNG);
                    assertThat(image.getMimeType()).isEqualTo("image/png");
                })
                .verifyComplete();

        assertThat(requests).hasSize(2);
        assertThat(requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-secret");
        assertThat(requests.get(1).method()).isEqualTo(HttpMethod.GET);
        assertThat(requests.get(1).url().toString()).isEqualTo(CDN_URL);
    }

    @Test
    void rateLimitIsRetryableFailure() {
        backend = request -> json(HttpStatus.TOO_MANY_REQUESTS, "{\"error\":\"slow down\"}");

        StepVerifier.create(caller.call(chat(false), "sk-secret", request()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(BackendFailureException.class);
                    BackendFailureException failure = (BackendFailureException) error;
                    assertThat(failure.getErrorType()).isEqualTo(BackendErrorType.RATE_LIMITED);
                    assertThat(failure.getBackendStatus()).isEqualTo(429);
                    assertThat(failure.isRetryable()).isTrue();
                })
                .verify();
    }

    @Test
    void rejectedKeyIsNotRetryable() {
        backend = request -> json(HttpStatus.UNAUTHORIZED, "{\"error\":\"invalid api key\"}");

        StepVerifier.create(caller.call(gemini(), "AIzaSy-secret", request()))
                .expectErrorSatisfies(error -> {
                    BackendFailureException failure = (BackendFailureException) error;
                    assertThat(failure.getErrorType()).isEqualTo(BackendErrorType.CREDENTIAL_REJECTED);
                    assertThat(failure.isRetryable()).isFalse();
                })
                .verify();
    }

    @Test
    void textOnlyAnswerIsNoImageFailure() {
        backend = request -> json(HttpStatus.OK, "{\"choices\":[{\"message\":{\"content\":\"I can't draw that\"}}]}");

        StepVerifier.create(caller.call(chat(false), "sk-secret", request()))
                .expectErrorSatisfies(error -> assertThat(((BackendFailureException) error).getErrorType())
                        .isEqualTo(BackendErrorType.NO_IMAGE_IN_RESPONSE))
                .verify();
    }

    @Test
    void nonJsonAnswerIsMalformedResponse() {
        backend = request -> ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_HTML_VALUE)
                .body("<html>Bad gateway</html>")
                .build();

        StepVerifier.create(caller.call(chat(false), "sk-secret", request()))
                .expectErrorSatisfies(error -> assertThat(((BackendFailureException) error).getErrorType())
                        .isEqualTo(BackendErrorType.MALFORMED_RESPONSE))
                .verify();
    }

    @Test
    void streamStopsAtFirstImageChunk() {
        backend = request -> sse(
                "data: {\"choices\":[{\"delta\":{\"content\":\"Drawing...\"}}]}\n\n"
                        + "data: not-json\n\n"
                        + "data: {\"choices\":[{\"delta\":{\"content\":\"![img](data:image/png;base64," + PNG_BASE64 + ")\"}}]}\n\n"
                        + "data: [DONE]\n\n");

        StepVerifier.create(caller.call(chat(true), "sk-secret", request()))
                .assertNext(image -> {
                    assertThat(image.getData()).isEqualTo(PNG);
                    assertThat(image.getMimeType()).isEqualTo("image/png");
                })
                .verifyComplete();

        assertThat(requests.get(0).headers().getAccept()).contains(MediaType.TEXT_EVENT_STREAM);
    }

    @Test
    void streamEndingWithoutImageIsNoImageFailure() {
        backend = request -> sse(
                "data: {\"choices\":[{\"delta\":{\"content\":\"Sorry\"}}]}\n\n"
                        + "data: [DONE]\n\n"
                        + "data: {\"choices\":[{\"delta\":{\"content\":\"![img](data:image/png;base64," + PNG_BASE64 + ")\"}}]}\n\n");

        StepVerifier.create(caller.call(chat(true), "sk-secret", request()))
                .expectErrorSatisfies(error -> assertThat(((BackendFailureException) error).getErrorType())
                        .isEqualTo(BackendErrorType.NO_IMAGE_IN_RESPONSE))
                .verify();
    }

    @Test
    void silentBackendIsRetryableTimeout() {
        properties.getHttp().setRequestTimeout(Duration.ofMillis(200));
        exchange = request -> Mono.never();

        StepVerifier.create(caller.call(gemini(), "AIzaSy-secret", request()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(BackendFailureException.class);
                    BackendFailureException failure = (BackendFailureException) error;
                    assertThat(failure.getErrorType()).isEqualTo(BackendErrorType.TIMEOUT);
                    assertThat(failure.isRetryable()).isTrue();
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void streamWithoutImageWithinStreamTimeoutIsRetryableTimeout() {
        properties.getHttp().setStreamTimeout(Duration.ofMillis(200));
        byte[] firstChunk = "data: {\"choices\":[{\"delta\":{\"content\":\"drawing...\"}}]}\n\n"
                .getBytes(StandardCharsets.UTF_8);
        backend = request -> ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_EVENT_STREAM_VALUE)
                .body(Flux.concat(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(firstChunk)), Flux.never()))
                .build();

        StepVerifier.create(caller.call(chat(true), "sk-secret", request()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(BackendFailureException.class);
                    BackendFailureException failure = (BackendFailureException) error;
                    assertThat(failure.getErrorType()).isEqualTo(BackendErrorType.TIMEOUT);
                    assertThat(failure.isRetryable()).isTrue();
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void hangingImageDownloadFailsWithinRequestTimeout() {
        properties.getHttp().setRequestTimeout(Duration.ofMillis(200));
        exchange = request -> request.url().toString().equals(CDN_URL)
                ? Mono.never()
                : Mono.just(json(HttpStatus.OK,
                "{\"choices\":[{\"message\":{\"content\":\"![img](" + CDN_URL + ")\"}}]}"));

        StepVerifier.create(caller.call(chat(false), "sk-secret", request()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(BackendFailureException.class);
                    assertThat(((BackendFailureException) error).getErrorType())
                            .isEqualTo(BackendErrorType.IMAGE_DOWNLOAD_FAILED);
                })
                .verify(Duration.ofSeconds(5));
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    private static ClientResponse sse(String body) {
        return ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_EVENT_STREAM_VALUE)
                .body(body)
                .build();
    }

    private static Channel gemini() {
        return Channel.builder().name("google").format(ChannelFormat.GENERATE_CONTENT).url(GEMINI_URL).build();
    }

    private static Channel chat(boolean streaming) {
        return Channel.builder()
                .name("proxy")
                .format(ChannelFormat.CHAT_COMPLETIONS)
                .url(CHAT_URL)
                .model("gemini-2.5-flash-image")
                .streaming(streaming)
                .build();
    }

    private static GenerationRequest request() {
        return GenerationRequest.builder().prompt("a lighthouse at dusk").build();
    }
}
