package ru.oparin.drawer.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.drawer.config.properties.DrawerProperties;
import ru.oparin.drawer.exception.AllChannelsExhaustedException;
import ru.oparin.drawer.exception.BackendFailureException;
import ru.oparin.drawer.exception.ChannelValidationException;
import ru.oparin.drawer.exception.NoAvailableCredentialException;
import ru.oparin.drawer.model.domain.Channel;
import ru.oparin.drawer.model.domain.Credential;
import ru.oparin.drawer.model.domain.CredentialLease;
import ru.oparin.drawer.model.domain.GeneratedImage;
import ru.oparin.drawer.model.domain.GenerationRequest;
import ru.oparin.drawer.model.enums.BackendErrorType;
import ru.oparin.drawer.model.enums.ChannelFormat;
import ru.oparin.drawer.service.adapter.BackendCaller;

import java.time.Duration;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DispatchEngineTest {

    private static final String GEMINI_URL =
            "https://generativelanguage.googleapis.com/v1beta/models/gemini-2.5-flash-image:generateContent";
    private static final String CHAT_URL = "https://proxy.example.com/v1/chat/completions";
    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n', 1, 2, 3};

    @Mock
    private BackendCaller backendCaller;

    private ChannelRegistry registry;
    private CredentialPool pool;
    private DispatchMetricsService metrics;
    private DispatchEngine engine;

    @BeforeEach
    void setUp() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        DrawerProperties properties = new DrawerProperties();
        properties.getDispatch().setRetryDelay(Duration.ZERO);
        properties.getCredentials().setDefaultThreshold(3);
        registry = new ChannelRegistry(publisher);
        pool = new CredentialPool(registry, properties, publisher);
        metrics = new DispatchMetricsService();
        engine = new DispatchEngine(registry, pool, backendCaller, metrics, properties);
    }

    @Test
    void returnsImageFromFirstHealthyChannel() {
        addGoogle("AIzaSy-first-key-0001");
        when(backendCaller.call(any(), anyString(), any())).thenReturn(Mono.just(image()));

        StepVerifier.create(engine.generate(request(null)))
                .assertNext(result -> {
                    assertThat(result.getChannel()).isEqualTo("google");
                    assertThat(result.getAttempts()).isEqualTo(1);
                    assertThat(result.getImage()).isEqualTo(PNG);
                    assertThat(result.getMimeType()).isEqualTo("image/png");
                    assertThat(result.getCredential()).doesNotContain("first-key");
                })
                .verifyComplete();
        assertThat(metrics.getStats().getSuccessesByChannel()).containsEntry("google", 1L);
    }

    @Test
    void failsOverToNextChannelWhenFirstIsFullyDisabled() {
        addGoogle("AIzaSy-first-key-0001");
        pool.setThreshold("google", 1, 0);
        addProxy("proxy", 0, "sk-proxy-key-0001");
        when(backendCaller.call(channel("proxy"), anyString(), any())).thenReturn(Mono.just(image()));

        StepVerifier.create(engine.generate(request(null)))
                .assertNext(result -> {
                    assertThat(result.getChannel()).isEqualTo("proxy");
                    assertThat(result.getAttempts()).isEqualTo(1);
                })
                .verifyComplete();
        verify(backendCaller, never()).call(channel("google"), anyString(), any());
    }

    @Test
    void rotatesCredentialsThenChannelsOnRetryableFailures() {
        addGoogle("AIzaSy-first-key-0001", "AIzaSy-second-key-0002");
        addProxy("proxy", 0, "sk-proxy-key-0001");
        when(backendCaller.call(any(), anyString(), any())).thenAnswer(invocation -> {
            Channel target = invocation.getArgument(0);
            return "google".equals(target.getName()) ? Mono.error(retryable()) : Mono.just(image());
        });

        StepVerifier.create(engine.generate(request(null)))
                .assertNext(result -> {
                    assertThat(result.getChannel()).isEqualTo("proxy");
                    assertThat(result.getAttempts()).isEqualTo(3);
                })
                .verifyComplete();

        verify(backendCaller).call(channel("google"), eq("AIzaSy-first-key-0001"), any());
        verify(backendCaller).call(channel("google"), eq("AIzaSy-second-key-0002"), any());
        assertThat(pool.listCredentials("google")).allSatisfy(c -> assertThat(c.getFailureCount()).isEqualTo(1));
        assertThat(pool.listCredentials("proxy").get(0).getFailureCount()).isZero();
        assertThat(metrics.getStats().getFailovers()).isEqualTo(1);
    }

    @Test
    void nonRetryableFailureStopsDispatchImmediately() {
        addGoogle("AIzaSy-first-key-0001", "AIzaSy-second-key-0002");
        addProxy("proxy", 0, "sk-proxy-key-0001");
        when(backendCaller.call(channel("google"), anyString(), any()))
                .thenReturn(Mono.error(new BackendFailureException("rejected", BackendErrorType.CREDENTIAL_REJECTED, 401)));

        StepVerifier.create(engine.generate(request(null)))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(BackendFailureException.class);
                    assertThat(((BackendFailureException) error).getErrorType())
                            .isEqualTo(BackendErrorType.CREDENTIAL_REJECTED);
                })
                .verify();

        verify(backendCaller, times(1)).call(any(), anyString(), any());
        verify(backendCaller, never()).call(channel("proxy"), anyString(), any());
        assertThat(pool.listCredentials("google").get(0).getFailureCount()).isEqualTo(1);
        assertThat(metrics.getStats().getRejected()).isEqualTo(1);
    }

    @Test
    void twoCredentialsWithThresholdThreeAreDisabledAfterThreeFailedRequests() {
        addGoogle("AIzaSy-first-key-0001", "AIzaSy-second-key-0002");
        when(backendCaller.call(any(), anyString(), any())).thenReturn(Mono.error(retryable()));

        for (int requestNo = 1; requestNo <= 3; requestNo++) {
            StepVerifier.create(engine.generate(request(null)))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(AllChannelsExhaustedException.class);
                        AllChannelsExhaustedException exhausted = (AllChannelsExhaustedException) error;
                        assertThat(exhausted.getAttempts()).isEqualTo(2);
                        assertThat(exhausted.getLastErrorType()).isEqualTo(BackendErrorType.HTTP_5XX);
                        assertThat(exhausted.getChannelsTried()).containsExactly("google");
                    })
                    .verify();
            int expectedFailures = requestNo;
            assertThat(pool.listCredentials("google"))
                    .allSatisfy(c -> assertThat(c.getFailureCount()).isEqualTo(expectedFailures));
        }

        assertThat(pool.listCredentials("google")).noneMatch(Credential::isActive);
        StepVerifier.create(engine.generate(request(null)))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(NoAvailableCredentialException.class);
                    assertThat(((NoAvailableCredentialException) error).getChannels()).containsExactly("google");
                })
                .verify();
        verify(backendCaller, times(6)).call(any(), anyString(), any());
    }

    @Test
    void disabledFirstCredentialIsSkippedWithoutOperatorAction() {
        addGoogle("AIzaSy-first-key-0001", "AIzaSy-second-key-0002");
        for (int i = 0; i < 3; i++) {
            CredentialLease lease = pool.acquire("google");
            if (lease.getPosition() == 2) {
                pool.reportOutcome(lease, true);
                lease = pool.acquire("google");
            }
            pool.reportOutcome(lease, false);
        }
        assertThat(pool.listCredentials("google").get(0).isActive()).isFalse();
        when(backendCaller.call(any(), anyString(), any())).thenReturn(Mono.just(image()));

        StepVerifier.create(engine.generate(request(null)))
                .assertNext(result -> assertThat(result.getAttempts()).isEqualTo(1))
                .verifyComplete();

        verify(backendCaller).call(any(), eq("AIzaSy-second-key-0002"), any());
    }

    @Test
    void everyActiveCredentialOfChannelIsTriedBeforeGivingUp() {
        String[] keys = IntStream.rangeClosed(1, 11).mapToObj(i -> String.format("k-%04d", i)).toArray(String[]::new);
        addGoogle(keys);
        when(backendCaller.call(any(), anyString(), any())).thenAnswer(invocation ->
                "k-0011".equals(invocation.getArgument(1)) ? Mono.just(image()) : Mono.error(retryable()));

        StepVerifier.create(engine.generate(request(null)))
                .assertNext(result -> {
                    assertThat(result.getChannel()).isEqualTo("google");
                    assertThat(result.getAttempts()).isEqualTo(11);
                })
                .verifyComplete();

        verify(backendCaller, times(11)).call(any(), anyString(), any());
        verify(backendCaller).call(any(), eq("k-0011"), any());
    }

    @Test
    void attemptsPerChannelCanBeCappedByConfiguration() {
        DrawerProperties properties = new DrawerProperties();
        properties.getDispatch().setRetryDelay(Duration.ZERO);
        properties.getDispatch().setMaxAttemptsPerChannel(2);
        engine = new DispatchEngine(registry, pool, backendCaller, metrics, properties);
        addGoogle("k-0001", "k-0002", "k-0003", "k-0004");
        when(backendCaller.call(any(), anyString(), any())).thenReturn(Mono.error(retryable()));

        StepVerifier.create(engine.generate(request(null)))
                .expectError(AllChannelsExhaustedException.class)
                .verify();

        verify(backendCaller, times(2)).call(any(), anyString(), any());
    }

    @Test
    void timedOutCredentialIsRotatedToNextOne() {
        addGoogle("AIzaSy-slow-key-0001", "AIzaSy-fast-key-0002");
        when(backendCaller.call(any(), anyString(), any())).thenAnswer(invocation ->
                "AIzaSy-slow-key-0001".equals(invocation.getArgument(1))
                        ? Mono.error(new BackendFailureException("no response in 90s", BackendErrorType.TIMEOUT, null))
                        : Mono.just(image()));

        StepVerifier.create(engine.generate(request(null)))
                .assertNext(result -> {
                    assertThat(result.getChannel()).isEqualTo("google");
                    assertThat(result.getAttempts()).isEqualTo(2);
                })
                .verifyComplete();

        List<Credential> credentials = pool.listCredentials("google");
        assertThat(credentials.get(0).getFailureCount()).isEqualTo(1);
        assertThat(credentials.get(1).getFailureCount()).isZero();
    }

    @Test
    void channelsAreTriedInPriorityOrder() {
        addProxy("late", 5, "sk-late-key-0001");
        addProxy("early", 1, "sk-early-key-0001");
        when(backendCaller.call(any(), anyString(), any())).thenReturn(Mono.just(image()));

        StepVerifier.create(engine.generate(request(null)))
                .assertNext(result -> assertThat(result.getChannel()).isEqualTo("early"))
                .verifyComplete();
    }

    @Test
    void pinnedChannelIsUsedExclusively() {
        addGoogle("AIzaSy-first-key-0001");
        addProxy("proxy", 0, "sk-proxy-key-0001");
        when(backendCaller.call(channel("proxy"), anyString(), any())).thenReturn(Mono.error(retryable()));

        StepVerifier.create(engine.generate(request("proxy")))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(AllChannelsExhaustedException.class);
                    assertThat(((AllChannelsExhaustedException) error).getChannelsTried()).containsExactly("proxy");
                })
                .verify();
        verify(backendCaller, never()).call(channel("google"), anyString(), any());
    }

    @Test
    void pinnedChannelMustExistAndBeEnabled() {
        addGoogle("AIzaSy-first-key-0001");
        registry.setEnabled("google", false);

        StepVerifier.create(engine.generate(request("missing")))
                .expectError(ChannelValidationException.class)
                .verify();
        StepVerifier.create(engine.generate(request("google")))
                .expectError(ChannelValidationException.class)
                .verify();
    }

    @Test
    void pinnedChannelWithoutCredentialsReportsNoAvailableCredential() {
        registry.addChannel("google", ChannelFormat.GENERATE_CONTENT, GEMINI_URL, null, false, 0);

        StepVerifier.create(engine.generate(request("google")))
                .expectError(NoAvailableCredentialException.class)
                .verify();
    }

    @Test
    void noCredentialsInAnyCandidateChannelIsReportedAsNoAvailableCredential() {
        registry.addChannel("google", ChannelFormat.GENERATE_CONTENT, GEMINI_URL, null, false, 0);
        addProxy("proxy", 1, "sk-proxy-key-0001");
        pool.setThreshold("proxy", 1, 0);

        StepVerifier.create(engine.generate(request(null)))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(NoAvailableCredentialException.class);
                    assertThat(((NoAvailableCredentialException) error).getChannels())
                            .containsExactly("google", "proxy");
                })
                .verify();
        verify(backendCaller, never()).call(any(), anyString(), any());
    }

    @Test
    void noEnabledChannelsMeansExhausted() {
        StepVerifier.create(engine.generate(request(null)))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(AllChannelsExhaustedException.class);
                    assertThat(((AllChannelsExhaustedException) error).getLastErrorType()).isNull();
                })
                .verify();
    }

    @Test
    void blankPromptIsRejected() {
        StepVerifier.create(engine.generate(GenerationRequest.builder().prompt(" ").build()))
                .expectError(ChannelValidationException.class)
                .verify();
    }

    @Test
    void successResetsCredentialFailureCounter() {
        addGoogle("AIzaSy-first-key-0001");
        when(backendCaller.call(any(), anyString(), any()))
                .thenReturn(Mono.error(retryable()))
                .thenReturn(Mono.just(image()));

        StepVerifier.create(engine.generate(request(null)))
                .expectError(AllChannelsExhaustedException.class)
                .verify();
        assertThat(pool.listCredentials("google").get(0).getFailureCount()).isEqualTo(1);

        StepVerifier.create(engine.generate(request(null)))
                .expectNextCount(1)
                .verifyComplete();
        assertThat(pool.listCredentials("google").get(0).getFailureCount()).isZero();
    }

    private void addGoogle(String... keys) {
        registry.addChannel("google", ChannelFormat.GENERATE_CONTENT, GEMINI_URL, null, false, 0);
        pool.addCredentials("google", List.of(keys));
    }

    private void addProxy(String name, int priority, String... keys) {
        registry.addChannel(name, ChannelFormat.CHAT_COMPLETIONS, CHAT_URL, "gemini-2.5-flash-image", false, priority);
        pool.addCredentials(name, List.of(keys));
    }

    private static Channel channel(String name) {
        return argThat(channel -> channel != null && name.equals(channel.getName()));
    }

    private static GenerationRequest request(String channel) {
        return GenerationRequest.builder()
                .prompt("a cat in a space suit")
                .channel(channel)
                .build();
    }

    private static GeneratedImage image() {
        return new GeneratedImage(PNG, "image/png");
    }

    private static BackendFailureException retryable() {
        return new BackendFailureException("upstream 502", BackendErrorType.HTTP_5XX, 502);
    }
}
