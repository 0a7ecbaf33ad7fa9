package ru.oparin.drawer.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import ru.oparin.drawer.config.properties.DrawerProperties;
import ru.oparin.drawer.exception.AllChannelsExhaustedException;
import ru.oparin.drawer.exception.BackendFailureException;
import ru.oparin.drawer.exception.ChannelValidationException;
import ru.oparin.drawer.exception.NoAvailableCredentialException;
import ru.oparin.drawer.model.domain.Channel;
import ru.oparin.drawer.model.domain.CredentialLease;
import ru.oparin.drawer.model.domain.GeneratedImage;
import ru.oparin.drawer.model.domain.GenerationRequest;
import ru.oparin.drawer.model.domain.GenerationResult;
import ru.oparin.drawer.service.adapter.BackendCaller;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Диспетчер запросов генерации.
 * <p>
 * Перебирает каналы в порядке приоритета, внутри канала перебирает ключи по кругу.
 * Число попыток в канале равно количеству активных ключей на момент входа в канал
 * (или меньше, если задано {@code drawer.dispatch.max-attempts-per-channel}); список каналов
 * фиксируется в начале запроса, поэтому перебор всегда конечен.
 * <p>
 * Если ни в одном из каналов не нашлось активного ключа, возвращается
 * {@link NoAvailableCredentialException} со списком этих каналов.
 * <p>
 * Повторяемая ошибка ведет к следующему ключу (после паузы {@code drawer.dispatch.retry-delay}),
 * неповторяемая сразу возвращается вызывающему.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispatchEngine {

    private final ChannelRegistry channelRegistry;
    private final CredentialPool credentialPool;
    private final BackendCaller backendCaller;
    private final DispatchMetricsService metricsService;
    private final DrawerProperties properties;

    /**
     * Сгенерировать изображение.
     *
     * @param request логический запрос
     * @return результат с изображением, каналом и числом попыток
     */
    public Mono<GenerationResult> generate(GenerationRequest request) {
        return Mono.defer(() -> {
            validate(request);
            metricsService.recordRequest();
            List<Channel> candidates = resolveCandidates(request);
            log.debug("Каналы-кандидаты для запроса: {}", candidates.stream().map(Channel::getName).toList());
            DispatchContext context = new DispatchContext(request, candidates);
            return tryChannel(context, 0);
        });
    }

    private void validate(GenerationRequest request) {
        if (!StringUtils.hasText(request.getPrompt())) {
            throw new ChannelValidationException("Промпт не может быть пустым");
        }
    }

    /**
     * Закрепленный канал или все включенные каналы, отсортированные по приоритету
     * (при равном приоритете сохраняется порядок добавления).
     */
    private List<Channel> resolveCandidates(GenerationRequest request) {
        if (request.isChannelPinned()) {
            Channel channel = channelRegistry.require(request.getChannel());
            if (!channel.isEnabled()) {
                throw new ChannelValidationException(
                        String.format("Канал `%s` отключен", channel.getName()), HttpStatus.BAD_REQUEST);
            }
            return List.of(channel);
        }
        return channelRegistry.enabledChannels().stream()
                .sorted(Comparator.comparingInt(Channel::getPriority))
                .toList();
    }

    private Mono<GenerationResult> tryChannel(DispatchContext context, int channelIndex) {
        if (channelIndex >= context.candidates.size()) {
            if (context.channelsTried.isEmpty() && !context.channelsWithoutCredentials.isEmpty()) {
                return Mono.error(noCredentials(context));
            }
            return Mono.error(exhausted(context));
        }
        Channel channel = context.candidates.get(channelIndex);
        if (context.lastChannel != null) {
            metricsService.recordFailover(context.lastChannel, channel.getName());
            log.warn("Канал {} не смог выполнить запрос, переключение на канал {}", context.lastChannel, channel.getName());
        }

        int maxAttempts = attemptsFor(credentialPool.activeCount(channel.getName()));
        if (maxAttempts <= 0) {
            log.debug("В канале {} нет активных ключей, пропускаем", channel.getName());
            return skipChannel(context, channelIndex, channel);
        }
        context.channelsTried.add(channel.getName());
        context.lastChannel = channel.getName();
        return attempt(context, channelIndex, channel, 1, maxAttempts);
    }

    private Mono<GenerationResult> attempt(DispatchContext context, int channelIndex, Channel channel,
                                           int draw, int maxAttempts) {
        if (draw > maxAttempts) {
            return tryChannel(context, channelIndex + 1);
        }
        CredentialLease lease;
        try {
            lease = credentialPool.acquire(channel.getName());
        } catch (NoAvailableCredentialException e) {
            log.debug("Канал {}: ключи закончились на попытке {}", channel.getName(), draw);
            return tryChannel(context, channelIndex + 1);
        }
        context.attempts++;
        log.debug("Попытка {} (в канале {}/{}): канал {}, ключ #{} {}", context.attempts, draw, maxAttempts,
                channel.getName(), lease.getPosition(), lease.getMaskedSecret());

        return backendCaller.call(channel, lease.getSecret(), context.request)
                .map(image -> onSuccess(context, channel, lease, image))
                .onErrorResume(BackendFailureException.class, failure -> {
                    credentialPool.reportOutcome(lease, false);
                    metricsService.recordFailure(failure.getErrorType());
                    if (!failure.isRetryable()) {
                        metricsService.recordRejected();
                        log.warn("Канал {}, ключ {}: неповторяемая ошибка [{}], запрос прерван: {}",
                                channel.getName(), lease.getMaskedSecret(), failure.getErrorType(), failure.getMessage());
                        return Mono.error(failure);
                    }
                    context.lastFailure = failure;
                    log.warn("Канал {}, ключ {}: ошибка [{}], пробуем дальше: {}",
                            channel.getName(), lease.getMaskedSecret(), failure.getErrorType(), failure.getMessage());
                    return Mono.delay(properties.getDispatch().getRetryDelay())
                            .then(Mono.defer(() -> attempt(context, channelIndex, channel, draw + 1, maxAttempts)));
                });
    }

    private GenerationResult onSuccess(DispatchContext context, Channel channel, CredentialLease lease,
                                       GeneratedImage image) {
        credentialPool.reportOutcome(lease, true);
        metricsService.recordSuccess(channel.getName());
        log.info("Изображение сгенерировано через канал {} (ключ {}), попыток: {}, размер: {} байт",
                channel.getName(), lease.getMaskedSecret(), context.attempts, image.getData().length);
        return GenerationResult.builder()
                .image(image.getData())
                .mimeType(image.getMimeType())
                .channel(channel.getName())
                .credential(lease.getMaskedSecret())
                .attempts(context.attempts)
                .build();
    }

    private Mono<GenerationResult> skipChannel(DispatchContext context, int channelIndex, Channel channel) {
        context.channelsWithoutCredentials.add(channel.getName());
        if (context.request.isChannelPinned()) {
            return Mono.error(new NoAvailableCredentialException(channel.getName()));
        }
        return tryChannel(context, channelIndex + 1);
    }

    /**
     * Число попыток в канале: все активные ключи, если не задано ограничение
     * {@code drawer.dispatch.max-attempts-per-channel}.
     */
    private int attemptsFor(int activeCount) {
        int cap = properties.getDispatch().getMaxAttemptsPerChannel();
        return cap > 0 ? Math.min(activeCount, cap) : activeCount;
    }

    private NoAvailableCredentialException noCredentials(DispatchContext context) {
        NoAvailableCredentialException exception =
                new NoAvailableCredentialException(context.channelsWithoutCredentials);
        log.error(exception.getMessage());
        return exception;
    }

    private AllChannelsExhaustedException exhausted(DispatchContext context) {
        metricsService.recordExhausted();
        AllChannelsExhaustedException exception = new AllChannelsExhaustedException(
                context.lastFailure, context.attempts, context.channelsTried, context.channelsWithoutCredentials);
        log.error(exception.getMessage());
        return exception;
    }

    /**
     * Состояние перебора одного запроса.
     */
    private static class DispatchContext {
        final GenerationRequest request;
        final List<Channel> candidates;
        final List<String> channelsTried = new ArrayList<>();
        final List<String> channelsWithoutCredentials = new ArrayList<>();
        int attempts;
        String lastChannel;
        BackendFailureException lastFailure;

        DispatchContext(GenerationRequest request, List<Channel> candidates) {
            this.request = request;
            this.candidates = candidates;
        }
    }
}
