package ru.oparin.drawer.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import ru.oparin.drawer.config.properties.DrawerProperties;
import ru.oparin.drawer.exception.ChannelValidationException;
import ru.oparin.drawer.exception.NoAvailableCredentialException;
import ru.oparin.drawer.model.domain.Credential;
import ru.oparin.drawer.model.domain.CredentialLease;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Пулы API ключей по каналам.
 * <p>
 * Ключи выдаются по кругу среди активных, начиная со следующего за последним выданным.
 * Успешный запрос обнуляет счетчик ошибок ключа, неудачный увеличивает его; при достижении
 * порога ключ перестает выдаваться до сброса. У каждого канала своя блокировка,
 * каналы друг другу не мешают.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialPool {

    private final ChannelRegistry channelRegistry;
    private final DrawerProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    private final Map<String, ChannelCredentials> pools = new ConcurrentHashMap<>();

    /**
     * Добавить ключи в канал. Пробелы по краям обрезаются, пустые значения и дубликаты пропускаются.
     *
     * @return количество добавленных ключей
     */
    public int addCredentials(String channel, Collection<String> values) {
        channelRegistry.require(channel);
        int threshold = properties.getCredentials().getDefaultThreshold();
        ChannelCredentials pool = poolFor(channel);
        int added = 0;
        synchronized (pool) {
            if (pool.retired || !channelRegistry.contains(channel)) {
                // канал удален между проверкой и захватом пула
                pools.remove(channel, pool);
                throw ChannelValidationException.unknownChannel(channel);
            }
            Set<String> known = new LinkedHashSet<>();
            pool.credentials.forEach(credential -> known.add(credential.getValue()));
            for (String raw : values) {
                if (raw == null || raw.isBlank()) {
                    continue;
                }
                String value = raw.trim();
                if (known.add(value)) {
                    pool.credentials.add(new Credential(channel, value, threshold, 0));
                    added++;
                }
            }
        }
        if (added > 0) {
            log.info("В канал {} добавлено ключей: {} (всего {})", channel, added, pool.size());
            publish("add credentials to " + channel);
        }
        return added;
    }

    /**
     * Восстановить ключ из сохраненного состояния со счетчиком и порогом.
     */
    public void restoreCredential(String channel, String value, int threshold, int failureCount) {
        if (value == null || value.isBlank()) {
            return;
        }
        ChannelCredentials pool = poolFor(channel);
        synchronized (pool) {
            String trimmed = value.trim();
            boolean exists = pool.credentials.stream().anyMatch(credential -> credential.getValue().equals(trimmed));
            if (!exists) {
                pool.credentials.add(new Credential(channel, trimmed,
                        Math.max(threshold, Credential.UNLIMITED_THRESHOLD), failureCount));
            }
        }
    }

    /**
     * Ключи канала в порядке добавления (позиция в списке + 1 = номер ключа).
     */
    public List<Credential> listCredentials(String channel) {
        ChannelCredentials pool = pools.get(channel);
        if (pool == null) {
            return List.of();
        }
        synchronized (pool) {
            return List.copyOf(pool.credentials);
        }
    }

    /**
     * Удалить ключ по номеру (с 1).
     *
     * @return удаленный ключ
     */
    public Credential removeCredential(String channel, int index) {
        ChannelCredentials pool = requirePool(channel);
        Credential removed;
        synchronized (pool) {
            checkIndex(pool, channel, index);
            int position = index - 1;
            removed = pool.credentials.remove(position);
            if (position <= pool.cursor) {
                pool.cursor--;
            }
        }
        log.info("Из канала {} удален ключ #{} {}", channel, index, removed.getMaskedValue());
        publish("remove credential from " + channel);
        return removed;
    }

    /**
     * Установить порог отключения ключа (неотрицательный или -1 для "без ограничения").
     *
     * @return ключ с новым порогом
     */
    public Credential setThreshold(String channel, int index, int threshold) {
        if (threshold < Credential.UNLIMITED_THRESHOLD) {
            throw new ChannelValidationException("Порог должен быть неотрицательным или равным -1: " + threshold);
        }
        ChannelCredentials pool = requirePool(channel);
        Credential credential;
        synchronized (pool) {
            checkIndex(pool, channel, index);
            credential = pool.credentials.get(index - 1);
            credential.setThreshold(threshold);
        }
        log.info("Канал {}, ключ #{} {}: порог {}, активен={}", channel, index,
                credential.getMaskedValue(), threshold, credential.isActive());
        publish("set threshold in " + channel);
        return credential;
    }

    /**
     * Сбросить счетчики ошибок ключей канала: одного ключа или всех, если номер не указан.
     *
     * @return количество ключей, у которых счетчик был ненулевым
     */
    public int resetFailures(String channel, Integer index) {
        ChannelCredentials pool = requirePool(channel);
        int changed = 0;
        synchronized (pool) {
            if (index != null) {
                checkIndex(pool, channel, index);
                changed = pool.credentials.get(index - 1).resetFailures() ? 1 : 0;
            } else {
                for (Credential credential : pool.credentials) {
                    if (credential.resetFailures()) {
                        changed++;
                    }
                }
            }
        }
        if (changed > 0) {
            log.info("Канал {}: сброшены счетчики ошибок у {} ключей", channel, changed);
            publish("reset credentials in " + channel);
        }
        return changed;
    }

    /**
     * Сбросить счетчики ошибок всех ключей во всех каналах.
     *
     * @return количество ключей, у которых счетчик был ненулевым
     */
    public int resetAll() {
        int changed = 0;
        for (ChannelCredentials pool : pools.values()) {
            synchronized (pool) {
                for (Credential credential : pool.credentials) {
                    if (credential.resetFailures()) {
                        changed++;
                    }
                }
            }
        }
        if (changed > 0) {
            log.info("Сброшены счетчики ошибок у {} ключей во всех каналах", changed);
            publish("reset all credentials");
        }
        return changed;
    }

    /**
     * Выдать следующий активный ключ канала.
     *
     * @throws NoAvailableCredentialException если активных ключей нет или канал удален
     */
    public CredentialLease acquire(String channel) {
        ChannelCredentials pool = pools.get(channel);
        if (pool == null) {
            throw new NoAvailableCredentialException(channel);
        }
        synchronized (pool) {
            if (pool.retired) {
                throw new NoAvailableCredentialException(channel);
            }
            int size = pool.credentials.size();
            for (int step = 1; step <= size; step++) {
                int position = Math.floorMod(pool.cursor + step, size);
                Credential credential = pool.credentials.get(position);
                if (credential.isActive()) {
                    pool.cursor = position;
                    return new CredentialLease(channel, credential, position + 1);
                }
            }
        }
        throw new NoAvailableCredentialException(channel);
    }

    /**
     * Сообщить результат использования ключа. Повторный отчет по той же аренде,
     * отчет по удаленному ключу или удаленному каналу ничего не меняют.
     */
    public void reportOutcome(CredentialLease lease, boolean success) {
        if (!lease.markReported()) {
            log.debug("Повторный отчет по ключу {} канала {} проигнорирован", lease.getMaskedSecret(), lease.getChannelName());
            return;
        }
        ChannelCredentials pool = pools.get(lease.getChannelName());
        Credential credential = lease.getCredential();
        if (pool == null || !pool.holds(credential)) {
            log.debug("Ключ {} канала {} уже удален, результат не учитывается",
                    lease.getMaskedSecret(), lease.getChannelName());
            return;
        }
        if (success) {
            if (credential.resetFailures()) {
                log.debug("Канал {}: счетчик ошибок ключа {} обнулен", lease.getChannelName(), lease.getMaskedSecret());
                publish("credential recovered in " + lease.getChannelName());
            }
            return;
        }
        int failures = credential.incrementFailures();
        if (!credential.isUnlimited() && failures == credential.getThreshold()) {
            log.warn("Канал {}: ключ {} отключен после {} ошибок подряд (credential disabled)",
                    lease.getChannelName(), lease.getMaskedSecret(), failures);
        } else {
            log.debug("Канал {}: ошибка ключа {}, счетчик {}/{}", lease.getChannelName(),
                    lease.getMaskedSecret(), failures, credential.isUnlimited() ? "∞" : credential.getThreshold());
        }
        publish("credential failure in " + lease.getChannelName());
    }

    /**
     * Количество активных ключей канала.
     */
    public int activeCount(String channel) {
        ChannelCredentials pool = pools.get(channel);
        if (pool == null) {
            return 0;
        }
        synchronized (pool) {
            return pool.retired ? 0 : (int) pool.credentials.stream().filter(Credential::isActive).count();
        }
    }

    /**
     * Вывести пул канала из оборота при удалении канала. Запросы, уже получившие ключ,
     * завершаются, новые ключи не выдаются.
     */
    public void retireChannel(String channel) {
        ChannelCredentials pool = pools.remove(channel);
        if (pool == null) {
            return;
        }
        synchronized (pool) {
            pool.retired = true;
        }
        log.info("Пул ключей канала {} выведен из оборота ({} ключей)", channel, pool.size());
        publish("retire pool " + channel);
    }

    private ChannelCredentials poolFor(String channel) {
        return pools.computeIfAbsent(channel, name -> new ChannelCredentials());
    }

    private ChannelCredentials requirePool(String channel) {
        channelRegistry.require(channel);
        return poolFor(channel);
    }

    private void checkIndex(ChannelCredentials pool, String channel, int index) {
        if (index < 1 || index > pool.credentials.size()) {
            throw ChannelValidationException.unknownCredential(channel, index);
        }
    }

    private void publish(String reason) {
        eventPublisher.publishEvent(new DrawerStateChangedEvent(this, reason));
    }

    /**
     * Ключи одного канала и позиция последнего выданного ключа. Доступ под монитором объекта.
     */
    private static final class ChannelCredentials {
        private final List<Credential> credentials = new ArrayList<>();
        private int cursor = -1;
        private boolean retired;

        synchronized boolean holds(Credential credential) {
            if (retired) {
                return false;
            }
            for (Credential candidate : credentials) {
                if (candidate == credential) {
                    return true;
                }
            }
            return false;
        }

        synchronized int size() {
            return credentials.size();
        }
    }
}
