package ru.oparin.drawer.model.domain;

import lombok.Getter;
import ru.oparin.drawer.util.SecretMasker;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * API ключ канала со счетчиком последовательных ошибок и порогом отключения.
 * <p>
 * Активность ключа не хранится отдельным флагом, а вычисляется:
 * ключ отключен тогда и только тогда, когда счетчик ошибок достиг порога
 * и порог не равен {@link #UNLIMITED_THRESHOLD}.
 * <p>
 * Изменять счетчик и порог должен только {@code CredentialPool}.
 */
public class Credential {

    /**
     * Значение порога "никогда не отключать".
     */
    public static final int UNLIMITED_THRESHOLD = -1;

    @Getter
    private final String channelName;

    @Getter
    private final String value;

    private final AtomicInteger failureCount;

    private volatile int threshold;

    public Credential(String channelName, String value, int threshold, int failureCount) {
        this.channelName = channelName;
        this.value = value;
        this.threshold = threshold;
        this.failureCount = new AtomicInteger(Math.max(0, failureCount));
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    public int getThreshold() {
        return threshold;
    }

    public boolean isUnlimited() {
        return threshold == UNLIMITED_THRESHOLD;
    }

    public boolean isActive() {
        int currentThreshold = threshold;
        return currentThreshold == UNLIMITED_THRESHOLD || failureCount.get() < currentThreshold;
    }

    public String getMaskedValue() {
        return SecretMasker.mask(value);
    }

    /**
     * Атомарно увеличить счетчик ошибок.
     *
     * @return новое значение счетчика
     */
    public int incrementFailures() {
        return failureCount.incrementAndGet();
    }

    /**
     * Сбросить счетчик ошибок в ноль.
     *
     * @return true если счетчик был ненулевым
     */
    public boolean resetFailures() {
        return failureCount.getAndSet(0) != 0;
    }

    public void setThreshold(int threshold) {
        if (threshold < UNLIMITED_THRESHOLD) {
            throw new IllegalArgumentException("Порог должен быть неотрицательным или равным -1: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public String toString() {
        return "Credential{channel=" + channelName + ", value=" + getMaskedValue()
                + ", failures=" + failureCount.get() + ", threshold=" + threshold + "}";
    }
}
