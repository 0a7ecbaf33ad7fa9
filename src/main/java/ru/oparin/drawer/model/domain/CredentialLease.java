package ru.oparin.drawer.model.domain;

import lombok.Getter;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Выданный пулом ключ для одного обращения к бэкенду.
 * <p>
 * Выдача не эксклюзивна: один и тот же ключ может одновременно использоваться
 * несколькими запросами. Аренда нужна, чтобы сообщить пулу результат ровно один раз.
 */
@Getter
public class CredentialLease {

    private final String channelName;
    private final Credential credential;

    /**
     * Порядковый номер ключа в канале на момент выдачи (с 1).
     */
    private final int position;

    private final AtomicBoolean reported = new AtomicBoolean(false);

    public CredentialLease(String channelName, Credential credential, int position) {
        this.channelName = channelName;
        this.credential = credential;
        this.position = position;
    }

    public String getSecret() {
        return credential.getValue();
    }

    public String getMaskedSecret() {
        return credential.getMaskedValue();
    }

    /**
     * Отметить аренду как отчитанную.
     *
     * @return true если это первый отчет по аренде
     */
    public boolean markReported() {
        return reported.compareAndSet(false, true);
    }
}
