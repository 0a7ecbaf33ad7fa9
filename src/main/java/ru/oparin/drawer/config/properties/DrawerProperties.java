package ru.oparin.drawer.config.properties;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;
import ru.oparin.drawer.model.enums.ChannelFormat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Конфигурационные свойства шлюза генерации.
 * Настройки загружаются из application.yml с префиксом drawer.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "drawer")
public class DrawerProperties {

    private Http http = new Http();

    private Dispatch dispatch = new Dispatch();

    private Credentials credentials = new Credentials();

    private State state = new State();

    /**
     * Каналы, создаваемые при старте, если их нет в сохраненном состоянии.
     */
    private List<ChannelSeed> channels = new ArrayList<>();

    /**
     * Таймауты HTTP клиента бэкендов.
     */
    @Getter
    @Setter
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(30);

        /**
         * Таймаут обычного (не потокового) запроса.
         */
        private Duration requestTimeout = Duration.ofSeconds(120);

        /**
         * Таймаут потокового запроса целиком.
         */
        private Duration streamTimeout = Duration.ofSeconds(180);

        /**
         * Максимальный размер тела ответа в памяти (ответы с base64 изображениями бывают большими).
         */
        private DataSize maxInMemorySize = DataSize.ofMegabytes(64);
    }

    @Getter
    @Setter
    public static class Dispatch {
        /**
         * Пауза между попытками после повторяемой ошибки.
         */
        private Duration retryDelay = Duration.ofSeconds(1);

        /**
         * Ограничение попыток в одном канале за один запрос. 0 означает "без ограничения":
         * пробуются все активные ключи канала.
         */
        private int maxAttemptsPerChannel = 0;
    }

    @Getter
    @Setter
    public static class Credentials {
        /**
         * Порог отключения для новых ключей (-1 = не отключать).
         */
        private int defaultThreshold = 5;

        /**
         * Префикс ключей сторонних OpenAI-совместимых прокси.
         */
        private String thirdPartyPrefix = "sk-";

        private String firstPartyChannel = "google";

        private String thirdPartyChannel = "bailili";
    }

    @Getter
    @Setter
    public static class State {
        /**
         * Путь к JSON файлу состояния. Если не задан, состояние хранится только в памяти.
         */
        private String file;
    }

    /**
     * Описание канала в конфигурации.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChannelSeed {
        private String name;
        private ChannelFormat format;
        private String url;
        private String model;
        private boolean enabled = true;
        private boolean streaming = false;
        private int priority = 0;
        private List<String> credentials = new ArrayList<>();
    }
}
