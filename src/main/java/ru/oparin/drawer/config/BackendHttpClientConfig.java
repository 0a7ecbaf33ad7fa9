package ru.oparin.drawer.config;

import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import ru.oparin.drawer.config.properties.DrawerProperties;

/**
 * Общий WebClient для обращения к бэкендам генерации и загрузки изображений по URL.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class BackendHttpClientConfig {

    private final DrawerProperties properties;

    @Bean
    public WebClient backendWebClient(WebClient.Builder webClientBuilder) {
        DrawerProperties.Http http = properties.getHttp();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) http.getConnectTimeout().toMillis())
                .followRedirect(true);

        log.info("HTTP клиент бэкендов: connectTimeout={}, requestTimeout={}, streamTimeout={}",
                http.getConnectTimeout(), http.getRequestTimeout(), http.getStreamTimeout());

        return webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs()
                        .maxInMemorySize((int) http.getMaxInMemorySize().toBytes()))
                .build();
    }
}
