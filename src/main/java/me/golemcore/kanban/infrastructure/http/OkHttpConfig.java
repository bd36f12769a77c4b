package me.golemcore.kanban.infrastructure.http;

import lombok.RequiredArgsConstructor;
import me.golemcore.kanban.infrastructure.config.KanbanProperties;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} for the workflow record API, configured from
 * {@code kanban.http.*}.
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private final KanbanProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        KanbanProperties.HttpProperties http = properties.getHttp();

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .build();
    }
}
