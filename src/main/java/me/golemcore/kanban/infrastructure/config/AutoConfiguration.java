package me.golemcore.kanban.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kanban.domain.loop.ControlLoop;
import me.golemcore.kanban.domain.service.BoardPersistenceService;
import me.golemcore.kanban.infrastructure.loop.SingleThreadControlLoop;
import me.golemcore.kanban.port.outbound.WorkflowTransportPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Wires the shared infrastructure beans and brings the engine up: the board
 * is rehydrated from its last snapshot before the transport connects, so the
 * first inbound events already route to restored tasks.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private static final long REHYDRATE_TIMEOUT_SECONDS = 30;

    private final KanbanProperties properties;
    private final BoardPersistenceService persistenceService;
    private final WorkflowTransportPort transport;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public static ControlLoop controlLoop(KanbanProperties properties) {
        return new SingleThreadControlLoop(properties);
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Kanban v{} starting...", version);
        log.info("Workflow transport: {}", properties.getTransport().getUrl());
        log.info("Workflow API: {}", properties.getApi().getBaseUrl());
        log.info("Storage Path: {}", properties.getStorage().getBasePath());

        rehydrateBoard();

        if (properties.getTransport().isEnabled()) {
            log.info("Connecting workflow transport");
            transport.connect();
        } else {
            log.info("Workflow transport disabled, board runs offline");
        }
    }

    private void rehydrateBoard() {
        try {
            persistenceService.rehydrate().get(REHYDRATE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while rehydrating board");
        } catch (ExecutionException | TimeoutException e) {
            log.error("Board rehydration failed, starting with an empty board: {}", e.getMessage());
        }
    }
}
