package me.golemcore.kanban.adapter.outbound.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kanban.domain.model.RemotePersistenceException;
import me.golemcore.kanban.domain.model.RemoteWorkflowRecord;
import me.golemcore.kanban.domain.model.RemoteWorkflowUpdate;
import me.golemcore.kanban.infrastructure.config.KanbanProperties;
import me.golemcore.kanban.infrastructure.http.FeignClientFactory;
import me.golemcore.kanban.port.outbound.WorkflowPersistencePort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * {@link WorkflowPersistencePort} over the ADW records REST API.
 *
 * <p>
 * Calls block on the shared OkHttp pool, so they run off the caller's thread.
 * Every failure surfaces as a {@link RemotePersistenceException}: HTTP errors
 * carry the status and the server's {@code detail} message, transport errors
 * carry status 0.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HttpWorkflowPersistenceAdapter implements WorkflowPersistencePort {

    private static final String DETAIL_FIELD = "detail";

    private final FeignClientFactory feignClientFactory;
    private final KanbanProperties properties;
    private final ObjectMapper objectMapper;

    private AdwRecordsApi api;

    @PostConstruct
    public void init() {
        String baseUrl = properties.getApi().getBaseUrl();
        this.api = feignClientFactory.create(AdwRecordsApi.class, baseUrl);
        log.info("[AdwApi] Workflow records API at {}", baseUrl);
    }

    @Override
    public CompletableFuture<RemoteWorkflowRecord> create(RemoteWorkflowRecord record) {
        return call("create " + record.getAdwId(), () -> api.create(record));
    }

    @Override
    public CompletableFuture<RemoteWorkflowRecord> update(String externalId, RemoteWorkflowUpdate update) {
        return call("update " + externalId, () -> api.update(externalId, update));
    }

    @Override
    public CompletableFuture<Void> delete(String externalId) {
        return call("delete " + externalId, () -> {
            api.delete(externalId);
            return null;
        });
    }

    private <T> CompletableFuture<T> call(String operation, Supplier<T> request) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                T result = request.get();
                log.debug("[AdwApi] {} succeeded", operation);
                return result;
            } catch (FeignException e) {
                RemotePersistenceException error = translate(e);
                log.warn("[AdwApi] {} failed (status {}): {}", operation, error.getStatus(), error.getDetail());
                throw error;
            }
        });
    }

    RemotePersistenceException translate(FeignException e) {
        int status = Math.max(e.status(), 0);
        if (status == 0) {
            String reason = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            return new RemotePersistenceException(0, "Network error: " + reason, e);
        }
        String detail = extractDetail(e.contentUTF8());
        return new RemotePersistenceException(status, detail != null ? detail : "HTTP " + status, e);
    }

    private String extractDetail(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode detail = objectMapper.readTree(body).get(DETAIL_FIELD);
            if (detail == null || detail.isNull()) {
                return null;
            }
            return detail.isTextual() ? detail.asText() : detail.toString();
        } catch (JsonProcessingException e) {
            log.debug("[AdwApi] Error body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }
}
