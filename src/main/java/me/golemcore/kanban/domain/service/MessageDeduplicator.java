package me.golemcore.kanban.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.kanban.domain.loop.ControlLoop;
import me.golemcore.kanban.domain.model.Stage;
import me.golemcore.kanban.domain.model.Task;
import me.golemcore.kanban.domain.model.event.StatusUpdateEvent;
import me.golemcore.kanban.domain.model.event.WorkflowEvent;
import me.golemcore.kanban.infrastructure.config.KanbanProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Suppresses re-delivered inbound events.
 *
 * <p>
 * The transport delivers at least once, so every status, log and trigger event
 * is fingerprinted by content ({@link MessageFingerprint}) and dropped when the
 * same fingerprint was seen within the TTL. One exception: a status update that
 * claims a {@code "Stage: X"} the task is not in is let through again, since
 * that is how a lost client state gets repaired by a backend resend.
 *
 * <p>
 * Entries live in insertion order. Refreshing an entry moves it to the end, so
 * the head is always the oldest. When the cache grows past its bound the
 * oldest fifth is evicted immediately; past the sweep threshold an expiry sweep
 * is queued as idle work on the {@link ControlLoop}.
 *
 * <p>
 * Only touched from the control thread.
 */
@Service
@Slf4j
public class MessageDeduplicator {

    private final ExternalIdIndex externalIdIndex;
    private final ControlLoop controlLoop;
    private final Clock clock;
    private final int maxSize;
    private final Duration ttl;
    private final double sweepThreshold;
    private final double evictionRatio;

    private Map<String, Instant> cache;
    private boolean sweepScheduled;

    @Autowired
    public MessageDeduplicator(ExternalIdIndex externalIdIndex, ControlLoop controlLoop,
            KanbanProperties properties, Clock clock) {
        this(externalIdIndex, controlLoop, properties, clock, new LinkedHashMap<>());
    }

    MessageDeduplicator(ExternalIdIndex externalIdIndex, ControlLoop controlLoop,
            KanbanProperties properties, Clock clock, Map<String, Instant> cache) {
        this.externalIdIndex = externalIdIndex;
        this.controlLoop = controlLoop;
        this.clock = clock;
        KanbanProperties.DedupProperties dedup = properties.getDedup();
        this.maxSize = dedup.getMaxSize();
        this.ttl = dedup.getTtl();
        this.sweepThreshold = dedup.getSweepThreshold();
        this.evictionRatio = dedup.getEvictionRatio();
        this.cache = cache;
    }

    /**
     * Whether the event was already processed. Records the fingerprint when
     * the answer is no.
     */
    public boolean isDuplicate(WorkflowEvent event) {
        if (!event.type().isDeduplicated()) {
            return false;
        }
        String fingerprint = MessageFingerprint.of(event);
        try {
            return checkAndRecord(event, fingerprint);
        } catch (ClassCastException e) { // NOSONAR - corrupted cache is reset, never fatal
            log.warn("[Dedup] Cache corrupted ({}), resetting and letting message through", e.getMessage());
            cache = new LinkedHashMap<>();
            cache.put(fingerprint, clock.instant());
            return false;
        }
    }

    /**
     * Forget everything. Called on every transport (re)connect and on
     * rehydration.
     */
    public void clear() {
        int size = cache.size();
        cache = new LinkedHashMap<>();
        if (size > 0) {
            log.debug("[Dedup] Cleared {} fingerprints", size);
        }
    }

    public int size() {
        return cache.size();
    }

    private boolean checkAndRecord(WorkflowEvent event, String fingerprint) {
        Instant now = clock.instant();
        Instant lastSeen = cache.get(fingerprint);
        if (lastSeen != null) {
            if (isWithinTtl(lastSeen, now)) {
                if (isStageMismatch(event)) {
                    log.info("[Dedup] Re-applying stage hint for {} after state divergence", event.externalId());
                    cache.remove(fingerprint);
                    cache.put(fingerprint, now);
                    return false;
                }
                return true;
            }
            cache.remove(fingerprint);
        }
        cache.put(fingerprint, now);
        enforceCapacity();
        return false;
    }

    private boolean isWithinTtl(Instant lastSeen, Instant now) {
        return Duration.between(lastSeen, now).compareTo(ttl) < 0;
    }

    private boolean isStageMismatch(WorkflowEvent event) {
        if (!(event instanceof StatusUpdateEvent update)) {
            return false;
        }
        Optional<Stage> hinted = StageHintParser.parseStage(update.currentStep());
        if (hinted.isEmpty()) {
            return false;
        }
        Optional<Task> task = externalIdIndex.resolve(update.externalId());
        return task.isPresent() && task.get().getStage() != hinted.get();
    }

    private void enforceCapacity() {
        if (cache.size() > maxSize) {
            int toEvict = (int) Math.floor(maxSize * evictionRatio);
            Iterator<String> oldest = cache.keySet().iterator();
            for (int i = 0; i < toEvict && oldest.hasNext(); i++) {
                oldest.next();
                oldest.remove();
            }
            log.debug("[Dedup] Evicted {} oldest fingerprints, {} remain", toEvict, cache.size());
        }
        if (cache.size() > maxSize * sweepThreshold && !sweepScheduled) {
            sweepScheduled = true;
            controlLoop.executeWhenIdle(this::sweepExpired);
        }
    }

    private void sweepExpired() {
        sweepScheduled = false;
        Instant now = clock.instant();
        int before = cache.size();
        cache.values().removeIf(lastSeen -> !isWithinTtl(lastSeen, now));
        int removed = before - cache.size();
        if (removed > 0) {
            log.debug("[Dedup] Idle sweep removed {} expired fingerprints", removed);
        }
    }
}
