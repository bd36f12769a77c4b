package me.golemcore.kanban.domain.service;

import me.golemcore.kanban.domain.model.Notification;
import me.golemcore.kanban.infrastructure.config.KanbanProperties;
import me.golemcore.kanban.testsupport.loop.DirectControlLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationServiceTest {

    private DirectControlLoop loop;
    private KanbanProperties properties;
    private NotificationService service;

    @BeforeEach
    void setUp() {
        loop = new DirectControlLoop();
        properties = new KanbanProperties();
        service = new NotificationService(loop, properties,
                Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldUseErrorDurationForErrors() {
        Notification error = service.error("boom");
        Notification info = service.info("hello");

        assertEquals(Notification.NotificationType.ERROR, error.getType());
        assertEquals(properties.getNotifications().getErrorDuration(), error.getDuration());
        assertEquals(properties.getNotifications().getDefaultDuration(), info.getDuration());
        assertNotEquals(error.getId(), info.getId());
    }

    @Test
    void shouldAutoDismissAfterDuration() {
        service.success("saved");
        assertEquals(1, service.getNotifications().size());
        assertEquals(List.of(properties.getNotifications().getDefaultDuration()), loop.scheduledDelays());

        loop.runScheduledTasks();

        assertTrue(service.getNotifications().isEmpty());
    }

    @Test
    void shouldKeepNotificationWithoutDuration() {
        service.add(Notification.NotificationType.WARNING, "sticky", Duration.ZERO);

        assertEquals(0, loop.scheduledTaskCount());
        assertEquals(1, service.getNotifications().size());
    }

    @Test
    void shouldDismissById() {
        Notification notification = service.info("hello");

        assertTrue(service.dismiss(notification.getId()));
        assertFalse(service.dismiss(notification.getId()));
        assertTrue(service.getNotifications().isEmpty());
    }
}
