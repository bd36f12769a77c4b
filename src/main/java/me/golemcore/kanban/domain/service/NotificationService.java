package me.golemcore.kanban.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kanban.domain.loop.ControlLoop;
import me.golemcore.kanban.domain.model.Notification;
import me.golemcore.kanban.infrastructure.config.KanbanProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * User-visible notifications. Each one is dismissed automatically once its
 * duration elapses.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final ControlLoop controlLoop;
    private final KanbanProperties properties;
    private final Clock clock;

    private final List<Notification> notifications = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    public Notification success(String message) {
        return add(Notification.NotificationType.SUCCESS, message, properties.getNotifications().getDefaultDuration());
    }

    public Notification info(String message) {
        return add(Notification.NotificationType.INFO, message, properties.getNotifications().getDefaultDuration());
    }

    public Notification error(String message) {
        return add(Notification.NotificationType.ERROR, message, properties.getNotifications().getErrorDuration());
    }

    public Notification add(Notification.NotificationType type, String message, Duration duration) {
        Notification notification = Notification.builder()
                .id("notification-" + sequence.incrementAndGet())
                .type(type)
                .message(message)
                .timestamp(clock.instant())
                .duration(duration)
                .build();
        notifications.add(notification);
        log.debug("[Notify] {}: {}", type, message);
        if (duration != null && !duration.isZero() && !duration.isNegative()) {
            controlLoop.schedule(() -> dismiss(notification.getId()), duration);
        }
        return notification;
    }

    public boolean dismiss(String notificationId) {
        return notifications.removeIf(notification -> notification.getId().equals(notificationId));
    }

    public List<Notification> getNotifications() {
        return List.copyOf(notifications);
    }
}
