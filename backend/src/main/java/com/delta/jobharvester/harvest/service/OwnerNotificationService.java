package com.delta.jobharvester.harvest.service;

import com.delta.jobharvester.harvest.model.NotificationType;
import com.delta.jobharvester.harvest.model.OwnerNotification;
import com.delta.jobharvester.harvest.persistence.NotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
public class OwnerNotificationService {
    private static final Logger log = LoggerFactory.getLogger(OwnerNotificationService.class);

    private final NotificationRepository repository;
    private final Clock clock;

    public OwnerNotificationService(NotificationRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Best-effort: a failed notification is logged and never undoes the state change that caused it.
     */
    public boolean notify(String owner, String message, NotificationType type, Long taskId) {
        if (owner == null || owner.isBlank()) {
            return false;
        }
        try {
            repository.insert(owner, message, type, taskId, clock.instant());
            return true;
        } catch (Exception e) {
            log.warn("Failed to notify {} about task {}: {}", owner, taskId, e.getMessage());
            return false;
        }
    }

    public List<OwnerNotification> list(String owner, boolean unreadOnly, int limit) {
        return repository.findForOwner(owner, unreadOnly, limit);
    }

    public boolean markRead(long notificationId) {
        return repository.markRead(notificationId);
    }
}
