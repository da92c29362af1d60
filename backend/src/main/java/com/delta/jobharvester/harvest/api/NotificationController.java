package com.delta.jobharvester.harvest.api;

import com.delta.jobharvester.harvest.model.OwnerNotification;
import com.delta.jobharvester.harvest.service.OwnerNotificationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {
    private final OwnerNotificationService notificationService;

    public NotificationController(OwnerNotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public List<OwnerNotification> list(
        @RequestParam(name = "owner") String owner,
        @RequestParam(name = "unreadOnly", required = false, defaultValue = "false") boolean unreadOnly,
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit
    ) {
        return notificationService.list(owner, unreadOnly, Math.min(500, Math.max(1, limit)));
    }

    @PostMapping("/{notificationId}/read")
    public ResponseEntity<Void> markRead(@PathVariable("notificationId") long notificationId) {
        return notificationService.markRead(notificationId)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }
}
