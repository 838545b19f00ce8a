package com.medflow.backend.modules.notification.presentation;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

import com.medflow.backend.global.error.ProblemException;
import com.medflow.backend.global.web.RequestIdFilter;
import com.medflow.backend.modules.notification.application.NotificationService;
import com.medflow.backend.modules.notification.application.NotificationService.NotificationFilterState;
import com.medflow.backend.modules.notification.application.NotificationService.NotificationPageResult;
import com.medflow.backend.modules.notification.domain.Notification;
import com.medflow.backend.modules.notification.presentation.dto.NotificationItemResponse;
import com.medflow.backend.modules.notification.presentation.dto.NotificationListResponse;

import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Notifications of the calling actor. Shared desks read theirs with {@code recipient}.
 */
@RestController
@RequestMapping("/notifications")
@Tag(name = "Notifications")
public class NotificationController {

    private static final int MAX_PAGE_SIZE = 50;

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public ResponseEntity<NotificationListResponse> getNotifications(
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId,
            @RequestParam(name = "recipient", required = false) String recipient,
            @RequestParam(name = "state", defaultValue = "all") String stateParam,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        NotificationFilterState filter = parseState(stateParam);
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);

        NotificationPageResult result = notificationService.getNotifications(
                recipientOf(actorId, recipient),
                filter,
                PageRequest.of(safePage, safeSize)
        );

        List<NotificationItemResponse> items = result.notifications().stream()
                .map(this::toItemResponse)
                .toList();

        return ResponseEntity.ok(new NotificationListResponse(
                items,
                result.page(),
                result.size(),
                result.totalElements(),
                result.unreadCount()
        ));
    }

    @PatchMapping("/{notificationId}/read")
    public ResponseEntity<Void> markRead(
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId,
            @RequestParam(name = "recipient", required = false) String recipient,
            @PathVariable("notificationId") UUID notificationId
    ) {
        notificationService.markNotificationRead(recipientOf(actorId, recipient), notificationId);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/read-all")
    public ResponseEntity<Void> markAllRead(
            @RequestHeader(RequestIdFilter.ACTOR_ID_HEADER) String actorId,
            @RequestParam(name = "recipient", required = false) String recipient
    ) {
        notificationService.markAllNotificationsRead(recipientOf(actorId, recipient));
        return ResponseEntity.noContent().build();
    }

    private NotificationItemResponse toItemResponse(Notification notification) {
        return new NotificationItemResponse(
                notification.getId(),
                notification.getKindCode(),
                notification.getTitle(),
                notification.getBody(),
                notification.getState().name(),
                notification.getCreatedAt(),
                notification.getReadAt(),
                notification.getTtlAt(),
                notification.getMetadata()
        );
    }

    private static String recipientOf(String actorId, String recipient) {
        return recipient != null && !recipient.isBlank() ? recipient.trim() : actorId;
    }

    private NotificationFilterState parseState(String value) {
        String normalized = value == null ? "all" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "all" -> NotificationFilterState.ALL;
            case "unread" -> NotificationFilterState.UNREAD;
            case "read" -> NotificationFilterState.READ;
            default -> throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_STATE");
        };
    }
}
