package com.medflow.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.medflow.backend.global.error.NotFoundException;
import com.medflow.backend.global.error.ProblemException;
import com.medflow.backend.modules.notification.domain.Notification;
import com.medflow.backend.modules.notification.domain.NotificationState;
import com.medflow.backend.modules.notification.infrastructure.persistence.NotificationRepository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class NotificationService {

    public static final String KIND_ESCORT_ASSIGNED = "ESCORT_ASSIGNED";
    public static final String KIND_NEXT_STATION = "NEXT_STATION";
    public static final String KIND_EQUIPMENT_BROKEN = "EQUIPMENT_BROKEN";
    public static final String KIND_EQUIPMENT_FAILURE = "EQUIPMENT_FAILURE";
    public static final int DEFAULT_TTL_HOURS = 24;

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    public NotificationService(NotificationRepository notificationRepository, Clock clock) {
        this.notificationRepository = notificationRepository;
        this.clock = clock;
    }

    public NotificationPageResult getNotifications(String recipientId, NotificationFilterState filter, Pageable pageable) {
        expireNotifications(recipientId);

        List<NotificationState> states = switch (filter) {
            case ALL -> List.of(NotificationState.UNREAD, NotificationState.READ);
            case UNREAD -> List.of(NotificationState.UNREAD);
            case READ -> List.of(NotificationState.READ);
        };

        Page<Notification> page = notificationRepository.findByRecipientIdAndStates(recipientId, states, pageable);
        long unreadCount = notificationRepository.countByRecipientIdAndState(recipientId, NotificationState.UNREAD);

        return new NotificationPageResult(
                page.getContent(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                unreadCount
        );
    }

    public void markNotificationRead(String recipientId, UUID notificationId) {
        Notification notification = notificationRepository.findByIdAndRecipientId(notificationId, recipientId)
                .orElseThrow(() -> new NotFoundException("NOTIFICATION_NOT_FOUND", "Unknown notification " + notificationId));

        if (notification.getState() == NotificationState.EXPIRED) {
            throw new ProblemException(HttpStatus.CONFLICT, "NOTIFICATION_EXPIRED");
        }

        if (notification.getState() == NotificationState.UNREAD) {
            notification.markRead(OffsetDateTime.now(clock));
            notificationRepository.save(notification);
        }
    }

    public int markAllNotificationsRead(String recipientId) {
        List<Notification> unread = notificationRepository.findByRecipientIdAndState(recipientId, NotificationState.UNREAD);
        if (unread.isEmpty()) {
            return 0;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        unread.forEach(notification -> notification.markRead(now));
        notificationRepository.saveAll(unread);
        return unread.size();
    }

    /**
     * Creates an unread notification unless one with the same dedupe key already exists for the recipient.
     */
    public Optional<Notification> sendNotification(
            String recipientId,
            String kindCode,
            String title,
            String body,
            String dedupeKey,
            Map<String, Object> metadata,
            int ttlHours
    ) {
        if (recipientId == null || recipientId.isBlank()) {
            return Optional.empty();
        }
        if (dedupeKey != null && notificationRepository.findByRecipientIdAndDedupeKey(recipientId, dedupeKey).isPresent()) {
            return Optional.empty();
        }

        OffsetDateTime now = OffsetDateTime.now(clock);

        Notification notification = new Notification();
        notification.setRecipientId(recipientId);
        notification.setKindCode(kindCode);
        notification.setTitle(title);
        notification.setBody(body);
        notification.setState(NotificationState.UNREAD);
        notification.setDedupeKey(dedupeKey);
        notification.setTtlAt(now.plusHours(ttlHours));
        notification.setMetadata(metadata == null ? Map.of() : metadata);

        return Optional.of(notificationRepository.save(notification));
    }

    private void expireNotifications(String recipientId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Notification> expirable = notificationRepository.findByRecipientIdAndTtlAtBeforeAndStateNot(
                recipientId,
                now,
                NotificationState.EXPIRED
        );
        if (expirable.isEmpty()) {
            return;
        }
        expirable.forEach(notification -> notification.markExpired(now));
        notificationRepository.saveAll(expirable);
    }

    public enum NotificationFilterState {
        ALL,
        UNREAD,
        READ
    }

    public record NotificationPageResult(
            List<Notification> notifications,
            int page,
            int size,
            long totalElements,
            long unreadCount
    ) {
    }
}
