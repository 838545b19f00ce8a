package com.medflow.backend.modules.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.medflow.backend.global.error.ProblemException;
import com.medflow.backend.modules.notification.application.NotificationService;
import com.medflow.backend.modules.notification.domain.Notification;
import com.medflow.backend.modules.notification.domain.NotificationState;
import com.medflow.backend.modules.notification.infrastructure.persistence.NotificationRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private NotificationRepository notificationRepository;

    private NotificationService notificationService;
    private Clock clock;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2025-03-10T01:00:00Z").toInstant(), ZoneOffset.UTC);
        notificationService = new NotificationService(notificationRepository, clock);
    }

    @Test
    @DisplayName("a new notification is stored unread with a ttl")
    void sendNotification_createsUnread() {
        when(notificationRepository.findByRecipientIdAndDedupeKey("escort-7", "NEXT_STATION:p1:CT")).thenReturn(Optional.empty());
        when(notificationRepository.save(any(Notification.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Optional<Notification> sent = notificationService.sendNotification(
                "escort-7",
                NotificationService.KIND_NEXT_STATION,
                "Next station",
                "Take patient C-001 to CT",
                "NEXT_STATION:p1:CT",
                Map.of("stationCode", "CT"),
                NotificationService.DEFAULT_TTL_HOURS
        );

        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationRepository).save(captor.capture());
        Notification saved = captor.getValue();
        assertThat(sent).isPresent();
        assertThat(saved.getRecipientId()).isEqualTo("escort-7");
        assertThat(saved.getState()).isEqualTo(NotificationState.UNREAD);
        assertThat(saved.getTtlAt()).isEqualTo(OffsetDateTime.now(clock).plusHours(24));
        assertThat(saved.getMetadata()).containsEntry("stationCode", "CT");
    }

    @Test
    @DisplayName("a repeated dedupe key creates nothing")
    void sendNotification_skipsDuplicates() {
        when(notificationRepository.findByRecipientIdAndDedupeKey("escort-7", "dup"))
                .thenReturn(Optional.of(new Notification()));

        Optional<Notification> sent = notificationService.sendNotification(
                "escort-7", NotificationService.KIND_NEXT_STATION, "t", "b", "dup", null, 1);

        assertThat(sent).isEmpty();
        verify(notificationRepository, never()).save(any());
    }

    @Test
    void sendNotification_withoutRecipientIsIgnored() {
        assertThat(notificationService.sendNotification(
                " ", NotificationService.KIND_EQUIPMENT_BROKEN, "t", "b", null, null, 1)).isEmpty();
        verify(notificationRepository, never()).save(any());
    }

    @Test
    void markAllNotificationsRead_marksEveryUnread() {
        Notification first = new Notification();
        Notification second = new Notification();
        when(notificationRepository.findByRecipientIdAndState("DISPATCH", NotificationState.UNREAD))
                .thenReturn(List.of(first, second));

        int updated = notificationService.markAllNotificationsRead("DISPATCH");

        assertThat(updated).isEqualTo(2);
        assertThat(first.getState()).isEqualTo(NotificationState.READ);
        assertThat(second.getReadAt()).isEqualTo(OffsetDateTime.now(clock));
    }

    @Test
    void markNotificationRead_rejectsExpired() {
        UUID id = UUID.randomUUID();
        Notification expired = new Notification();
        expired.markExpired(OffsetDateTime.now(clock));
        when(notificationRepository.findByIdAndRecipientId(id, "DISPATCH")).thenReturn(Optional.of(expired));

        assertThatThrownBy(() -> notificationService.markNotificationRead("DISPATCH", id))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo("NOTIFICATION_EXPIRED"));
    }
}
