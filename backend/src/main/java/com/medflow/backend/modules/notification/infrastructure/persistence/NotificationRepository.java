package com.medflow.backend.modules.notification.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.medflow.backend.modules.notification.domain.Notification;
import com.medflow.backend.modules.notification.domain.NotificationState;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    List<Notification> findByRecipientIdAndState(String recipientId, NotificationState state);

    Optional<Notification> findByRecipientIdAndDedupeKey(String recipientId, String dedupeKey);

    Optional<Notification> findByIdAndRecipientId(UUID id, String recipientId);

    long countByRecipientIdAndState(String recipientId, NotificationState state);

    List<Notification> findByRecipientIdAndKindCodeOrderByCreatedAtDesc(String recipientId, String kindCode);

    List<Notification> findByRecipientIdAndTtlAtBeforeAndStateNot(String recipientId, OffsetDateTime threshold, NotificationState state);

    @Query("""
            select n
              from Notification n
             where n.recipientId = :recipientId
               and n.state in :states
             order by case
                        when n.state = com.medflow.backend.modules.notification.domain.NotificationState.UNREAD then 0
                        when n.state = com.medflow.backend.modules.notification.domain.NotificationState.READ then 1
                        else 2
                      end,
                      n.createdAt desc
            """)
    Page<Notification> findByRecipientIdAndStates(
            @Param("recipientId") String recipientId,
            @Param("states") List<NotificationState> states,
            Pageable pageable
    );
}
