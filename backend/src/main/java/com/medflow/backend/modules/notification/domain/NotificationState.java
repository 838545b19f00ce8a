package com.medflow.backend.modules.notification.domain;

public enum NotificationState {
    UNREAD,
    READ,
    EXPIRED
}
