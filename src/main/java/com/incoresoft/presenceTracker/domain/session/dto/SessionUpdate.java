package com.incoresoft.presenceTracker.domain.session.dto;

public record SessionUpdate(SessionTransition transition, PresenceSnapshot snapshot) {
}
