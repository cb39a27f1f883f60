package com.mqol.teamservice.domain;

import com.mqol.access.Role;

import java.time.Instant;

public record Member(String userId, Role role, Instant createdAt, Instant updatedAt) {
}
