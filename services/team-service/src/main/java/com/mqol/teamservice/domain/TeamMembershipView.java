package com.mqol.teamservice.domain;

import com.mqol.access.Role;

/** A team together with the listing actor's role in it. */
public record TeamMembershipView(Team team, Role role) {
}
