package com.mqol.teamservice.api;

import com.mqol.teamservice.domain.Member;
import java.time.Instant;

public record MemberResponse(String userId, String role, Instant createdAt, Instant updatedAt) {

    static MemberResponse from(Member member) {
        return new MemberResponse(member.userId(), member.role().value(), member.createdAt(),
                member.updatedAt());
    }
}
