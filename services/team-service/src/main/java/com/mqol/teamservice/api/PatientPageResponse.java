package com.mqol.teamservice.api;

import com.mqol.teamservice.domain.PatientPage;
import java.util.List;

public record PatientPageResponse(List<PatientResponse> data, Pagination pagination) {

    public record Pagination(long total, boolean hasMore, int limit, int offset) {
    }

    static PatientPageResponse from(PatientPage page) {
        return new PatientPageResponse(
                page.data().stream().map(PatientResponse::from).toList(),
                new Pagination(page.total(), page.hasMore(), page.limit(), page.offset()));
    }
}
