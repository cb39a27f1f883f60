package com.mqol.teamservice.api;

import com.mqol.teamservice.api.PatientPageResponse.Pagination;
import com.mqol.teamservice.domain.BaselinePage;
import java.util.List;

public record BaselinePageResponse(List<BaselineResponse> data, Pagination pagination) {

    static BaselinePageResponse from(BaselinePage page) {
        return new BaselinePageResponse(
                page.data().stream().map(BaselineResponse::from).toList(),
                new Pagination(page.total(), page.hasMore(), page.limit(), page.offset()));
    }
}
