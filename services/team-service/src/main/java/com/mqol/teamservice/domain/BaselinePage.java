package com.mqol.teamservice.domain;

import java.util.List;

/** One page of a patient's baselines. */
public record BaselinePage(List<PatientBaseline> data, long total, int limit, int offset) {

    public BaselinePage {
        data = List.copyOf(data);
    }

    public boolean hasMore() {
        return offset + data.size() < total;
    }
}
