package com.mqol.teamservice.domain;

import java.util.List;

/** One page of a patient search. */
public record PatientPage(List<Patient> data, long total, int limit, int offset) {

    public PatientPage {
        data = List.copyOf(data);
    }

    public boolean hasMore() {
        return offset + data.size() < total;
    }
}
