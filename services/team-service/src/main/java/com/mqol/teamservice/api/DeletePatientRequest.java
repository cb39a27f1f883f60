package com.mqol.teamservice.api;

import jakarta.validation.constraints.Size;

public record DeletePatientRequest(@Size(max = 500) String deletionReason) {
}
