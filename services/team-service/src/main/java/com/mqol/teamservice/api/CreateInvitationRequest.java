package com.mqol.teamservice.api;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record CreateInvitationRequest(@Email String email, @NotBlank String role) {
}
