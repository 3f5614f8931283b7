package com.fulqrom.backend.modules.access.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AssignRolesRequest(
        @JsonProperty("role_ids") @NotNull List<@NotBlank String> roleIds
) {
}
