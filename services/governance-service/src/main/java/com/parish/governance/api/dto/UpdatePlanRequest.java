package com.parish.governance.api.dto;

import jakarta.validation.constraints.NotBlank;

public record UpdatePlanRequest(@NotBlank String planId) {
}
