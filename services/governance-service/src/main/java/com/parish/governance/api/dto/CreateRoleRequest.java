package com.parish.governance.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;

public record CreateRoleRequest(@NotBlank @Size(max = 100) String name, List<String> permissions) {
}
