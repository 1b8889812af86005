package com.parish.governance.api.dto;

import jakarta.validation.constraints.Size;
import java.util.List;

/** Null fields are left unchanged. */
public record UpdateRoleRequest(@Size(max = 100) String name, List<String> permissions) {
}
