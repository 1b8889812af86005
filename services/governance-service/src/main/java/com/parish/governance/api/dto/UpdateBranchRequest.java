package com.parish.governance.api.dto;

import jakarta.validation.constraints.Size;

/** Null fields are left unchanged; a blank location clears it. */
public record UpdateBranchRequest(@Size(max = 200) String name, @Size(max = 300) String location) {
}
