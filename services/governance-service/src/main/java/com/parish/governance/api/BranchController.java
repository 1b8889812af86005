package com.parish.governance.api;

import com.parish.governance.api.dto.CreateBranchRequest;
import com.parish.governance.api.dto.UpdateBranchRequest;
import com.parish.governance.domain.model.Branch;
import com.parish.governance.domain.services.BranchService;
import com.parish.governance.infrastructure.web.RequiresPermissions;
import com.parish.governance.infrastructure.web.TenantScoped;
import com.parish.security.Permissions;
import com.parish.security.SecurityContext;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/branches")
@TenantScoped
public class BranchController {

    private final BranchService branchService;

    public BranchController(BranchService branchService) {
        this.branchService = branchService;
    }

    @GetMapping
    public List<Branch> list(SecurityContext context,
                             @RequestParam(defaultValue = "false") boolean includeArchived,
                             @RequestParam(required = false) String branchId) {
        return branchService.list(context, includeArchived, branchId);
    }

    @GetMapping("/{branchId}")
    public Branch get(SecurityContext context, @PathVariable String branchId) {
        return branchService.get(context, branchId);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @RequiresPermissions(Permissions.BRANCHES_MANAGE)
    public Branch create(SecurityContext context, @Valid @RequestBody CreateBranchRequest request) {
        return branchService.create(context, request.name(), request.location());
    }

    @PatchMapping("/{branchId}")
    @RequiresPermissions(Permissions.BRANCHES_MANAGE)
    public Branch update(SecurityContext context, @PathVariable String branchId,
                         @Valid @RequestBody UpdateBranchRequest request) {
        return branchService.update(context, branchId, request.name(), request.location());
    }

    @PostMapping("/{branchId}/archive")
    @RequiresPermissions(Permissions.BRANCHES_MANAGE)
    public Branch archive(SecurityContext context, @PathVariable String branchId) {
        return branchService.archive(context, branchId);
    }

    @PostMapping("/{branchId}/unarchive")
    @RequiresPermissions(Permissions.BRANCHES_MANAGE)
    public Branch unarchive(SecurityContext context, @PathVariable String branchId) {
        return branchService.unarchive(context, branchId);
    }
}
