package com.parish.governance.api;

import com.parish.governance.api.dto.CreateRoleRequest;
import com.parish.governance.api.dto.UpdateRoleRequest;
import com.parish.governance.domain.model.Role;
import com.parish.governance.domain.model.RoleSummary;
import com.parish.governance.domain.services.RoleService;
import com.parish.governance.infrastructure.web.RequiresPermissions;
import com.parish.governance.infrastructure.web.TenantScoped;
import com.parish.security.Permissions;
import com.parish.security.SecurityContext;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
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
@RequestMapping("/api/v1/roles")
@TenantScoped
public class RoleController {

    private final RoleService roleService;

    public RoleController(RoleService roleService) {
        this.roleService = roleService;
    }

    @GetMapping
    public List<RoleSummary> list(SecurityContext context) {
        return roleService.list(context);
    }

    @GetMapping("/permissions-catalog")
    public List<String> permissionsCatalog() {
        return Permissions.CATALOG;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @RequiresPermissions(Permissions.ROLES_MANAGE)
    public Role create(SecurityContext context, @Valid @RequestBody CreateRoleRequest request) {
        return roleService.create(context, request.name(), request.permissions());
    }

    @PatchMapping("/{roleId}")
    @RequiresPermissions(Permissions.ROLES_MANAGE)
    public Role update(SecurityContext context, @PathVariable String roleId,
                       @Valid @RequestBody UpdateRoleRequest request) {
        return roleService.update(context, roleId, request.name(), request.permissions());
    }

    @DeleteMapping("/{roleId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @RequiresPermissions(Permissions.ROLES_MANAGE)
    public void delete(SecurityContext context, @PathVariable String roleId,
                       @RequestParam(required = false) String reassignRoleId) {
        roleService.delete(context, roleId, reassignRoleId);
    }
}
