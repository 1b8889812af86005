package com.parish.governance.api;

import com.parish.governance.api.dto.RequestValues;
import com.parish.governance.api.dto.UpdateStatusRequest;
import com.parish.governance.api.dto.UpdateUserRoleRequest;
import com.parish.governance.domain.model.PageRequest;
import com.parish.governance.domain.model.PageResult;
import com.parish.governance.domain.model.TenantUser;
import com.parish.governance.domain.model.UserQuery;
import com.parish.governance.domain.services.UserService;
import com.parish.governance.infrastructure.web.PlatformAdminOnly;
import com.parish.security.SecurityContext;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Cross-tenant user support operations for platform administrators.
 */
@RestController
@RequestMapping("/api/v1/platform/users")
@PlatformAdminOnly
public class PlatformUserController {

    private final UserService userService;

    public PlatformUserController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping
    public PageResult<TenantUser> list(@RequestParam(required = false) Integer page,
                                       @RequestParam(required = false) Integer limit,
                                       @RequestParam(required = false) String tenantId,
                                       @RequestParam(required = false) String status,
                                       @RequestParam(required = false) String roleId,
                                       @RequestParam(required = false) String search) {
        String tenant = tenantId == null || tenantId.isBlank() ? null : tenantId.strip();
        return userService.platformList(
                new UserQuery(tenant, RequestValues.userStatus(status), roleId, search),
                PageRequest.of(page, limit));
    }

    @GetMapping("/{userId}")
    public TenantUser get(@PathVariable String userId) {
        return userService.platformGet(userId);
    }

    @PatchMapping("/{userId}/status")
    public TenantUser updateStatus(SecurityContext context, @PathVariable String userId,
                                   @Valid @RequestBody UpdateStatusRequest request) {
        return userService.platformUpdateStatus(context, userId, RequestValues.userStatus(request.status()));
    }

    @PatchMapping("/{userId}/role")
    public TenantUser updateRole(SecurityContext context, @PathVariable String userId,
                                 @Valid @RequestBody UpdateUserRoleRequest request) {
        return userService.platformUpdateRole(context, userId, request.roleId());
    }

    @PostMapping("/{userId}/reset-access")
    public TenantUser resetAccess(SecurityContext context, @PathVariable String userId) {
        return userService.platformResetAccess(context, userId);
    }
}
