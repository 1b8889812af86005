package com.parish.governance.api;

import com.parish.governance.api.dto.InviteUserRequest;
import com.parish.governance.api.dto.RequestValues;
import com.parish.governance.api.dto.UpdateUserBranchesRequest;
import com.parish.governance.api.dto.UpdateUserRequest;
import com.parish.governance.api.dto.UpdateUserRoleRequest;
import com.parish.governance.domain.model.PageRequest;
import com.parish.governance.domain.model.PageResult;
import com.parish.governance.domain.model.TenantUser;
import com.parish.governance.domain.model.UserChanges;
import com.parish.governance.domain.model.UserInvitation;
import com.parish.governance.domain.services.UserService;
import com.parish.governance.infrastructure.web.RequiresPermissions;
import com.parish.governance.infrastructure.web.TenantScoped;
import com.parish.security.Permissions;
import com.parish.security.SecurityContext;
import jakarta.validation.Valid;
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
@RequestMapping("/api/v1/users")
@TenantScoped
@RequiresPermissions(Permissions.USERS_MANAGE)
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping
    public PageResult<TenantUser> list(SecurityContext context,
                                       @RequestParam(required = false) Integer page,
                                       @RequestParam(required = false) Integer limit,
                                       @RequestParam(required = false) String status,
                                       @RequestParam(required = false) String roleId,
                                       @RequestParam(required = false) String search) {
        return userService.list(context, RequestValues.userStatus(status), roleId, search,
                PageRequest.of(page, limit));
    }

    @GetMapping("/{userId}")
    public TenantUser get(SecurityContext context, @PathVariable String userId) {
        return userService.get(context, userId);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TenantUser invite(SecurityContext context, @Valid @RequestBody InviteUserRequest request) {
        return userService.invite(context, new UserInvitation(
                request.email(),
                request.name(),
                request.roleId(),
                RequestValues.branchScopeMode(request.branchScopeMode()),
                request.branchIds(),
                request.defaultBranchId()));
    }

    @PatchMapping("/{userId}")
    public TenantUser update(SecurityContext context, @PathVariable String userId,
                             @Valid @RequestBody UpdateUserRequest request) {
        return userService.update(context, userId, new UserChanges(
                request.name(),
                RequestValues.userStatus(request.status()),
                request.roleId(),
                RequestValues.branchScopeMode(request.branchScopeMode()),
                request.branchIds(),
                request.defaultBranchId()));
    }

    @PatchMapping("/{userId}/role")
    public TenantUser updateRole(SecurityContext context, @PathVariable String userId,
                                 @Valid @RequestBody UpdateUserRoleRequest request) {
        return userService.updateRole(context, userId, request.roleId());
    }

    @PatchMapping("/{userId}/branches")
    public TenantUser updateBranches(SecurityContext context, @PathVariable String userId,
                                     @Valid @RequestBody UpdateUserBranchesRequest request) {
        return userService.updateBranches(context, userId,
                RequestValues.branchScopeMode(request.branchScopeMode()),
                request.branchIds(),
                request.defaultBranchId());
    }

    @PostMapping("/{userId}/suspend")
    public TenantUser suspend(SecurityContext context, @PathVariable String userId) {
        return userService.suspend(context, userId);
    }

    @PostMapping("/{userId}/reactivate")
    public TenantUser reactivate(SecurityContext context, @PathVariable String userId) {
        return userService.reactivate(context, userId);
    }

    @PostMapping("/{userId}/resend-invite")
    public TenantUser resendInvite(SecurityContext context, @PathVariable String userId) {
        return userService.resendInvite(context, userId);
    }
}
