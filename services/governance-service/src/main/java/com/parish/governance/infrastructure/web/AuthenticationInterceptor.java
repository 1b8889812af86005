package com.parish.governance.infrastructure.web;

import com.parish.observability.CorrelationContextHolder;
import com.parish.security.PermissionAuthorizer;
import com.parish.security.SecurityContext;
import com.parish.security.SessionResolver;
import com.parish.security.TenantIsolationEnforcer;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.lang.annotation.Annotation;
import java.util.Set;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Resolves the session of every {@code /api/**} request before its handler runs.
 *
 * <ol>
 *   <li>{@code Authorization} header, via {@link SessionResolver}, to a {@link SecurityContext}
 *       attached to the request;
 *   <li>tenant and user written into the correlation context (and so into the MDC);
 *   <li>{@link TenantScoped} / {@link PlatformAdminOnly} gate;
 *   <li>{@link RequiresPermissions} through {@link PermissionAuthorizer}.
 * </ol>
 *
 * <p>Failures are thrown as access-control exceptions and rendered by
 * {@link GlobalExceptionHandler}.
 */
@Component
public class AuthenticationInterceptor implements HandlerInterceptor {

    private final SessionResolver sessionResolver;

    public AuthenticationInterceptor(SessionResolver sessionResolver) {
        this.sessionResolver = sessionResolver;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }

        SecurityContext context = sessionResolver.resolveAuthorizationHeader(
                request.getHeader(HttpHeaders.AUTHORIZATION));
        RequestSecurityContext.attach(request, context);
        CorrelationContextHolder.enrich(context.tenantId(), context.principalId(), context.kind().name());

        if (find(handlerMethod, PlatformAdminOnly.class) != null) {
            TenantIsolationEnforcer.requirePlatformAdmin(context);
        } else if (find(handlerMethod, TenantScoped.class) != null) {
            TenantIsolationEnforcer.requireTenant(context);
        }

        RequiresPermissions permissions = find(handlerMethod, RequiresPermissions.class);
        if (permissions != null) {
            PermissionAuthorizer.authorize(context, Set.of(permissions.value()));
        }
        return true;
    }

    private static <A extends Annotation> A find(HandlerMethod handlerMethod, Class<A> type) {
        A onMethod = AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getMethod(), type);
        if (onMethod != null) {
            return onMethod;
        }
        return AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), type);
    }
}
