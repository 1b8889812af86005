package com.parish.governance.infrastructure.web;

import com.parish.security.SecurityContext;
import com.parish.security.UnauthenticatedException;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Access to the {@link SecurityContext} the {@link AuthenticationInterceptor} attached to
 * the current request.
 */
public final class RequestSecurityContext {

    public static final String ATTRIBUTE = RequestSecurityContext.class.getName() + ".CONTEXT";

    private RequestSecurityContext() {
        // utility class
    }

    static void attach(HttpServletRequest request, SecurityContext context) {
        request.setAttribute(ATTRIBUTE, context);
    }

    /**
     * @throws UnauthenticatedException if the request was not authenticated
     */
    public static SecurityContext require(HttpServletRequest request) {
        Object context = request.getAttribute(ATTRIBUTE);
        if (context instanceof SecurityContext securityContext) {
            return securityContext;
        }
        throw new UnauthenticatedException("No security context on request");
    }
}
