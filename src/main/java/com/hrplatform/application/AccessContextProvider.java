package com.hrplatform.application;

import com.hrplatform.infrastructure.security.AccessContext;
import com.hrplatform.infrastructure.security.AccessContextFactory;
import com.hrplatform.infrastructure.security.UserAttributes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;

import java.util.Optional;

/**
 * Provider of the current request's {@link AccessContext}.
 *
 * <p>Reads the stored user attributes from the JWT claims of Spring Security's authentication
 * and builds the context once per request. The result is cached as a request attribute, so it
 * never outlives the request that produced it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessContextProvider {

    static final String REQUEST_ATTRIBUTE = AccessContextProvider.class.getName() + ".CONTEXT";

    private final AccessContextFactory accessContextFactory;

    /**
     * Get the access context of the authenticated caller.
     *
     * @throws SecurityException if the request is not authenticated with a bearer token
     */
    public AccessContext getCurrentContext() {
        return findCurrentContext()
            .orElseThrow(() -> new SecurityException("No authenticated user"));
    }

    /**
     * Access context of the authenticated caller, empty for anonymous requests.
     */
    public Optional<AccessContext> findCurrentContext() {
        RequestAttributes requestAttributes = RequestContextHolder.getRequestAttributes();
        if (requestAttributes != null) {
            Object cached = requestAttributes.getAttribute(REQUEST_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
            if (cached instanceof AccessContext) {
                return Optional.of((AccessContext) cached);
            }
        }

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (!(authentication instanceof JwtAuthenticationToken) || !authentication.isAuthenticated()) {
            return Optional.empty();
        }

        JwtAuthenticationToken token = (JwtAuthenticationToken) authentication;
        AccessContext context = accessContextFactory.build(UserAttributes.fromClaims(token.getTokenAttributes()));
        log.debug("Built access context [{}]: user={}, role={}, scope={}",
            context.getRequestId(), context.getUserId(), context.getRole(), context.getDataScope());

        if (requestAttributes != null) {
            requestAttributes.setAttribute(REQUEST_ATTRIBUTE, context, RequestAttributes.SCOPE_REQUEST);
        }
        return Optional.of(context);
    }
}
