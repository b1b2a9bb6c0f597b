package com.eventwatch.autoconfigure;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.security.Principal;

/**
 * Reads the user from Spring Security's context, falling back to the
 * container principal. Anonymous authentications do not count.
 */
public class SecurityContextPrincipalResolver implements PrincipalResolver {

    private static final Logger log = LoggerFactory.getLogger(SecurityContextPrincipalResolver.class);

    @Override
    public String resolveUserId(HttpServletRequest request) {
        try {
            Authentication auth = SecurityContextHolder.getContext().getAuthentication();
            if (auth != null && auth.isAuthenticated() && !(auth instanceof AnonymousAuthenticationToken)
                    && !"anonymousUser".equals(auth.getPrincipal())) {
                String name = auth.getName();
                if (name != null && !name.isBlank()) {
                    return name;
                }
            }
        } catch (RuntimeException e) {
            log.debug("[EventWatch] Could not read security context: {}", e.getMessage());
        }

        Principal principal = request.getUserPrincipal();
        if (principal != null && principal.getName() != null && !principal.getName().isBlank()) {
            return principal.getName();
        }
        return null;
    }
}
