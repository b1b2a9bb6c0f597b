package com.eventwatch.autoconfigure;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves the authenticated user id for a request, or {@code null} when
 * the request is anonymous.
 */
@FunctionalInterface
public interface PrincipalResolver {

    String resolveUserId(HttpServletRequest request);
}
