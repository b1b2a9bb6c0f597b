package com.eventwatch.autoconfigure;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Client address as seen through a reverse proxy: first
 * {@code X-Forwarded-For} entry, then {@code X-Real-IP}, then the socket peer.
 * The headers are taken at face value; deployments must strip them at the edge.
 */
public class ClientIpResolver {

    public String resolve(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",", 2)[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return request.getRemoteAddr();
    }
}
