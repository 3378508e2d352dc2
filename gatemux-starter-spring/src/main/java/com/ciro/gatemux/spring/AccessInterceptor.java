package com.ciro.gatemux.spring;

import com.ciro.gatemux.spi.AccessPolicy;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;

/** 401 JSON para lo que {@link AccessPolicy} no deja pasar. */
public class AccessInterceptor implements HandlerInterceptor {

    static final String UNAUTHORIZED_BODY = "{\"ok\":false,\"error\":\"Unauthorized\"}";

    private final AccessPolicy access;

    public AccessInterceptor(AccessPolicy access) {
        this.access = access;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        String token = presentedToken(request.getHeader("Authorization"), request.getHeader("Cookie"));
        if (access.permits(token)) return true;

        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(UNAUTHORIZED_BODY);
        return false;
    }

    /** Bearer primero, luego la cookie {@link AccessPolicy#COOKIE_NAME}. */
    static String presentedToken(String authorization, String cookieHeader) {
        String bearer = AccessPolicy.bearer(authorization);
        if (bearer != null) return bearer;
        if (cookieHeader == null) return null;
        for (String part : cookieHeader.split(";")) {
            String s = part.trim();
            int idx = s.indexOf('=');
            if (idx > 0 && AccessPolicy.COOKIE_NAME.equals(s.substring(0, idx).trim())) {
                return s.substring(idx + 1).trim();
            }
        }
        return null;
    }
}
