package com.truledgr.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.truledgr.backend.modules.auth.application.AuthException;
import com.truledgr.backend.modules.auth.application.IdentityResolver;
import com.truledgr.backend.modules.auth.application.ResolvedIdentity;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String USER_ID_MDC_KEY = "userId";
    public static final String IMPERSONATOR_ID_MDC_KEY = "impersonatorId";

    private static final String BEARER_PREFIX = "Bearer ";
    // Admin checks belong to the services, which read the resolved identity itself
    private static final List<SimpleGrantedAuthority> AUTHORITIES = List.of(new SimpleGrantedAuthority("ROLE_USER"));

    private final IdentityResolver identityResolver;
    private final AuthenticationEntryPoint authenticationEntryPoint;

    public JwtAuthenticationFilter(IdentityResolver identityResolver, RestAuthenticationEntryPoint authenticationEntryPoint) {
        this.identityResolver = identityResolver;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        ResolvedIdentity identity;
        try {
            identity = identityResolver.resolve(token);
        } catch (AuthException ex) {
            SecurityContextHolder.clearContext();
            authenticationEntryPoint.commence(request, response, new BadCredentialsException(ex.getDetailMessage(), ex));
            return;
        }

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(identity, token, AUTHORITIES);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        MDC.put(USER_ID_MDC_KEY, identity.userId().toString());
        if (identity.impersonating()) {
            MDC.put(IMPERSONATOR_ID_MDC_KEY, identity.impersonation().adminUserId().toString());
        }
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(USER_ID_MDC_KEY);
            MDC.remove(IMPERSONATOR_ID_MDC_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        String path = request.getServletPath();
        return path.equals("/auth/login") || path.equals("/auth/refresh");
    }
}
