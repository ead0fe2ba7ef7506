package com.holesforpoles.auth.security;

import com.holesforpoles.auth.entity.User;
import com.holesforpoles.auth.exception.AuthException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Authenticates requests that carry a bearer token.
 *
 * A valid token puts the resolved {@link User} into the security context as
 * the principal. A rejected token leaves the request anonymous and records
 * the reason under {@link #AUTH_FAILURE_ATTRIBUTE}; public endpoints still
 * work, protected ones are answered by {@link RestAuthenticationEntryPoint}.
 *
 * Not a Spring bean, so it only runs inside the security filter chain.
 */
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String AUTH_FAILURE_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".FAILURE";

    static final String ROLE_USER = "ROLE_USER";
    static final String ROLE_SUPERUSER = "ROLE_SUPERUSER";

    private final AuthorizationGuard authorizationGuard;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        Optional<String> token = BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token.isPresent()) {
            try {
                User user = authorizationGuard.resolve(token.get());
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(user, null, authoritiesOf(user));
                SecurityContext context = SecurityContextHolder.createEmptyContext();
                context.setAuthentication(authentication);
                SecurityContextHolder.setContext(context);
            } catch (AuthException e) {
                SecurityContextHolder.clearContext();
                request.setAttribute(AUTH_FAILURE_ATTRIBUTE, e);
            }
        }
        filterChain.doFilter(request, response);
    }

    static List<GrantedAuthority> authoritiesOf(User user) {
        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority(ROLE_USER));
        if (user.isSuperuser()) {
            authorities.add(new SimpleGrantedAuthority(ROLE_SUPERUSER));
        }
        return authorities;
    }
}
