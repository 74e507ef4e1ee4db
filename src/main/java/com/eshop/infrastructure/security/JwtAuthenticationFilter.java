package com.eshop.infrastructure.security;

import com.eshop.application.auth.AuthService;
import com.eshop.application.auth.AuthUser;
import com.eshop.common.exception.ErrorCode;
import com.eshop.common.exception.UnauthorizedException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * JwtAuthenticationFilter - Authorization: Bearer 토큰 인증
 *
 * 동작:
 * - 헤더가 없으면 익명 요청으로 통과 (보호된 경로는 이후 인가 단계에서 401)
 * - 헤더가 있는데 Bearer 형식이 아니거나 토큰이 잘못되면 즉시 401
 * - 성공하면 AuthUser를 principal로, ROLE_{역할}을 권한으로 SecurityContext에 저장
 */
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String ROLE_PREFIX = "ROLE_";

    private final AuthService authService;
    private final AuthenticationEntryPoint authenticationEntryPoint;
    private final WebAuthenticationDetailsSource detailsSource = new WebAuthenticationDetailsSource();

    public JwtAuthenticationFilter(AuthService authService, AuthenticationEntryPoint authenticationEntryPoint) {
        this.authService = authService;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(header)) {
            filterChain.doFilter(request, response);
            return;
        }

        try {
            AuthUser authUser = authService.authenticate(extractToken(header));
            UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                    authUser, null, List.of(new SimpleGrantedAuthority(ROLE_PREFIX + authUser.getRole().name())));
            authentication.setDetails(detailsSource.buildDetails(request));

            SecurityContext context = SecurityContextHolder.createEmptyContext();
            context.setAuthentication(authentication);
            SecurityContextHolder.setContext(context);
        } catch (UnauthorizedException e) {
            log.debug("[JwtAuthenticationFilter] 토큰 인증 실패 - uri={}, code={}",
                    request.getRequestURI(), e.getErrorCodeValue());
            SecurityContextHolder.clearContext();
            authenticationEntryPoint.commence(request, response, new BadCredentialsException(e.getMessage(), e));
            return;
        }

        filterChain.doFilter(request, response);
    }

    private static String extractToken(String header) {
        if (!header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw new UnauthorizedException(ErrorCode.INVALID_TOKEN);
        }
        return header.substring(BEARER_PREFIX.length()).trim();
    }
}
