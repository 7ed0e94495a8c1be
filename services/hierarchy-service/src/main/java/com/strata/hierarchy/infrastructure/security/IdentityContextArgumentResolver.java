package com.strata.hierarchy.infrastructure.security;

import com.strata.hierarchy.domain.UnauthenticatedException;
import com.strata.observability.CorrelationContextHolder;
import com.strata.security.IdentityContext;
import java.util.LinkedHashMap;
import org.springframework.core.MethodParameter;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies controller methods with the caller's {@link IdentityContext}, built from the verified
 * JWT: {@code sub} becomes the identity id, the remaining claims are carried along.
 *
 * <p>Also adds the identity to the request's log context.
 */
@Component
public class IdentityContextArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return IdentityContext.class.equals(parameter.getParameterType());
    }

    @Override
    public IdentityContext resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest request,
            WebDataBinderFactory binderFactory) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (!(authentication instanceof JwtAuthenticationToken token)) {
            throw new UnauthenticatedException("Authentication required");
        }
        IdentityContext identity = fromJwt(token.getToken());
        CorrelationContextHolder.attachIdentity(identity.identityId());
        return identity;
    }

    static IdentityContext fromJwt(Jwt jwt) {
        var claims = new LinkedHashMap<String, Object>();
        jwt.getClaims()
                .forEach(
                        (name, value) -> {
                            if (value != null && !"sub".equals(name)) {
                                claims.put(name, value);
                            }
                        });
        return new IdentityContext(jwt.getSubject(), claims);
    }
}
