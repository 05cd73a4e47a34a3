package com.qrwallet.security;

import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.error.WalletException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.preauth.PreAuthenticatedAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Access to the authenticated caller and the hashed client address of the current request.
 */
@Component
public class CallerContext {

    /**
     * @throws WalletException AUTH_UNAUTHENTICATED if the request carries no caller identity
     */
    public String requireUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (!(authentication instanceof PreAuthenticatedAuthenticationToken)
                || !(authentication.getPrincipal() instanceof String userId)) {
            throw WalletException.of(ErrorCode.AUTH_UNAUTHENTICATED);
        }
        return userId;
    }

    public String ipHash() {
        if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attributes) {
            HttpServletRequest request = attributes.getRequest();
            return ClientIpHasher.hash(request.getHeader("X-Forwarded-For"));
        }
        return ClientIpHasher.hash(null);
    }
}
