package com.example.admission;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.util.UrlPathHelper;

import java.security.Principal;

/**
 * HttpServletRequest から AdmissionRequest を作る。
 * principal は認証レイヤ (Spring Security 等) が検証済みのものをそのまま使う。
 */
final class ServletAdmissionRequests {

    private static final UrlPathHelper PATH_HELPER = new UrlPathHelper();

    private ServletAdmissionRequests() {}

    static AdmissionRequest from(HttpServletRequest request, String forwardedHeader) {
        String path = PATH_HELPER.getPathWithinApplication(request);
        String forwarded = (forwardedHeader == null || forwardedHeader.isBlank())
                ? null
                : request.getHeader(forwardedHeader);
        Principal principal = request.getUserPrincipal();
        String principalId = (principal != null) ? principal.getName() : null;
        return new AdmissionRequest(path, request.getRemoteAddr(), forwarded, principalId);
    }
}
