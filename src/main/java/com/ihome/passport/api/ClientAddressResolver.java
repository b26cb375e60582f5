package com.ihome.passport.api;

import com.ihome.passport.config.AuthProperties;
import com.ihome.passport.model.ClientInfo;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * 解析请求来源。
 * <p>
 * 默认只使用连接的远端地址；部署在可信反向代理之后时开启 `auth.login.trust-forwarded-headers`，
 * 才会读取 `X-Forwarded-For` / `X-Real-IP`，否则客户端可伪造请求头绕过登录失败计数。
 */
@Component
public class ClientAddressResolver {

    private final AuthProperties properties;

    public ClientAddressResolver(AuthProperties properties) {
        this.properties = properties;
    }

    public ClientInfo resolve(HttpServletRequest request) {
        return new ClientInfo(extractClientIp(request), request.getHeader("User-Agent"));
    }

    private String extractClientIp(HttpServletRequest request) {
        if (properties.getLogin().isTrustForwardedHeaders()) {
            String forwarded = request.getHeader("X-Forwarded-For");
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.split(",")[0].trim();
            }
            String realIp = request.getHeader("X-Real-IP");
            if (realIp != null && !realIp.isBlank()) {
                return realIp.trim();
            }
        }
        return request.getRemoteAddr();
    }
}
