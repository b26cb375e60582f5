package com.ihome.passport.session;

import com.ihome.passport.credential.AuthenticatedPrincipal;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * 登录态管理。
 * <p>
 * 会话中只保存三个字段：`name`（展示名）、`mobile`（登录手机号）、`user_id`。
 * 建立登录态时先清空旧数据并更换会话标识，防止会话固定攻击。
 */
@Component
public class SessionManager {

    public static final String ATTR_NAME = "name";
    public static final String ATTR_MOBILE = "mobile";
    public static final String ATTR_USER_ID = "user_id";

    public SessionToken establish(SessionContext context, AuthenticatedPrincipal principal) {
        context.clear();
        String sessionId = context.renew();
        context.put(ATTR_NAME, principal.displayName());
        context.put(ATTR_MOBILE, principal.identity());
        context.put(ATTR_USER_ID, principal.userId());
        return new SessionToken(sessionId, principal.displayName());
    }

    public Optional<SessionView> current(SessionContext context) {
        return context.get(ATTR_NAME)
                .map(Object::toString)
                .filter(StringUtils::hasText)
                .map(SessionView::new);
    }

    public void terminate(SessionContext context) {
        context.clear();
    }
}
