package com.ihome.passport.session;

import java.util.Optional;

/**
 * 请求级会话视图。
 * <p>
 * 会话的创建与过期由传输层负责，这里只暴露读写字段、清空与更换会话标识。
 */
public interface SessionContext {

    Optional<Object> get(String name);

    void put(String name, Object value);

    /**
     * 清空全部会话数据；会话不存在时不做任何事。
     */
    void clear();

    /**
     * 确保会话存在并更换其标识，返回新的会话标识。
     */
    String renew();
}
