package com.ihome.passport.session;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;

import java.util.Collections;
import java.util.Optional;

/**
 * 基于 Servlet {@link HttpSession} 的会话视图。只读操作不会创建会话。
 */
public class HttpSessionContext implements SessionContext {

    private final HttpServletRequest request;

    public HttpSessionContext(HttpServletRequest request) {
        this.request = request;
    }

    @Override
    public Optional<Object> get(String name) {
        HttpSession session = request.getSession(false);
        if (session == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(session.getAttribute(name));
    }

    @Override
    public void put(String name, Object value) {
        request.getSession(true).setAttribute(name, value);
    }

    @Override
    public void clear() {
        HttpSession session = request.getSession(false);
        if (session == null) {
            return;
        }
        for (String name : Collections.list(session.getAttributeNames())) {
            session.removeAttribute(name);
        }
    }

    @Override
    public String renew() {
        request.getSession(true);
        return request.changeSessionId();
    }
}
