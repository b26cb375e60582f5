package com.ihome.passport.model;

/**
 * 请求来源信息，`ip` 作为登录失败计数的客户端标识。
 */
public record ClientInfo(String ip, String userAgent) {
}
