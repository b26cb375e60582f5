package com.ihome.passport.api;

import com.ihome.passport.config.AuthProperties;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class ClientAddressResolverTest {

    @Test
    void usesRemoteAddressByDefault() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("203.0.113.5");
        request.addHeader("X-Forwarded-For", "198.51.100.1");

        assertThat(new ClientAddressResolver(new AuthProperties()).resolve(request).ip()).isEqualTo("203.0.113.5");
    }

    @Test
    void honoursForwardedHeadersWhenTrusted() {
        AuthProperties properties = new AuthProperties();
        properties.getLogin().setTrustForwardedHeaders(true);
        ClientAddressResolver resolver = new ClientAddressResolver(properties);

        MockHttpServletRequest forwarded = new MockHttpServletRequest();
        forwarded.addHeader("X-Forwarded-For", "198.51.100.1, 10.0.0.2");
        assertThat(resolver.resolve(forwarded).ip()).isEqualTo("198.51.100.1");

        MockHttpServletRequest realIp = new MockHttpServletRequest();
        realIp.setRemoteAddr("10.0.0.2");
        realIp.addHeader("X-Real-IP", "198.51.100.9");
        realIp.addHeader("User-Agent", "curl/8");
        assertThat(resolver.resolve(realIp).ip()).isEqualTo("198.51.100.9");
        assertThat(resolver.resolve(realIp).userAgent()).isEqualTo("curl/8");
    }
}
