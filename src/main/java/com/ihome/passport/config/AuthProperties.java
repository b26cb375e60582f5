package com.ihome.passport.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    private final Verification verification = new Verification();
    private final Login login = new Login();
    private final Identity identity = new Identity();
    private final Password password = new Password();
    private final Store store = new Store();

    @Data
    public static class Verification {
        /**
         * 验证码有效期，由外部发送方写入时使用。
         */
        private Duration ttl = Duration.ofMinutes(5);
        private String keyPrefix = "sms_code_";
    }

    @Data
    public static class Login {
        private int maxAttempts = 5;
        private Duration forbidWindow = Duration.ofMinutes(10);
        private String keyPrefix = "access_nums_";
        private boolean trustForwardedHeaders = false;
    }

    @Data
    public static class Identity {
        private String pattern = "^1[345678]\\d{9}$";
    }

    @Data
    public static class Password {
        private int bcryptStrength = 10;
    }

    @Data
    public static class Store {
        /**
         * redis 或 memory。
         */
        private String type = "redis";
    }
}
