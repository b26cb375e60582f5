package com.ihome.passport.user;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * 用户记录读写。
 * <p>
 * 手机号与用户名在库中唯一，重复插入时由 Spring 转换为 {@link org.springframework.dao.DuplicateKeyException}。
 */
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserMapper userMapper;

    @Transactional(readOnly = true)
    public Optional<User> findByMobile(String mobile) {
        return Optional.ofNullable(userMapper.findByMobile(mobile));
    }

    @Transactional
    public User createUser(User user) {
        Instant now = Instant.now();
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        userMapper.insert(user);
        return user;
    }
}
