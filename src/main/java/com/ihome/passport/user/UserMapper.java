package com.ihome.passport.user;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface UserMapper {

    User findByMobile(@Param("mobile") String mobile);

    void insert(User user);
}
