package com.edtech.auth.audit;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;

@Mapper
public interface LoginLogMapper {

    void insert(LoginLog log);

    int deleteBefore(@Param("before") Instant before);
}
