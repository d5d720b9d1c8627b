package com.example.streampanel.infrastructure.persistence.mapper;

import com.example.streampanel.infrastructure.persistence.entity.UserSessionEntity;
import java.time.LocalDateTime;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface UserSessionMapper {

    @Insert("INSERT INTO user_sessions (user_id, session_token, ip_address, user_agent, created_at, expires_at) "
            + "VALUES (#{userId}, #{sessionToken}, #{ipAddress}, #{userAgent}, #{createdAt}, #{expiresAt})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(UserSessionEntity entity);

    @Select("SELECT id, user_id, session_token, ip_address, user_agent, created_at, expires_at "
            + "FROM user_sessions WHERE session_token = #{token} AND expires_at > #{now}")
    UserSessionEntity selectLiveByToken(@Param("token") String token, @Param("now") LocalDateTime now);

    @Delete("DELETE FROM user_sessions WHERE session_token = #{token}")
    int deleteByToken(@Param("token") String token);

    @Delete("DELETE FROM user_sessions WHERE user_id = #{userId}")
    int deleteByUserId(@Param("userId") Long userId);

    @Delete("DELETE FROM user_sessions WHERE expires_at <= #{now}")
    int deleteExpired(@Param("now") LocalDateTime now);
}
