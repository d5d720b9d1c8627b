package com.example.streampanel.infrastructure.persistence.mapper;

import com.example.streampanel.infrastructure.persistence.entity.AccountEntity;
import java.time.LocalDateTime;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface AccountMapper {

    @Select("SELECT id, username, email, password_hash, role, status, max_connections, expires_at, "
            + "last_login, created_at, updated_at FROM users WHERE username = #{login} OR email = #{login} LIMIT 1")
    AccountEntity selectByLogin(@Param("login") String login);

    @Select("SELECT id, username, email, password_hash, role, status, max_connections, expires_at, "
            + "last_login, created_at, updated_at FROM users WHERE id = #{id}")
    AccountEntity selectById(@Param("id") Long id);

    /**
     * Locks the account row until the surrounding transaction ends. Admission holds this
     * lock across its count-then-insert step so concurrent starts for one account serialize
     * even when they land on different instances.
     */
    @Select("SELECT id, username, email, password_hash, role, status, max_connections, expires_at, "
            + "last_login, created_at, updated_at FROM users WHERE id = #{id} FOR UPDATE")
    AccountEntity selectByIdForUpdate(@Param("id") Long id);

    @Update("UPDATE users SET last_login = #{lastLogin} WHERE id = #{id}")
    int updateLastLogin(@Param("id") Long id, @Param("lastLogin") LocalDateTime lastLogin);
}
