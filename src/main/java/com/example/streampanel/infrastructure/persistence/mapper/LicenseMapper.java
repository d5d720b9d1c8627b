package com.example.streampanel.infrastructure.persistence.mapper;

import com.example.streampanel.infrastructure.persistence.entity.LicenseEntity;
import java.time.LocalDateTime;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface LicenseMapper {

    @Select("SELECT id, license_key, customer_name, plan_type, status, max_connections, current_connections, "
            + "expires_at, last_used, created_at FROM licenses WHERE license_key = #{licenseKey}")
    LicenseEntity selectByKey(@Param("licenseKey") String licenseKey);

    /**
     * Takes one connection slot in a single statement. Returns 1 when the slot was taken,
     * 0 when the license is unknown, revoked, expired or full. A cap of 0 or null means
     * unlimited.
     */
    @Update("UPDATE licenses SET current_connections = current_connections + 1, last_used = #{now} "
            + "WHERE license_key = #{licenseKey} AND status = 'active' AND (expires_at IS NULL OR expires_at > #{now}) "
            + "AND (max_connections IS NULL OR max_connections = 0 OR current_connections < max_connections)")
    int tryAcquire(@Param("licenseKey") String licenseKey, @Param("now") LocalDateTime now);

    @Update("UPDATE licenses SET current_connections = current_connections - 1 "
            + "WHERE license_key = #{licenseKey} AND current_connections > 0")
    int release(@Param("licenseKey") String licenseKey);

    /**
     * Gives back one slot only while the counter stays above {@code floor}, the number of
     * slots held by open streams. Slots held by a live stream are released by its close.
     */
    @Update("UPDATE licenses SET current_connections = current_connections - 1 "
            + "WHERE license_key = #{licenseKey} AND current_connections > #{floor}")
    int releaseAbove(@Param("licenseKey") String licenseKey, @Param("floor") long floor);

    @Update("UPDATE licenses SET status = 'revoked' WHERE license_key = #{licenseKey}")
    int revoke(@Param("licenseKey") String licenseKey);

    @Update("UPDATE licenses SET current_connections = #{connections} WHERE license_key = #{licenseKey}")
    int resetConnections(@Param("licenseKey") String licenseKey, @Param("connections") int connections);
}
