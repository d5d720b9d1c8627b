package com.example.streampanel.infrastructure.persistence.mapper;

import com.example.streampanel.infrastructure.persistence.entity.StreamLogEntity;
import com.example.streampanel.infrastructure.persistence.model.UsageStatsRow;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface StreamLogMapper {

    @Insert("INSERT INTO stream_logs (user_id, channel_id, stream_url, ip_address, user_agent, license_key, "
            + "start_time, bytes_transferred) "
            + "VALUES (#{userId}, #{channelId}, #{streamUrl}, #{ipAddress}, #{userAgent}, #{licenseKey}, "
            + "#{startTime}, 0)")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(StreamLogEntity entity);

    @Select("SELECT id, user_id, channel_id, stream_url, ip_address, user_agent, license_key, start_time, "
            + "relay_started_at, relay_heartbeat_at, end_time, duration_sec, bytes_transferred, close_reason "
            + "FROM stream_logs WHERE id = #{id}")
    StreamLogEntity selectById(@Param("id") Long id);

    @Select("SELECT COUNT(*) FROM stream_logs WHERE user_id = #{userId} AND end_time IS NULL")
    long countActiveByUser(@Param("userId") Long userId);

    @Select("SELECT COUNT(*) FROM stream_logs WHERE license_key = #{licenseKey} AND end_time IS NULL")
    long countActiveByLicense(@Param("licenseKey") String licenseKey);

    @Select("SELECT id, user_id, channel_id, stream_url, ip_address, user_agent, license_key, start_time, "
            + "relay_started_at, relay_heartbeat_at, end_time, duration_sec, bytes_transferred, close_reason "
            + "FROM stream_logs WHERE user_id = #{userId} AND end_time IS NULL ORDER BY start_time DESC")
    List<StreamLogEntity> selectActiveByUser(@Param("userId") Long userId);

    /**
     * Admitted rows whose relay never started and whose play handle was issued before
     * {@code before}.
     */
    @Select("SELECT id, user_id, channel_id, stream_url, ip_address, user_agent, license_key, start_time, "
            + "relay_started_at, relay_heartbeat_at, end_time, duration_sec, bytes_transferred, close_reason "
            + "FROM stream_logs WHERE end_time IS NULL AND relay_started_at IS NULL AND start_time < #{before} "
            + "ORDER BY id LIMIT #{limit}")
    List<StreamLogEntity> selectUnclaimed(@Param("before") LocalDateTime before, @Param("limit") int limit);

    @Update("UPDATE stream_logs SET relay_started_at = #{now}, relay_heartbeat_at = #{now} "
            + "WHERE id = #{id} AND end_time IS NULL AND relay_started_at IS NULL")
    int markRelaying(@Param("id") Long id, @Param("now") LocalDateTime now);

    /**
     * Liveness mark from the instance relaying the row, with the bytes relayed so far.
     */
    @Update("UPDATE stream_logs SET relay_heartbeat_at = #{now}, bytes_transferred = #{bytesTransferred} "
            + "WHERE id = #{id} AND end_time IS NULL")
    int touchRelay(@Param("id") Long id,
                   @Param("now") LocalDateTime now,
                   @Param("bytesTransferred") long bytesTransferred);

    /**
     * Claimed rows still open whose relay has not been seen since {@code staleBefore}.
     */
    @Select("SELECT id, user_id, channel_id, stream_url, ip_address, user_agent, license_key, start_time, "
            + "relay_started_at, relay_heartbeat_at, end_time, duration_sec, bytes_transferred, close_reason "
            + "FROM stream_logs WHERE end_time IS NULL AND relay_started_at IS NOT NULL "
            + "AND COALESCE(relay_heartbeat_at, relay_started_at) < #{staleBefore} "
            + "ORDER BY id LIMIT #{limit}")
    List<StreamLogEntity> selectOrphaned(@Param("staleBefore") LocalDateTime staleBefore, @Param("limit") int limit);

    @Select("SELECT id, user_id, channel_id, stream_url, ip_address, user_agent, license_key, start_time, "
            + "relay_started_at, relay_heartbeat_at, end_time, duration_sec, bytes_transferred, close_reason "
            + "FROM stream_logs WHERE user_id = #{userId} AND end_time IS NOT NULL "
            + "ORDER BY start_time DESC, id DESC LIMIT #{limit} OFFSET #{offset}")
    List<StreamLogEntity> selectHistoryByUser(@Param("userId") Long userId,
                                              @Param("limit") int limit,
                                              @Param("offset") int offset);

    @Select("SELECT COUNT(*) FROM stream_logs WHERE user_id = #{userId} AND end_time IS NOT NULL")
    long countHistoryByUser(@Param("userId") Long userId);

    /**
     * Closes an active row. Returns 1 for the caller that performed the close, 0 when the
     * row was already closed.
     */
    @Update("UPDATE stream_logs SET end_time = #{endTime}, duration_sec = #{durationSec}, "
            + "bytes_transferred = #{bytesTransferred}, close_reason = #{closeReason} "
            + "WHERE id = #{id} AND end_time IS NULL")
    int close(@Param("id") Long id,
              @Param("endTime") LocalDateTime endTime,
              @Param("durationSec") long durationSec,
              @Param("bytesTransferred") long bytesTransferred,
              @Param("closeReason") String closeReason);

    /**
     * Same as {@link #close} but only while the relay has not started, so a reaper cannot
     * close a handle that was claimed after it was listed.
     */
    @Update("UPDATE stream_logs SET end_time = #{endTime}, duration_sec = #{durationSec}, "
            + "bytes_transferred = 0, close_reason = #{closeReason} "
            + "WHERE id = #{id} AND end_time IS NULL AND relay_started_at IS NULL")
    int closeUnclaimed(@Param("id") Long id,
                       @Param("endTime") LocalDateTime endTime,
                       @Param("durationSec") long durationSec,
                       @Param("closeReason") String closeReason);

    /**
     * Closes a claimed row only while its relay is still stale, so a heartbeat that lands
     * after the row was listed keeps it open. Bytes stay at the last heartbeat's value.
     */
    @Update("UPDATE stream_logs SET end_time = #{endTime}, duration_sec = #{durationSec}, "
            + "close_reason = #{closeReason} "
            + "WHERE id = #{id} AND end_time IS NULL AND relay_started_at IS NOT NULL "
            + "AND COALESCE(relay_heartbeat_at, relay_started_at) < #{staleBefore}")
    int closeOrphaned(@Param("id") Long id,
                      @Param("endTime") LocalDateTime endTime,
                      @Param("durationSec") long durationSec,
                      @Param("closeReason") String closeReason,
                      @Param("staleBefore") LocalDateTime staleBefore);

    @Select("SELECT COUNT(*) AS total_streams, "
            + "COALESCE(SUM(COALESCE(duration_sec, 0)), 0) AS total_duration_sec, "
            + "COALESCE(AVG(COALESCE(duration_sec, 0)), 0) AS avg_duration_sec, "
            + "COUNT(DISTINCT channel_id) AS unique_channels, "
            + "COALESCE(SUM(COALESCE(bytes_transferred, 0)), 0) AS total_bytes "
            + "FROM stream_logs WHERE user_id = #{userId} AND start_time >= #{since}")
    UsageStatsRow selectUsageStats(@Param("userId") Long userId, @Param("since") LocalDateTime since);
}
