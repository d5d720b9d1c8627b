package com.example.streampanel.infrastructure.persistence.mapper;

import com.example.streampanel.infrastructure.persistence.entity.ChannelEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface ChannelMapper {

    @Select("SELECT id, name, stream_url, stream_type, quality, status FROM channels "
            + "WHERE id = #{id} AND status = 'active'")
    ChannelEntity selectActiveById(@Param("id") Long id);
}
