package com.encarbot.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

public interface SystemStateMapper {
    @Select("SELECT state_value FROM system_state WHERE state_key = #{key}")
    String selectValue(@Param("key") String key);

    @Insert("INSERT INTO system_state(state_key, state_value, updated_at) VALUES(#{key}, #{value}, #{updatedAt}) " +
            "ON CONFLICT(state_key) DO UPDATE SET state_value=excluded.state_value, updated_at=excluded.updated_at")
    int upsert(
            @Param("key") String key,
            @Param("value") String value,
            @Param("updatedAt") String updatedAt
    );

    @Delete("DELETE FROM system_state WHERE state_key = #{key}")
    int delete(@Param("key") String key);
}
