package com.encarbot.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface MonitoringLogMapper {
    @Insert("INSERT INTO monitoring_log(logged_at, action, details, new_listings_found, total_listings_scanned) " +
            "VALUES(#{loggedAt}, #{action}, #{details}, #{newListingsFound}, #{totalListingsScanned})")
    int insert(MonitoringLogRow row);

    @Select("SELECT id, logged_at, action, details, new_listings_found, total_listings_scanned " +
            "FROM monitoring_log ORDER BY logged_at DESC, id DESC LIMIT #{limit}")
    List<MonitoringLogRow> selectRecent(@Param("limit") int limit);

    @Select("SELECT id, logged_at, action, details, new_listings_found, total_listings_scanned " +
            "FROM monitoring_log WHERE action = #{action} ORDER BY logged_at DESC, id DESC LIMIT 1")
    MonitoringLogRow selectLatestByAction(@Param("action") String action);
}
