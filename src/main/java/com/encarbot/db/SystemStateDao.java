package com.encarbot.db;

import com.encarbot.db.mybatis.MyBatisSupport;
import com.encarbot.db.mybatis.SystemStateMapper;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

/**
 * Key/value state that must survive restarts, such as the last run time of each cycle.
 */
public final class SystemStateDao {
    private final Database database;

    public SystemStateDao(Database database) {
        this.database = database;
    }

    public Optional<String> get(String key) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return Optional.ofNullable(session.getMapper(SystemStateMapper.class).selectValue(key));
        }
    }

    public Optional<Instant> getInstant(String key) throws SQLException {
        return get(key).map(Timestamps::parse);
    }

    public void put(String key, String value) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            session.getMapper(SystemStateMapper.class).upsert(key, value, Timestamps.format(Instant.now()));
            session.commit();
        }
    }

    public void putInstant(String key, Instant value) throws SQLException {
        put(key, Timestamps.format(value));
    }

    public void delete(String key) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            session.getMapper(SystemStateMapper.class).delete(key);
            session.commit();
        }
    }
}
