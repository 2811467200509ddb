package com.encarbot.db;

import com.encarbot.db.mybatis.MonitoringLogMapper;
import com.encarbot.db.mybatis.MonitoringLogRow;
import com.encarbot.db.mybatis.MyBatisSupport;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only record of finished cycles.
 */
public final class MonitoringLogDao {
    private final Database database;

    public MonitoringLogDao(Database database) {
        this.database = database;
    }

    public void append(Instant at, String action, String details, int newListings, int scanned) throws SQLException {
        MonitoringLogRow row = MonitoringLogRow.builder()
                .loggedAt(Timestamps.format(at == null ? Instant.now() : at))
                .action(action)
                .details(details)
                .newListingsFound(Math.max(0, newListings))
                .totalListingsScanned(Math.max(0, scanned))
                .build();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            session.getMapper(MonitoringLogMapper.class).insert(row);
            session.commit();
        }
    }

    public List<MonitoringLogRow> recent(int limit) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(MonitoringLogMapper.class).selectRecent(Math.max(1, limit));
        }
    }

    public Optional<MonitoringLogRow> latest(String action) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return Optional.ofNullable(session.getMapper(MonitoringLogMapper.class).selectLatestByAction(action));
        }
    }
}
