package com.encarbot.db;

import com.encarbot.model.ClosureReason;
import com.encarbot.model.LeaseTerms;
import com.encarbot.model.Listing;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of {@link ListingStore}. One connection per call; the only
 * multi-statement operation, {@link #claimTrulyNew}, runs in its own transaction.
 */
public final class ListingDao implements ListingStore {
    private static final String COLUMNS = "car_id, title, model, badge, year, mileage, price, true_price, is_lease, "
            + "lease_deposit, lease_monthly_payment, lease_term_months, lease_total_monthly_cost, "
            + "lease_final_payment, lease_vehicle_price, views, registration_date, days_since_registration, "
            + "listing_url, is_coupe, is_truly_new, first_seen, last_updated, is_closed, closure_detected_at, closure_type";

    private static final String UPSERT_SQL = "INSERT INTO listings(" + COLUMNS + ") "
            + "VALUES(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
            + "ON CONFLICT(car_id) DO UPDATE SET "
            + "title=excluded.title, model=excluded.model, badge=excluded.badge, year=excluded.year, "
            + "mileage=excluded.mileage, price=excluded.price, true_price=excluded.true_price, "
            + "is_lease=excluded.is_lease, lease_deposit=excluded.lease_deposit, "
            + "lease_monthly_payment=excluded.lease_monthly_payment, lease_term_months=excluded.lease_term_months, "
            + "lease_total_monthly_cost=excluded.lease_total_monthly_cost, "
            + "lease_final_payment=excluded.lease_final_payment, lease_vehicle_price=excluded.lease_vehicle_price, "
            + "views=excluded.views, registration_date=excluded.registration_date, "
            + "days_since_registration=excluded.days_since_registration, listing_url=excluded.listing_url, "
            + "is_coupe=excluded.is_coupe, is_truly_new=excluded.is_truly_new, last_updated=excluded.last_updated, "
            + "is_closed=CASE WHEN listings.is_closed=1 THEN 1 ELSE excluded.is_closed END, "
            + "closure_detected_at=COALESCE(listings.closure_detected_at, excluded.closure_detected_at), "
            + "closure_type=COALESCE(listings.closure_type, excluded.closure_type)";

    private final Database database;

    public ListingDao(Database database) {
        this.database = database;
    }

    @Override
    public Optional<Listing> find(String id) throws PersistenceException {
        String sql = "SELECT " + COLUMNS + " FROM listings WHERE car_id = ?";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(readListing(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw readFailed("find " + id, e);
        }
    }

    @Override
    public void upsert(Listing listing) throws PersistenceException {
        if (listing == null || listing.getId() == null || listing.getId().isBlank()) {
            throw new PersistenceException(PersistenceException.Kind.WRITE_FAILED, "listing without id");
        }
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            bindListing(ps, listing);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException(PersistenceException.Kind.WRITE_FAILED, "upsert " + listing.getId(), e);
        }
    }

    @Override
    public boolean isEmpty() throws PersistenceException {
        return count() == 0;
    }

    @Override
    public int count() throws PersistenceException {
        return countWhere("1=1", null);
    }

    @Override
    public List<Listing> findActiveForClosureScan(Instant firstSeenBefore, int limit) throws PersistenceException {
        String sql = "SELECT " + COLUMNS + " FROM listings WHERE is_closed = 0 AND first_seen <= ? "
                + "ORDER BY last_updated ASC, car_id ASC LIMIT ?";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, Timestamps.format(firstSeenBefore));
            ps.setInt(2, Math.max(0, limit));
            return readAll(ps);
        } catch (SQLException e) {
            throw readFailed("active listings for closure scan", e);
        }
    }

    @Override
    public boolean markClosed(String id, ClosureReason reason, Instant detectedAt) throws PersistenceException {
        String sql = "UPDATE listings SET is_closed = 1, closure_detected_at = ?, closure_type = ? "
                + "WHERE car_id = ? AND is_closed = 0";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, Timestamps.format(detectedAt));
            ps.setString(2, reason == null ? null : reason.label());
            ps.setString(3, id);
            if (ps.executeUpdate() > 0) {
                return true;
            }
        } catch (SQLException e) {
            throw new PersistenceException(PersistenceException.Kind.WRITE_FAILED, "mark closed " + id, e);
        }
        if (find(id).isEmpty()) {
            throw new PersistenceException(PersistenceException.Kind.NOT_FOUND, "listing " + id);
        }
        return false;
    }

    @Override
    public List<Listing> claimTrulyNew(Instant firstSeenSince) throws PersistenceException {
        String select = "SELECT " + COLUMNS + " FROM listings "
                + "WHERE is_truly_new = 1 AND is_coupe = 1 AND is_closed = 0 AND first_seen >= ? "
                + "ORDER BY first_seen DESC, car_id ASC";
        String clear = "UPDATE listings SET is_truly_new = 0 WHERE car_id = ?";
        try (Connection conn = database.connect()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                List<Listing> claimed;
                try (PreparedStatement ps = conn.prepareStatement(select)) {
                    ps.setString(1, Timestamps.format(firstSeenSince));
                    claimed = readAll(ps);
                }
                if (!claimed.isEmpty()) {
                    try (PreparedStatement ps = conn.prepareStatement(clear)) {
                        for (Listing listing : claimed) {
                            ps.setString(1, listing.getId());
                            ps.addBatch();
                        }
                        ps.executeBatch();
                    }
                }
                conn.commit();
                for (Listing listing : claimed) {
                    listing.setTrulyNew(false);
                }
                return claimed;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new PersistenceException(PersistenceException.Kind.WRITE_FAILED, "claim truly-new listings", e);
        }
    }

    @Override
    public List<Listing> findFirstSeenSince(Instant since) throws PersistenceException {
        String sql = "SELECT " + COLUMNS + " FROM listings WHERE first_seen >= ? ORDER BY first_seen DESC, car_id ASC";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, Timestamps.format(since));
            return readAll(ps);
        } catch (SQLException e) {
            throw readFailed("listings first seen since " + since, e);
        }
    }

    @Override
    public int deleteNotUpdatedSince(Instant horizon) throws PersistenceException {
        String sql = "DELETE FROM listings WHERE last_updated < ?";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, Timestamps.format(horizon));
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException(PersistenceException.Kind.WRITE_FAILED, "cleanup before " + horizon, e);
        }
    }

    @Override
    public StoreStatistics statistics(Instant now) throws PersistenceException {
        int total = count();
        int closed = countWhere("is_closed = 1", null);
        int coupe = countWhere("is_coupe = 1 AND is_closed = 0", null);
        int lease = countWhere("is_lease = 1 AND is_closed = 0", null);
        int trulyNew = countWhere("is_truly_new = 1", null);
        int recent = countWhere("first_seen >= ?", Timestamps.format(now.minus(Duration.ofHours(24))));

        Map<String, Integer> byReason = new LinkedHashMap<>();
        String sql = "SELECT closure_type, COUNT(*) FROM listings WHERE is_closed = 1 "
                + "GROUP BY closure_type ORDER BY closure_type";
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String reason = rs.getString(1);
                byReason.put(reason == null ? "unknown" : reason, rs.getInt(2));
            }
        } catch (SQLException e) {
            throw readFailed("closure statistics", e);
        }
        return new StoreStatistics(total, total - closed, closed, coupe, lease, trulyNew, recent, byReason);
    }

    private int countWhere(String where, String param) throws PersistenceException {
        String sql = "SELECT COUNT(*) FROM listings WHERE " + where;
        try (Connection conn = database.connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            if (param != null) {
                ps.setString(1, param);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw readFailed("count " + where, e);
        }
    }

    private List<Listing> readAll(PreparedStatement ps) throws SQLException {
        List<Listing> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(readListing(rs));
            }
        }
        return out;
    }

    private void bindListing(PreparedStatement ps, Listing listing) throws SQLException {
        LeaseTerms lease = listing.getLeaseTerms() == null ? LeaseTerms.empty() : listing.getLeaseTerms();
        int i = 1;
        ps.setString(i++, listing.getId());
        ps.setString(i++, listing.getTitle());
        ps.setString(i++, listing.getModel());
        ps.setString(i++, listing.getBadge());
        setNullableInt(ps, i++, listing.getYear());
        setNullableInt(ps, i++, listing.getMileage());
        ps.setDouble(i++, listing.getListedPrice());
        ps.setDouble(i++, listing.getTrueCost());
        ps.setInt(i++, listing.isLease() ? 1 : 0);
        setNullableDouble(ps, i++, lease.deposit());
        setNullableDouble(ps, i++, lease.monthlyPayment());
        setNullableInt(ps, i++, lease.termMonths());
        setNullableDouble(ps, i++, lease.totalMonthlyCost());
        setNullableDouble(ps, i++, lease.finalPayment());
        setNullableDouble(ps, i++, lease.vehiclePrice());
        ps.setInt(i++, Math.max(0, listing.getViewCount()));
        ps.setString(i++, listing.getRegistrationDate());
        setNullableInt(ps, i++, listing.getDaysSinceRegistration());
        ps.setString(i++, listing.getListingUrl());
        ps.setInt(i++, listing.isCoupe() ? 1 : 0);
        ps.setInt(i++, listing.isTrulyNew() ? 1 : 0);
        Instant firstSeen = listing.getFirstSeenAt() == null ? Instant.now() : listing.getFirstSeenAt();
        Instant lastUpdated = listing.getLastUpdatedAt() == null ? firstSeen : listing.getLastUpdatedAt();
        ps.setString(i++, Timestamps.format(firstSeen));
        ps.setString(i++, Timestamps.format(lastUpdated));
        ps.setInt(i++, listing.isClosed() ? 1 : 0);
        ps.setString(i++, Timestamps.format(listing.getClosureDetectedAt()));
        ps.setString(i, listing.getClosureReason() == null ? null : listing.getClosureReason().label());
    }

    private Listing readListing(ResultSet rs) throws SQLException {
        LeaseTerms lease = new LeaseTerms(
                nullableDouble(rs, "lease_deposit"),
                nullableDouble(rs, "lease_monthly_payment"),
                nullableInt(rs, "lease_term_months"),
                nullableDouble(rs, "lease_final_payment"),
                nullableDouble(rs, "lease_vehicle_price")
        );
        return Listing.builder()
                .id(rs.getString("car_id"))
                .title(rs.getString("title"))
                .model(rs.getString("model"))
                .badge(rs.getString("badge"))
                .year(nullableInt(rs, "year"))
                .mileage(nullableInt(rs, "mileage"))
                .listedPrice(rs.getDouble("price"))
                .trueCost(rs.getDouble("true_price"))
                .lease(rs.getInt("is_lease") == 1)
                .leaseTerms(lease.hasAnyComponent() ? lease : null)
                .viewCount(rs.getInt("views"))
                .registrationDate(rs.getString("registration_date"))
                .daysSinceRegistration(nullableInt(rs, "days_since_registration"))
                .listingUrl(rs.getString("listing_url"))
                .coupe(rs.getInt("is_coupe") == 1)
                .trulyNew(rs.getInt("is_truly_new") == 1)
                .firstSeenAt(Timestamps.parse(rs.getString("first_seen")))
                .lastUpdatedAt(Timestamps.parse(rs.getString("last_updated")))
                .closed(rs.getInt("is_closed") == 1)
                .closureDetectedAt(Timestamps.parse(rs.getString("closure_detected_at")))
                .closureReason(ClosureReason.fromLabel(rs.getString("closure_type")).orElse(null))
                .build();
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private static void setNullableDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.DOUBLE);
        } else {
            ps.setDouble(index, value);
        }
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static PersistenceException readFailed(String what, SQLException e) {
        return new PersistenceException(PersistenceException.Kind.READ_FAILED, what, e);
    }
}
