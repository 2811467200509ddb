package com.encarbot.db;

import com.encarbot.model.ClosureReason;
import com.encarbot.model.LeaseTerms;
import com.encarbot.model.Listing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ListingDaoTest {
    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private ListingDao dao;

    @BeforeEach
    void setUp() throws Exception {
        Database database = Database.sqliteFile(tempDir.resolve("listings.db"));
        new MigrationRunner().run(database);
        dao = new ListingDao(database);
    }

    @Test
    void upsertShouldRoundTripAllFields() throws Exception {
        Listing listing = listing("100", T0).toBuilder()
                .lease(true)
                .leaseTerms(new LeaseTerms(1801.0, 165.0, 26, 2301.0, 8825.0))
                .trueCost(8392.0)
                .registrationDate("2024/02/20")
                .daysSinceRegistration(10)
                .build();

        dao.upsert(listing);
        Listing stored = dao.find("100").orElseThrow();

        assertEquals("벤츠 GLE-클래스 GLE450 쿠페", stored.getTitle());
        assertEquals(2023, stored.getYear());
        assertEquals(8392.0, stored.getTrueCost(), 1e-9);
        assertTrue(stored.isLease());
        assertEquals(26, stored.getLeaseTerms().termMonths());
        assertEquals(4290.0, stored.getLeaseTerms().totalMonthlyCost(), 1e-9);
        assertEquals(T0, stored.getFirstSeenAt());
        assertEquals("2024/02/20", stored.getRegistrationDate());
        assertNull(stored.getClosureReason());
        assertTrue(dao.find("missing").isEmpty());
    }

    @Test
    void firstSeenShouldNeverChangeOnUpsert() throws Exception {
        dao.upsert(listing("101", T0));
        Listing later = listing("101", T0.plus(Duration.ofDays(3)));
        later.setListedPrice(7000.0);

        dao.upsert(later);
        Listing stored = dao.find("101").orElseThrow();

        assertEquals(T0, stored.getFirstSeenAt());
        assertEquals(T0.plus(Duration.ofDays(3)), stored.getLastUpdatedAt());
        assertEquals(7000.0, stored.getListedPrice(), 1e-9);
    }

    @Test
    void closedShouldStayClosedAcrossUpserts() throws Exception {
        dao.upsert(listing("102", T0));
        Instant detected = T0.plus(Duration.ofDays(2));

        assertTrue(dao.markClosed("102", ClosureReason.HTTP_404, detected));
        assertFalse(dao.markClosed("102", ClosureReason.ERROR_PAGE, detected.plusSeconds(60)));
        dao.upsert(listing("102", T0.plus(Duration.ofDays(3))));

        Listing stored = dao.find("102").orElseThrow();
        assertTrue(stored.isClosed());
        assertEquals(ClosureReason.HTTP_404, stored.getClosureReason());
        assertEquals(detected, stored.getClosureDetectedAt());
    }

    @Test
    void markClosedOnUnknownIdShouldReportNotFound() {
        PersistenceException e = assertThrows(PersistenceException.class,
                () -> dao.markClosed("nope", ClosureReason.HTTP_404, T0));

        assertEquals(PersistenceException.Kind.NOT_FOUND, e.kind());
    }

    @Test
    void claimTrulyNewShouldClearFlagsInOneShot() throws Exception {
        Listing fresh = listing("103", T0);
        fresh.setTrulyNew(true);
        Listing notCoupe = listing("104", T0);
        notCoupe.setTrulyNew(true);
        notCoupe.setCoupe(false);
        Listing old = listing("105", T0.minus(Duration.ofHours(1)));
        old.setTrulyNew(true);
        dao.upsert(fresh);
        dao.upsert(notCoupe);
        dao.upsert(old);

        List<Listing> first = dao.claimTrulyNew(T0.minus(Duration.ofMinutes(15)));
        List<Listing> second = dao.claimTrulyNew(T0.minus(Duration.ofMinutes(15)));

        assertEquals(1, first.size());
        assertEquals("103", first.get(0).getId());
        assertFalse(first.get(0).isTrulyNew());
        assertTrue(second.isEmpty());
        assertFalse(dao.find("103").orElseThrow().isTrulyNew());
        assertTrue(dao.find("105").orElseThrow().isTrulyNew());
    }

    @Test
    void closureCandidatesShouldBeActiveOldEnoughAndStalestFirst() throws Exception {
        Listing a = listing("201", T0);
        a.setLastUpdatedAt(T0.plus(Duration.ofHours(5)));
        Listing b = listing("202", T0);
        b.setLastUpdatedAt(T0.plus(Duration.ofHours(1)));
        Listing young = listing("203", T0.plus(Duration.ofDays(2)));
        Listing closed = listing("204", T0);
        dao.upsert(a);
        dao.upsert(b);
        dao.upsert(young);
        dao.upsert(closed);
        dao.markClosed("204", ClosureReason.CONFIRMED_MESSAGE, T0.plus(Duration.ofHours(2)));

        List<Listing> candidates = dao.findActiveForClosureScan(T0.plus(Duration.ofDays(1)), 10);

        assertEquals(List.of("202", "201"), candidates.stream().map(Listing::getId).toList());
        assertEquals(1, dao.findActiveForClosureScan(T0.plus(Duration.ofDays(1)), 1).size());
    }

    @Test
    void cleanupShouldDeleteOnlyStaleRows() throws Exception {
        dao.upsert(listing("301", T0));
        dao.upsert(listing("302", T0.plus(Duration.ofDays(100))));

        int deleted = dao.deleteNotUpdatedSince(T0.plus(Duration.ofDays(10)));

        assertEquals(1, deleted);
        assertEquals(1, dao.count());
        assertTrue(dao.find("302").isPresent());
    }

    @Test
    void statisticsShouldCountByState() throws Exception {
        assertTrue(dao.isEmpty());
        Listing lease = listing("401", T0);
        lease.setLease(true);
        dao.upsert(lease);
        dao.upsert(listing("402", T0.minus(Duration.ofDays(3))));
        dao.upsert(listing("403", T0));
        dao.markClosed("403", ClosureReason.NO_RESPONSE, T0);

        StoreStatistics stats = dao.statistics(T0.plus(Duration.ofHours(1)));

        assertEquals(3, stats.total());
        assertEquals(2, stats.active());
        assertEquals(1, stats.closed());
        assertEquals(2, stats.coupe());
        assertEquals(1, stats.lease());
        assertEquals(2, stats.firstSeenLast24h());
        assertEquals(1, stats.closuresByReason().get(ClosureReason.NO_RESPONSE.label()));
    }

    private static Listing listing(String id, Instant seenAt) {
        return Listing.builder()
                .id(id)
                .title("벤츠 GLE-클래스 GLE450 쿠페")
                .model("GLE-클래스")
                .badge("GLE450 쿠페")
                .year(2023)
                .mileage(12000)
                .listedPrice(8500.0)
                .trueCost(8500.0)
                .viewCount(12)
                .listingUrl("https://fem.encar.com/cars/detail/" + id)
                .coupe(true)
                .firstSeenAt(seenAt)
                .lastUpdatedAt(seenAt)
                .build();
    }
}
