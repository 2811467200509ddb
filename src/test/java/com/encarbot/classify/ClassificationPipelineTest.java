package com.encarbot.classify;

import com.encarbot.MutableClock;
import com.encarbot.db.InMemoryListingStore;
import com.encarbot.model.Classification;
import com.encarbot.model.ClassificationLabel;
import com.encarbot.model.LeaseTerms;
import com.encarbot.model.Listing;
import com.encarbot.model.ListingDetail;
import com.encarbot.model.SearchItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClassificationPipelineTest {
    private static final Instant T0 = Instant.parse("2024-01-10T03:00:00Z");

    private InMemoryListingStore store;
    private MutableClock clock;
    private ClassificationPipeline pipeline;

    @BeforeEach
    void setUp() {
        store = new InMemoryListingStore();
        clock = new MutableClock(T0);
        NewListingCriteria criteria = new NewListingCriteria(30, 7, 100, 10, Duration.ofMinutes(15), List.of("사고"));
        pipeline = new ClassificationPipeline(store, criteria, "https://fem.encar.com/cars/detail/%s",
                clock, ZoneId.of("Asia/Seoul"));
    }

    @Test
    void unseenCoupeShouldBeNewAndTrulyNew() throws Exception {
        Classification result = pipeline.classify(item("38001234", "GLE450 4MATIC 쿠페", "8,500", 2, "2024/01/05"));

        assertEquals(ClassificationLabel.NEW, result.label());
        Listing stored = store.row("38001234");
        assertTrue(stored.isCoupe());
        assertTrue(stored.isTrulyNew());
        assertEquals(8500.0, stored.getListedPrice(), 1e-9);
        assertEquals(8500.0, stored.getTrueCost(), 1e-9);
        assertEquals(5, stored.getDaysSinceRegistration());
        assertEquals("https://fem.encar.com/cars/detail/38001234", stored.getListingUrl());
        assertEquals(T0, stored.getFirstSeenAt());
    }

    @Test
    void seededItemsShouldNeverBeTrulyNew() throws Exception {
        Classification result = pipeline.seed(item("1", "GLE450 4MATIC 쿠페", "8500", 2, "2024/01/05"));

        assertEquals(ClassificationLabel.NEW, result.label());
        assertFalse(store.row("1").isTrulyNew());
    }

    @Test
    void excludedTitleShouldNotBeTrulyNewOrWorthNotifying() throws Exception {
        pipeline.classify(item("2", "GLE450 쿠페 사고차", "7000", 1, "2024/01/09"));

        Listing stored = store.row("2");
        assertFalse(stored.isTrulyNew());
        assertFalse(pipeline.isNotificationWorthy(stored));
    }

    @Test
    void poorerObservationShouldNotEraseBrowserDetail() throws Exception {
        pipeline.classify(item("3", "GLE450 쿠페", "8500", 42, "2024/01/01"));
        clock.advance(Duration.ofMinutes(10));

        Classification result = pipeline.classify(item("3", "GLE450 쿠페", "8300", 0, null));

        assertEquals(ClassificationLabel.UPDATED, result.label());
        Listing stored = store.row("3");
        assertEquals(42, stored.getViewCount());
        assertEquals("2024/01/01", stored.getRegistrationDate());
        assertEquals(8300.0, stored.getListedPrice(), 1e-9);
        assertEquals(T0, stored.getFirstSeenAt());
        assertEquals(T0.plus(Duration.ofMinutes(10)), stored.getLastUpdatedAt());
    }

    @Test
    void identicalObservationShouldBeUnchangedButTouched() throws Exception {
        pipeline.classify(item("4", "GLE450 쿠페", "8500", 5, "2024/01/05"));
        clock.advance(Duration.ofMinutes(5));

        Classification result = pipeline.classify(item("4", "GLE450 쿠페", "8500", 5, "2024/01/05"));

        assertEquals(ClassificationLabel.UNCHANGED, result.label());
        assertEquals(T0.plus(Duration.ofMinutes(5)), store.row("4").getLastUpdatedAt());
        assertEquals(T0, store.row("4").getFirstSeenAt());
    }

    @Test
    void unparseablePriceShouldKeepPreviousPrice() throws Exception {
        pipeline.classify(item("5", "GLE450 쿠페", "8500", 5, "2024/01/05"));

        pipeline.classify(item("5", "GLE450 쿠페", "가격문의", 5, "2024/01/05"));

        assertEquals(8500.0, store.row("5").getListedPrice(), 1e-9);
    }

    @Test
    void applyDetailShouldClearLeaseGuessWhenPageHasNoLeaseTerms() throws Exception {
        Listing listing = pipeline.classify(item("6", "GLE450 쿠페 리스승계", "1801", 3, null)).listing();
        assertTrue(listing.isLease());

        Listing enriched = pipeline.applyDetail(listing, new ListingDetail(77, "2024/01/02", null));

        assertFalse(enriched.isLease());
        assertEquals(1801.0, enriched.getTrueCost(), 1e-9);
        assertEquals(77, store.row("6").getViewCount());
        assertEquals("2024/01/02", store.row("6").getRegistrationDate());
    }

    @Test
    void applyDetailShouldPriceLeaseAtTrueCost() throws Exception {
        Listing listing = pipeline.classify(item("7", "GLE450 쿠페", "1801", 3, null)).listing();

        Listing enriched = pipeline.applyDetail(listing,
                new ListingDetail(0, null, new LeaseTerms(1801.0, 165.0, 26, null, null)));

        assertTrue(enriched.isLease());
        assertEquals(6091.0, store.row("7").getTrueCost(), 1e-9);
        assertEquals(1801.0, store.row("7").getListedPrice(), 1e-9);
    }

    @Test
    void nonLeaseTrueCostShouldEqualListedPrice() throws Exception {
        Listing listing = pipeline.classify(item("8", "GLE450 쿠페", "5000", 3, null)).listing();

        assertFalse(listing.isLease());
        assertEquals(5000.0, listing.getTrueCost(), 1e-9);
    }

    @Test
    void claimTrulyNewShouldHandOutEachListingOnce() throws Exception {
        pipeline.classify(item("9", "GLE450 쿠페", "8500", 2, "2024/01/09"));
        pipeline.classify(item("10", "GLE450 4MATIC", "8500", 2, "2024/01/09"));

        List<Listing> first = pipeline.claimTrulyNew();
        List<Listing> second = pipeline.claimTrulyNew();

        assertEquals(1, first.size());
        assertEquals("9", first.get(0).getId());
        assertTrue(second.isEmpty());
    }

    @Test
    void claimTrulyNewShouldIgnoreListingsOutsideAlertWindow() throws Exception {
        pipeline.classify(item("11", "GLE450 쿠페", "8500", 2, "2024/01/09"));
        clock.advance(Duration.ofMinutes(16));

        assertTrue(pipeline.claimTrulyNew().isEmpty());
    }

    @Test
    void itemWithoutIdShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> pipeline.classify(item("", "GLE450 쿠페", "8500", 0, null)));
    }

    @Test
    void coupeDetectionShouldLookAtModelAndBadge() {
        assertTrue(ClassificationPipeline.isCoupe("GLE-클래스 W167", "GLE450 4MATIC 쿠페"));
        assertTrue(ClassificationPipeline.isCoupe("GLE Coupe", null));
        assertFalse(ClassificationPipeline.isCoupe("GLE-클래스 W167", "GLE450 4MATIC"));
    }

    private static SearchItem item(String id, String badge, String price, int views, String registered) {
        return new SearchItem(id, "벤츠", "GLE-클래스 W167", badge, 202301, price, 12000,
                "가솔린", "오토", "2024-01-10 10:00:00", views, registered);
    }
}
