package com.encarbot.classify;

import com.encarbot.db.ListingStore;
import com.encarbot.db.PersistenceException;
import com.encarbot.model.Classification;
import com.encarbot.model.ClassificationLabel;
import com.encarbot.model.LeaseTerms;
import com.encarbot.model.Listing;
import com.encarbot.model.ListingDetail;
import com.encarbot.model.SearchItem;
import com.encarbot.price.PriceNormalizer;
import com.encarbot.price.PriceParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns acquired items into stored listings.
 *
 * <p>Each item is normalized once, looked up by id and written back as a single-row
 * upsert. Items the store has never seen are labelled {@code NEW} and evaluated by
 * {@link TrulyNewRule}; known items are merged so that a poorer observation never erases
 * detail captured earlier from a rendered page.
 */
public final class ClassificationPipeline {
    private static final Logger LOG = LogManager.getLogger(ClassificationPipeline.class);
    private static final List<String> COUPE_KEYWORDS = List.of("쿠페", "coupe");

    private final ListingStore store;
    private final NewListingCriteria criteria;
    private final TrulyNewRule trulyNewRule;
    private final String detailUrlTemplate;
    private final Clock clock;
    private final ZoneId zone;

    public ClassificationPipeline(
            ListingStore store,
            NewListingCriteria criteria,
            String detailUrlTemplate,
            Clock clock,
            ZoneId zone
    ) {
        this.store = store;
        this.criteria = criteria;
        this.trulyNewRule = new TrulyNewRule(criteria);
        this.detailUrlTemplate = detailUrlTemplate;
        this.clock = clock;
        this.zone = zone;
    }

    public Classification classify(SearchItem item) throws PersistenceException {
        return classify(item, true);
    }

    /**
     * Population variant: same normalization and merge, but never flags anything as
     * truly-new, so the initial seed triggers no alerts.
     */
    public Classification seed(SearchItem item) throws PersistenceException {
        return classify(item, false);
    }

    public Listing applyDetail(Listing listing, ListingDetail detail) throws PersistenceException {
        Listing enriched = listing.toBuilder().build();
        if (detail.viewCount() > 0) {
            enriched.setViewCount(detail.viewCount());
        }
        if (detail.registrationDate() != null) {
            enriched.setRegistrationDate(detail.registrationDate());
            enriched.setDaysSinceRegistration(RegistrationDates.daysSince(detail.registrationDate(), clock, zone));
        }
        LeaseTerms terms = detail.leaseTerms();
        if (terms != null) {
            enriched.setLease(true);
            enriched.setLeaseTerms(terms);
            Double trueCost = terms.trueCost();
            enriched.setTrueCost(trueCost == null ? enriched.getListedPrice() : trueCost);
        } else {
            enriched.setLease(false);
            enriched.setLeaseTerms(null);
            enriched.setTrueCost(enriched.getListedPrice());
        }
        enriched.setLastUpdatedAt(clock.instant());
        store.upsert(enriched);
        if (listing.isLease() != enriched.isLease()) {
            LOG.info("lease flag corrected id={} {} -> {}", listing.getId(), listing.isLease(), enriched.isLease());
        }
        return enriched;
    }

    /**
     * Truly-new coupe listings first seen inside the alert window; each is returned once.
     */
    public List<Listing> claimTrulyNew() throws PersistenceException {
        return store.claimTrulyNew(clock.instant().minus(criteria.alertWindow()));
    }

    public boolean isNotificationWorthy(Listing listing) {
        return listing.isCoupe() && !listing.isClosed() && !criteria.isExcluded(listing.getTitle());
    }

    public static boolean isCoupe(String model, String badge) {
        String text = ((model == null ? "" : model) + " " + (badge == null ? "" : badge)).toLowerCase(Locale.ROOT);
        for (String keyword : COUPE_KEYWORDS) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    Listing normalize(SearchItem item, Instant now) {
        double listedPrice;
        try {
            listedPrice = PriceNormalizer.parsePrice(item.rawPrice());
        } catch (PriceParseException e) {
            LOG.warn("id={} {}", item.id(), e.getMessage());
            listedPrice = 0.0;
        }
        String registration = RegistrationDates.normalize(item.registrationDate());
        return Listing.builder()
                .id(item.id())
                .title(item.title())
                .model(item.model())
                .badge(item.badge())
                .year(item.modelYear())
                .mileage(item.mileage())
                .listedPrice(listedPrice)
                .trueCost(listedPrice)
                .lease(PriceNormalizer.looksLikeLeaseTitle(item.title()))
                .viewCount(item.viewCount())
                .registrationDate(registration)
                .daysSinceRegistration(RegistrationDates.daysSince(registration, clock, zone))
                .listingUrl(String.format(detailUrlTemplate, item.id()))
                .coupe(isCoupe(item.model(), item.badge()))
                .firstSeenAt(now)
                .lastUpdatedAt(now)
                .build();
    }

    private Classification classify(SearchItem item, boolean evaluateTrulyNew) throws PersistenceException {
        if (item.id().isEmpty()) {
            throw new IllegalArgumentException("search item without id");
        }
        Instant now = clock.instant();
        Listing observed = normalize(item, now);
        Optional<Listing> existing = store.find(item.id());
        if (existing.isEmpty()) {
            if (evaluateTrulyNew && !criteria.isExcluded(observed.getTitle())) {
                Optional<TrulyNewRule.Reason> reason =
                        trulyNewRule.evaluate(observed.getDaysSinceRegistration(), observed.getViewCount());
                observed.setTrulyNew(reason.isPresent());
                reason.ifPresent(r -> LOG.info("truly-new id={} reason={} views={} days={}",
                        observed.getId(), r, observed.getViewCount(), observed.getDaysSinceRegistration()));
            }
            store.upsert(observed);
            return new Classification(ClassificationLabel.NEW, observed);
        }

        Listing prior = existing.get();
        Listing merged = merge(prior, observed);
        store.upsert(merged);
        ClassificationLabel label = materiallyChanged(prior, merged)
                ? ClassificationLabel.UPDATED
                : ClassificationLabel.UNCHANGED;
        return new Classification(label, merged);
    }

    private Listing merge(Listing prior, Listing observed) {
        Listing merged = observed.toBuilder()
                .firstSeenAt(prior.getFirstSeenAt())
                .trulyNew(prior.isTrulyNew())
                .closed(prior.isClosed())
                .closureDetectedAt(prior.getClosureDetectedAt())
                .closureReason(prior.getClosureReason())
                .build();
        if (!observed.hasBrowserDetail() && prior.hasBrowserDetail()) {
            merged.setViewCount(prior.getViewCount());
            merged.setRegistrationDate(prior.getRegistrationDate());
            merged.setDaysSinceRegistration(prior.getRegistrationDate() == null
                    ? prior.getDaysSinceRegistration()
                    : RegistrationDates.daysSince(prior.getRegistrationDate(), clock, zone));
        }
        if (observed.getListedPrice() <= 0.0 && prior.getListedPrice() > 0.0) {
            merged.setListedPrice(prior.getListedPrice());
            merged.setTrueCost(prior.getListedPrice());
        }
        if (!observed.hasLeaseDetail() && prior.hasLeaseDetail()) {
            merged.setLease(prior.isLease());
            merged.setLeaseTerms(prior.getLeaseTerms());
            Double trueCost = prior.getLeaseTerms().trueCost();
            merged.setTrueCost(trueCost == null ? merged.getListedPrice() : trueCost);
        }
        return merged;
    }

    private static boolean materiallyChanged(Listing prior, Listing merged) {
        return Double.compare(prior.getListedPrice(), merged.getListedPrice()) != 0
                || Double.compare(prior.getTrueCost(), merged.getTrueCost()) != 0
                || !Objects.equals(prior.getMileage(), merged.getMileage())
                || !Objects.equals(prior.getTitle(), merged.getTitle())
                || prior.getViewCount() != merged.getViewCount()
                || !Objects.equals(prior.getRegistrationDate(), merged.getRegistrationDate())
                || prior.isLease() != merged.isLease();
    }
}
