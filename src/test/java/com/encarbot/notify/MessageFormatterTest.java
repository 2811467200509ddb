package com.encarbot.notify;

import com.encarbot.core.MonitoringCycle;
import com.encarbot.model.ClassificationLabel;
import com.encarbot.model.CycleType;
import com.encarbot.model.LeaseTerms;
import com.encarbot.model.Listing;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageFormatterTest {
    private final MessageFormatter formatter = new MessageFormatter(ZoneId.of("Asia/Seoul"));
    private final Instant now = Instant.parse("2024-03-01T00:00:00Z");

    @Test
    void listingAlertShouldCarryPriceViewsAndLink() {
        String text = formatter.listingAlert(listing(), now);

        assertTrue(text.startsWith("NEW LISTING ALERT - 2024-03-01 09:00:00"));
        assertTrue(text.contains("Price: 8,500만원"));
        assertTrue(text.contains("Mileage: 12,000 km"));
        assertTrue(text.contains("Registration: 2024/02/27 (3 days ago)"));
        assertTrue(text.contains("URL: https://fem.encar.com/cars/detail/38001234"));
    }

    @Test
    void leasePriceShouldShowTrueCostAndMonthlyTerms() {
        Listing lease = listing().toBuilder()
                .lease(true)
                .leaseTerms(new LeaseTerms(1801.0, 165.0, 26, null, null))
                .trueCost(6091.0)
                .build();

        assertEquals("lease 6,091만원 total (165만원 x 26)", MessageFormatter.priceText(lease));
    }

    @Test
    void batchAlertShouldNumberListings() {
        String text = formatter.batchAlert(List.of(listing(), listing()), "2 new listing(s)", now);

        assertTrue(text.contains("Found 2 truly new coupe listing(s)"));
        assertTrue(text.contains("[1] 벤츠 GLE-클래스 GLE450 쿠페 (2023) - 8,500만원 - 3 views (fresh)"));
        assertTrue(text.contains("[2] "));
        assertTrue(text.endsWith("2 new listing(s)"));
    }

    @Test
    void cycleReportShouldIncludeStatusAndCounters() {
        MonitoringCycle cycle = new MonitoringCycle(CycleType.QUICK, now);
        cycle.recordPage(20);
        cycle.recordClassification(ClassificationLabel.NEW);
        cycle.finish();

        String text = formatter.cycleReport(cycle);

        assertTrue(text.startsWith("CYCLE QUICK SUCCESS"));
        assertTrue(text.contains("scanned=20"));
        assertTrue(text.contains("new=1"));
    }

    private static Listing listing() {
        return Listing.builder()
                .id("38001234")
                .title("벤츠 GLE-클래스 GLE450 쿠페")
                .year(2023)
                .mileage(12000)
                .listedPrice(8500.0)
                .trueCost(8500.0)
                .viewCount(3)
                .registrationDate("2024/02/27")
                .daysSinceRegistration(3)
                .listingUrl("https://fem.encar.com/cars/detail/38001234")
                .build();
    }
}
