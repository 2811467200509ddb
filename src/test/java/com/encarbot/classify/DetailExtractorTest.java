package com.encarbot.classify;

import com.encarbot.browser.RenderedPage;
import com.encarbot.model.ListingDetail;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class DetailExtractorTest {

    @Test
    void extract_shouldReadViewsRegistrationAndLease() {
        ListingDetail detail = DetailExtractor.extract(
                "GLE 450 쿠페 조회수 1,234 최초 등록일 : 2024.03.02 리스 월 납입금 165만원 리스기간 26개월 인수금 1,801만원");

        assertEquals(1234, detail.viewCount());
        assertEquals("2024/03/02", detail.registrationDate());
        assertNotNull(detail.leaseTerms());
        assertEquals(6091.0, detail.leaseTerms().trueCost(), 1e-9);
    }

    @Test
    void extract_shouldFallBackToHtmlWhenBodyTextMissing() {
        RenderedPage page = new RenderedPage(200, "GLE", "https://fem.encar.com/cars/detail/1",
                "<html><body><span>조회수</span> <b>42</b></body></html>", "", List.of(), List.of());

        ListingDetail detail = DetailExtractor.extract(page);

        assertEquals(42, detail.viewCount());
        assertNull(detail.registrationDate());
        assertNull(detail.leaseTerms());
    }
}
