package com.encarbot.closure;

import com.encarbot.browser.RenderedPage;
import com.encarbot.model.ClosureReason;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClosureDetectorTest {
    private static final String DETAIL_URL = "https://fem.encar.com/cars/detail/38404123";

    @Test
    void missingResponseShouldCountAsNoResponse() {
        assertEquals(Optional.of(ClosureReason.NO_RESPONSE), ClosureDetector.detect(RenderedPage.noResponse(DETAIL_URL)));
    }

    @Test
    void statusCodesShouldDecideBeforeContent() {
        assertEquals(Optional.of(ClosureReason.HTTP_404), ClosureDetector.detect(page(404, "", "", List.of(), List.of())));
        assertTrue(ClosureDetector.detect(page(500, "Error", "", List.of(), List.of())).isEmpty());
    }

    @Test
    void blockedOrFailingStatusesShouldBeInconclusive() {
        for (int status : new int[]{403, 429, 500, 503}) {
            assertTrue(ClosureDetector.isInconclusive(page(status, "", "", List.of(), List.of())), "status " + status);
        }
        assertFalse(ClosureDetector.isInconclusive(page(404, "", "", List.of(), List.of())));
        assertFalse(ClosureDetector.isInconclusive(RenderedPage.noResponse(DETAIL_URL)));
    }

    @Test
    void noDataBannerShouldConfirmSale() {
        RenderedPage page = page(200, "GLE 450 쿠페", "", List.of("이 차량은 판매되었거나 삭제된 차량입니다."), List.of());

        assertEquals(Optional.of(ClosureReason.CONFIRMED_MESSAGE), ClosureDetector.detect(page));
    }

    @Test
    void errorTitleShouldCountAsErrorPage() {
        assertEquals(Optional.of(ClosureReason.ERROR_PAGE),
                ClosureDetector.detect(page(200, "Page Not Found", "", List.of(), List.of())));
    }

    @Test
    void withdrawnPhraseInBodyShouldConfirmSale() {
        RenderedPage page = page(200, "엔카", "안내 차량정보가 존재하지 않습니다 홈으로", List.of(), List.of());

        assertEquals(Optional.of(ClosureReason.CONFIRMED_MESSAGE), ClosureDetector.detect(page));
    }

    @Test
    void substantialErrorElementShouldCount() {
        assertEquals(Optional.of(ClosureReason.ERROR_ELEMENT),
                ClosureDetector.detect(page(200, "엔카", "", List.of(), List.of("요청하신 페이지를 표시할 수 없습니다"))));
        assertTrue(ClosureDetector.detect(page(200, "엔카", "", List.of(), List.of("닫기"))).isEmpty());
    }

    @Test
    void errorRedirectShouldCountButIdsContaining404ShouldNot() {
        RenderedPage redirected = new RenderedPage(200, "엔카", "https://www.encar.com/error/404.html",
                "", "", List.of(), List.of());

        assertEquals(Optional.of(ClosureReason.REDIRECT_ERROR), ClosureDetector.detect(redirected));
        assertTrue(ClosureDetector.detect(page(200, "벤츠 GLE 450 쿠페", "조회수 120", List.of(), List.of())).isEmpty());
    }

    private static RenderedPage page(int status, String title, String body, List<String> noData, List<String> errors) {
        return new RenderedPage(status, title, DETAIL_URL, "", body, noData, errors);
    }
}
