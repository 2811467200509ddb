package com.encarbot.notify;

import com.encarbot.MutableClock;
import com.encarbot.http.HttpResult;
import com.encarbot.http.ScriptedHttpTransport;
import com.encarbot.model.Listing;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TelegramNotifierTest {
    private ScriptedHttpTransport transport;
    private MutableClock clock;
    private TelegramNotifier notifier;

    @BeforeEach
    void setUp() {
        transport = new ScriptedHttpTransport();
        clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
        notifier = new TelegramNotifier(settings(2), transport, new MessageFormatter(ZoneId.of("Asia/Seoul")), clock);
    }

    @Test
    void sendShouldPostEscapedTextToBotEndpoint() {
        assertTrue(notifier.sendStatus("STARTED", "GLE <coupe> & friends"));

        assertEquals("https://api.telegram.example/bottoken-1/sendMessage", transport.postUrls.get(0));
        JSONObject body = new JSONObject(transport.postBodies.get(0));
        assertEquals("chat-9", body.getString("chat_id"));
        assertEquals("HTML", body.getString("parse_mode"));
        assertTrue(body.getString("text").contains("GLE &lt;coupe&gt; &amp; friends"));
        assertTrue(body.getString("text").contains("2024-03-01 09:00:00"));
    }

    @Test
    void longMessagesShouldBeTruncated() {
        notifier.sendStatus("STATUS", "x".repeat(5000));

        String text = new JSONObject(transport.postBodies.get(0)).getString("text");
        assertEquals(TelegramNotifier.MAX_MESSAGE_CHARS, text.length());
        assertTrue(text.endsWith("..."));
    }

    @Test
    void truncationShouldNotSplitEscapedEntities() {
        String escaped = TelegramNotifier.escapeHtml("x".repeat(TelegramNotifier.MAX_MESSAGE_CHARS - 5) + "<<<<");

        String cut = TelegramNotifier.truncate(escaped);

        assertTrue(cut.length() <= TelegramNotifier.MAX_MESSAGE_CHARS);
        assertTrue(cut.endsWith("x..."), cut.substring(cut.length() - 10));
        assertFalse(cut.contains("&l..."));
    }

    @Test
    void messagesOverRateLimitShouldBeDropped() {
        assertTrue(notifier.sendStatus("a", ""));
        assertTrue(notifier.sendStatus("b", ""));
        assertFalse(notifier.sendStatus("c", ""));
        assertEquals(2, transport.postBodies.size());

        clock.advance(Duration.ofSeconds(61));
        assertTrue(notifier.sendStatus("d", ""));
    }

    @Test
    void apiRejectionShouldReportUndelivered() {
        transport.postResponse = new HttpResult(400, "{\"ok\":false,\"description\":\"chat not found\"}");

        assertFalse(notifier.sendBatchAlert(List.of(listing()), "1 new"));
    }

    @Test
    void unusableSettingsShouldSendNothing() {
        TelegramNotifier.Settings settings = settings(5);
        settings.chatId = "";
        TelegramNotifier disabled = new TelegramNotifier(settings, transport,
                new MessageFormatter(ZoneId.of("Asia/Seoul")), clock);

        assertFalse(disabled.sendListingAlert(listing()));
        assertTrue(transport.postBodies.isEmpty());
    }

    private static TelegramNotifier.Settings settings(int maxPerMinute) {
        TelegramNotifier.Settings settings = new TelegramNotifier.Settings();
        settings.enabled = true;
        settings.apiBase = "https://api.telegram.example";
        settings.botToken = "token-1";
        settings.chatId = "chat-9";
        settings.maxPerMinute = maxPerMinute;
        settings.timeoutSec = 5;
        settings.parseMode = "HTML";
        return settings;
    }

    private static Listing listing() {
        return Listing.builder()
                .id("38001234")
                .title("벤츠 GLE-클래스 GLE450 쿠페")
                .year(2023)
                .listedPrice(8500.0)
                .trueCost(8500.0)
                .viewCount(3)
                .listingUrl("https://fem.encar.com/cars/detail/38001234")
                .build();
    }
}
