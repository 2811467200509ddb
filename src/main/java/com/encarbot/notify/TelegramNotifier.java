package com.encarbot.notify;

import com.encarbot.config.Config;
import com.encarbot.core.MonitoringCycle;
import com.encarbot.http.HttpResult;
import com.encarbot.http.HttpTransport;
import com.encarbot.model.Listing;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Telegram Bot API channel ({@code sendMessage}). Messages are HTML-escaped, sent with
 * HTML parse mode and cut to the API's size limit. Sends beyond the per-minute budget
 * are dropped.
 */
public final class TelegramNotifier implements Notifier {
    private static final Logger LOG = LogManager.getLogger(TelegramNotifier.class);
    static final int MAX_MESSAGE_CHARS = 4000;

    public static final class Settings {
        public boolean enabled;
        public String apiBase;
        public String botToken;
        public String chatId;
        public int maxPerMinute;
        public int timeoutSec;
        public String parseMode;
        public boolean disablePreview;

        public boolean isUsable() {
            return enabled && !isBlank(botToken) && !isBlank(chatId);
        }
    }

    public static Settings loadSettings(Config config) {
        Settings settings = new Settings();
        settings.enabled = config.getBoolean("notify.telegram.enabled", false);
        settings.apiBase = config.getString("notify.telegram.api_base", "https://api.telegram.org");
        settings.botToken = firstNonBlank(System.getenv("ENCARBOT_TELEGRAM_BOT_TOKEN"),
                config.getString("notify.telegram.bot_token"));
        settings.chatId = firstNonBlank(System.getenv("ENCARBOT_TELEGRAM_CHAT_ID"),
                config.getString("notify.telegram.chat_id"));
        settings.maxPerMinute = Math.max(1, config.getInt("notify.telegram.max_per_minute", 20));
        settings.timeoutSec = Math.max(3, config.getInt("notify.telegram.timeout_sec", 30));
        settings.parseMode = config.getString("notify.telegram.parse_mode", "HTML");
        settings.disablePreview = config.getBoolean("notify.telegram.disable_preview", false);
        return settings;
    }

    private final Settings settings;
    private final HttpTransport transport;
    private final MessageFormatter formatter;
    private final SlidingWindowRateLimiter rateLimiter;
    private final Clock clock;

    public TelegramNotifier(Settings settings, HttpTransport transport, MessageFormatter formatter, Clock clock) {
        this.settings = settings;
        this.transport = transport;
        this.formatter = formatter;
        this.clock = clock;
        this.rateLimiter = new SlidingWindowRateLimiter(settings.maxPerMinute, Duration.ofSeconds(60), clock);
    }

    @Override
    public boolean sendListingAlert(Listing listing) {
        return send(formatter.listingAlert(listing, clock.instant()));
    }

    @Override
    public boolean sendBatchAlert(List<Listing> listings, String summary) {
        return send(formatter.batchAlert(listings, summary, clock.instant()));
    }

    @Override
    public boolean sendCycleReport(MonitoringCycle cycle) {
        return send(formatter.cycleReport(cycle));
    }

    @Override
    public boolean sendStatus(String status, String details) {
        return send(formatter.status(status, details, clock.instant()));
    }

    @Override
    public boolean sendError(String context, Throwable error) {
        return send(formatter.error(context, error, clock.instant()));
    }

    boolean send(String text) {
        if (!settings.isUsable()) {
            return false;
        }
        if (!rateLimiter.tryAcquire()) {
            LOG.warn("telegram rate limit reached ({} per minute), message dropped", settings.maxPerMinute);
            return false;
        }
        JSONObject body = new JSONObject();
        body.put("chat_id", settings.chatId);
        body.put("text", truncate(escapeHtml(text)));
        body.put("parse_mode", settings.parseMode);
        body.put("disable_web_page_preview", settings.disablePreview);
        String url = settings.apiBase + "/bot" + settings.botToken + "/sendMessage";
        try {
            HttpResult result = transport.postJson(url, body.toString(), Duration.ofSeconds(settings.timeoutSec));
            if (result.isSuccess() && new JSONObject(result.body()).optBoolean("ok", false)) {
                return true;
            }
            LOG.warn("telegram api error status={} body={}", result.status(), abbreviate(result.body()));
            return false;
        } catch (IOException | JSONException e) {
            LOG.warn("telegram send failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("telegram send interrupted");
            return false;
        }
    }

    static String escapeHtml(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    static String truncate(String text) {
        if (text.length() <= MAX_MESSAGE_CHARS) {
            return text;
        }
        int cut = MAX_MESSAGE_CHARS - 3;
        // never split an escaped entity
        int amp = text.lastIndexOf('&', cut - 1);
        if (amp >= 0 && text.indexOf(';', amp) >= cut) {
            cut = amp;
        }
        return text.substring(0, cut) + "...";
    }

    private static String abbreviate(String body) {
        return body.length() <= 300 ? body : body.substring(0, 300) + "...";
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value.trim();
            }
        }
        return "";
    }
}
