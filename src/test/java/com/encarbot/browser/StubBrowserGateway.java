package com.encarbot.browser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Browser stand-in: fixed session, scripted JSON for {@link #fetchText} and pages per URL
 * for {@link #render}. URLs with no page configured fail to navigate.
 */
public final class StubBrowserGateway implements BrowserGateway {
    public int harvests;
    public int fetchTextCalls;
    public final List<String> rendered = new ArrayList<>();
    public final Map<String, RenderedPage> pages = new HashMap<>();
    public String fetchTextBody;
    public boolean failHarvest;

    @Override
    public synchronized SessionSnapshot harvestSession(String url) throws BrowserException {
        if (failHarvest) {
            throw new BrowserException("harvest failed for " + url);
        }
        harvests++;
        return new SessionSnapshot(Map.of("PCID", "pc-" + harvests, "WMONID", "w1"), "Mozilla/5.0 Test", url);
    }

    @Override
    public synchronized String fetchText(String url) throws BrowserException {
        fetchTextCalls++;
        if (fetchTextBody == null) {
            throw new BrowserException("no body scripted for " + url);
        }
        return fetchTextBody;
    }

    @Override
    public synchronized RenderedPage render(String url) throws BrowserException {
        rendered.add(url);
        RenderedPage page = pages.get(url);
        if (page == null) {
            throw new BrowserException("navigation failed: " + url);
        }
        return page;
    }

    public static RenderedPage page(int status, String bodyText) {
        return new RenderedPage(status, "엔카", "https://fem.encar.com/cars/detail/x", "", bodyText, List.of(), List.of());
    }
}
