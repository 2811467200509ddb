package com.encarbot.browser;

/**
 * Headless-browser operations used by acquisition, enrichment and closure scanning. Each
 * call owns its rendering resources for its whole duration and releases them before
 * returning, on success and on failure.
 */
public interface BrowserGateway {

    /**
     * Renders {@code url} and returns the cookies and user agent the browser ended up with.
     */
    SessionSnapshot harvestSession(String url) throws BrowserException;

    /**
     * Navigates the browser itself to a JSON endpoint and returns the raw document text.
     */
    String fetchText(String url) throws BrowserException;

    /**
     * Renders a listing page. A navigation that produced no HTTP response is reported as
     * {@link RenderedPage#noResponse}; failures to navigate at all throw.
     */
    RenderedPage render(String url) throws BrowserException;
}
