package com.openforge.memkeep.gateway;

/**
 * Minimal web page interaction used by the BROWSE and FETCH tools.
 *
 * The default implementation, {@link HttpPageAutomation}, supports navigation
 * and text extraction only.  Its {@code click}, {@code type} and
 * {@code screenshot} throw {@link UnsupportedOperationException}; those need
 * an implementation backed by a real browser driver.
 */
public interface PageAutomation {

    /** Loads the page and returns its title and raw markup. */
    Page navigate(String url);

    /** Visible text of the page: article, else main, else body. */
    String extractText(String url);

    /** @throws UnsupportedOperationException when no browser driver backs this instance */
    String click(String url, String selector);

    String type(String url, String selector, String text);

    /** @return where the screenshot was written */
    String screenshot(String url);

    record Page(String url, int status, String title, String html) {}
}
