package com.historicforts.scraper;

/**
 * Outcome of fetching one page: the body on success, an error message otherwise.
 */
public record FetchResult(String html, String error) {

    public static FetchResult success(String html) {
        return new FetchResult(html == null ? "" : html, null);
    }

    public static FetchResult failure(String error) {
        return new FetchResult(null, error == null || error.isBlank() ? "unknown error" : error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
