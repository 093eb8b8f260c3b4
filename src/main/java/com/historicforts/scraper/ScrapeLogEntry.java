package com.historicforts.scraper;

import java.time.LocalDateTime;

/**
 * Last recorded scrape attempt for a page URL.
 * @param status {@value #SUCCESS} or {@value #ERROR}
 */
public record ScrapeLogEntry(String url, String status, int fortsFound, String errorMessage, LocalDateTime scrapedAt) {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
