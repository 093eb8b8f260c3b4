package com.historicforts.scraper;

/**
 * A discovered state page.
 * @param filename file name without the {@code .html} suffix, e.g. {@code ca-central}
 * @param stateCode lower-case two-letter code taken from the file name
 */
public record PageInfo(String url, String section, String filename, String stateCode, String stateName) {

    public PageSource toSource() {
        return new PageSource(url, stateCode, stateName, section);
    }
}
