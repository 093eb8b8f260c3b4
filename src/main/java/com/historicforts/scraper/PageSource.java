package com.historicforts.scraper;

/**
 * Where a page came from: its URL plus the state and section it belongs to.
 */
public record PageSource(String sourceUrl, String stateCode, String stateName, String section) {}
