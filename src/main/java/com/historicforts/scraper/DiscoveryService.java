package com.historicforts.scraper;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the state pages linked from each site section index.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Fetches {@code <base>/<section>/} and selects every {@code a[href]} with jsoup.</li>
 *   <li>Keeps links naming a state page ({@code ct.html}, {@code /East/ct.html}, {@code ak2.html},
 *       {@code ca-central.html}, {@code mosouth.html}) and resolves them against the section URL.</li>
 *   <li>Derives the state code from the first two letters of the file name and looks up the state
 *       name; unknown codes keep the upper-cased code as name.</li>
 * </ul>
 * A section that cannot be fetched is logged and contributes no pages.
 *
 * @author Fort Scraper Team
 * @since 1.0
 */
public class DiscoveryService {
    private static final Logger logger = LoggerFactory.getLogger(DiscoveryService.class);

    private static final Pattern STATE_PREFIX = Pattern.compile("^([a-z]{2})");

    private final FetchServiceInterface fetcher;
    private final ScraperConfig config;

    public DiscoveryService(FetchServiceInterface fetcher, ScraperConfig config) {
        this.fetcher = fetcher;
        this.config = config;
    }

    /**
     * Discovers the pages of every configured section, sorted by URL within each section.
     */
    public List<PageInfo> discoverAll() {
        List<PageInfo> pages = new ArrayList<>();
        List<String> sections = config.sections();
        for (int i = 0; i < sections.size(); i++) {
            String section = sections.get(i);
            for (String url : discoverSection(section)) {
                pages.add(toPageInfo(url, section));
            }
            if (i < sections.size() - 1) Utils.sleep(config.requestDelayMs());
        }
        logger.info("Discovered {} pages across {} sections", pages.size(), sections.size());
        return pages;
    }

    /**
     * Discovers the state page URLs linked from one section index.
     * @return absolute URLs, sorted and without duplicates
     */
    public TreeSet<String> discoverSection(String section) {
        String sectionUrl = config.baseUrl() + "/" + section + "/";
        logger.info("Discovering pages in {}", sectionUrl);
        FetchResult result = fetcher.fetch(sectionUrl);
        if (!result.isSuccess()) {
            logger.error("Error fetching {}: {}", sectionUrl, result.error());
            return new TreeSet<>();
        }
        TreeSet<String> urls = extractStateLinks(result.html(), sectionUrl, section);
        logger.info("Found {} pages in {}", urls.size(), section);
        return urls;
    }

    static TreeSet<String> extractStateLinks(String html, String sectionUrl, String section) {
        Pattern statePage = Pattern.compile(
            "^(?:/" + Pattern.quote(section) + "/)?([a-z]{2}(?:-?[a-z0-9]*)?)\\.html$", Pattern.CASE_INSENSITIVE);
        Document doc = Jsoup.parse(html, sectionUrl);
        TreeSet<String> urls = new TreeSet<>();
        for (Element link : doc.select("a[href]")) {
            String href = link.attr("href").trim();
            if (statePage.matcher(href).matches()) {
                urls.add(link.absUrl("href"));
            }
        }
        return urls;
    }

    static PageInfo toPageInfo(String url, String section) {
        String filename = url.substring(url.lastIndexOf('/') + 1).replace(".html", "");
        Matcher m = STATE_PREFIX.matcher(filename.toLowerCase(Locale.ROOT));
        String stateCode = m.find() ? m.group(1) : filename.toLowerCase(Locale.ROOT);
        String stateName = FortVocabulary.stateName(stateCode);
        if (stateName == null) stateName = stateCode.toUpperCase(Locale.ROOT);
        return new PageInfo(url, section, filename, stateCode, stateName);
    }
}
