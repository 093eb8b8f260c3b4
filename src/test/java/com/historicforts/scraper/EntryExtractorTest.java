package com.historicforts.scraper;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EntryExtractorTest {

    @Test
    void testMarkupStrategyItalicLayout() {
        List<EntryFragment> fragments = EntryExtractor.extract(Fixtures.page("connecticut.html"), Fixtures.CT_URL);
        assertEquals(3, fragments.size());

        EntryFragment hill = fragments.get(0);
        assertTrue(hill.segmented());
        assertEquals("Fort Hill", hill.name());
        assertEquals("1775 - 1783", hill.datesRaw());
        assertEquals("near New London", hill.locationText());
        assertEquals("A stone fort, also known as Fort Trumbull Annex. Abandoned after the war.", hill.descriptionText());
        assertTrue(hill.descriptionHtml().contains("<B>Fort Trumbull Annex</B>"));
        assertEquals(List.of("Great Britain", "United States"), hill.nationalities());

        EntryFragment griswold = fragments.get(1);
        assertEquals("Fort Griswold", griswold.name());
        assertEquals("1775, 1812 - 1815, 1861", griswold.datesRaw());
        assertEquals("", griswold.locationText());
        assertEquals("Earthwork battery on Groton Heights.", griswold.descriptionText());
        assertTrue(griswold.nationalities().isEmpty());
    }

    @Test
    void testMarkupStrategyPlainDatesAfterAnchor() {
        List<EntryFragment> fragments = EntryExtractor.extract(Fixtures.page("connecticut.html"), Fixtures.CT_URL);
        EntryFragment saybrook = fragments.get(2);
        assertFalse(saybrook.segmented());
        assertEquals("Saybrook Fort (1636 - 1647), Old Saybrook - A palisade fort built by English colonists.",
            saybrook.rawText());
    }

    @Test
    void testItalicWithoutDatesIsLocation() {
        String html = "<a name=\"x\">Fort Nowhere</a><br><i>somewhere on the coast</i><br>Lost.<p>";
        EntryFragment fragment = EntryExtractor.extract(html, "test").get(0);
        assertEquals("", fragment.datesRaw());
        assertEquals("somewhere on the coast", fragment.locationText());
        assertEquals("Lost.", fragment.descriptionText());
    }

    @Test
    void testAnchorsWithoutEntryLayoutAreIgnored() {
        String html = "<a name=\"top\"></a><a name=\"idx\">Index</a> See the list below.<p>";
        assertTrue(EntryExtractor.extractFromMarkup(MarkupTokenizer.tokenize(html)).isEmpty());
    }

    @Test
    void testPlainTextFallback() {
        List<EntryFragment> fragments = EntryExtractor.extract(Fixtures.page("plain-text.html"), "test");
        assertEquals(2, fragments.size());

        EntryFragment alpha = fragments.get(0);
        assertTrue(alpha.segmented());
        assertEquals("", alpha.rawText());
        assertEquals("Fort Alpha", alpha.name());
        assertEquals("1750 - 1760", alpha.datesRaw());
        assertEquals("near Hartford", alpha.locationText());
        assertEquals("A wooden stockade built by colonial militia to guard the upper river crossing.",
            alpha.descriptionText());
        assertTrue(alpha.nationalities().isEmpty());

        EntryFragment beta = fragments.get(1);
        assertEquals("", beta.locationText());
        assertEquals("Built by the French.", beta.descriptionText());
        assertEquals(List.of("France"), beta.nationalities());
    }

    @Test
    void testPlainTextLocationKeptWhole() {
        String html = "<html><body><p>Fort Alpha (1750), St. Louis</p><p>Fort Beta (1755), Mobile</p></body></html>";
        List<EntryFragment> fragments = EntryExtractor.extract(html, "test");
        assertEquals(2, fragments.size());
        assertEquals("St. Louis", fragments.get(0).locationText());
        assertEquals("", fragments.get(0).descriptionText());
        assertEquals("Mobile", fragments.get(1).locationText());
    }

    @Test
    void testPlainTextFlagWindow() {
        String flag = "<img src=\"../flags/frenchflag.gif\">";
        String near = "<html><body>" + flag + "<p>Fort Gamma (1760), Detroit</p></body></html>";
        assertEquals(List.of("France"), EntryExtractor.extract(near, "test").get(0).nationalities());

        String filler = "<!-- " + "x".repeat(EntryExtractor.FLAG_WINDOW + 50) + " -->";
        String far = "<html><body>" + flag + filler + "<p>Fort Gamma (1760), Detroit</p></body></html>";
        List<EntryFragment> fragments = EntryExtractor.extract(far, "test");
        assertEquals(1, fragments.size());
        assertTrue(fragments.get(0).nationalities().isEmpty());
    }

    @Test
    void testPlainTextFlagsForEncodedName() {
        String html = "<html><body><p>Fort D&#39;Orleans (1723), Missouri River "
            + "<img src=\"../flags/frenchflag.gif\"></p></body></html>";
        EntryFragment fragment = EntryExtractor.extract(html, "test").get(0);
        assertEquals("Fort D'Orleans", fragment.name());
        assertEquals(List.of("France"), fragment.nationalities());
        assertEquals("<html><body><p>".length(), EntryExtractor.indexOfName(html, "Fort D'Orleans"));
        assertEquals(-1, EntryExtractor.indexOfName(html, "Fort Chartres"));
    }

    @Test
    void testPlainTextDescriptionCap() {
        String html = "<html><body><p>Fort Long (1800), Somewhere</p><p>" + "word ".repeat(400) + "</p></body></html>";
        EntryFragment fragment = EntryExtractor.extract(html, "test").get(0);
        assertEquals(EntryExtractor.FALLBACK_DESCRIPTION_LIMIT, fragment.descriptionText().length());
        assertTrue(fragment.descriptionText().startsWith("word word"));
    }

    @Test
    void testHeadingEndsDescription() {
        String html = "<a name=\"one\">Fort One</a><br><i>(1800), Here</i><br>First post."
            + "<h3>Western Posts</h3><a name=\"two\">Fort Two</a><br><i>(1810), There</i><br>Second post.";
        List<EntryFragment> fragments = EntryExtractor.extract(html, "test");
        assertEquals(2, fragments.size());
        assertEquals("First post.", fragments.get(0).descriptionText());
        assertEquals("Second post.", fragments.get(1).descriptionText());
    }

    @Test
    void testSizedFontEndsDescription() {
        String html = "<a name=\"one\">Fort One</a><br><i>(1800), Here</i><br>First post."
            + "<font size=\"4\">Southern Posts</font><a name=\"two\">Fort Two</a><br><i>(1810), There</i><br>"
            + "Second post with <font color=\"red\">plain</font> styling.";
        List<EntryFragment> fragments = EntryExtractor.extract(html, "test");
        assertEquals(2, fragments.size());
        assertEquals("First post.", fragments.get(0).descriptionText());
        assertEquals("Second post with plain styling.", fragments.get(1).descriptionText());
    }

    @Test
    void testPageWithoutEntries() {
        assertTrue(EntryExtractor.extract(Fixtures.page("no-entries.html"), "test").isEmpty());
        assertTrue(EntryExtractor.extract(null, "test").isEmpty());
        assertTrue(EntryExtractor.extract("   ", "test").isEmpty());
    }
}
