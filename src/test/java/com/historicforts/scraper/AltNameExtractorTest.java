package com.historicforts.scraper;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AltNameExtractorTest {

    @Test
    void testPhrasePatterns() {
        String text = "Originally known as **Fort Hill**, later renamed **Fort Adams** in 1820.";
        assertEquals(List.of("Fort Hill", "Fort Adams"), AltNameExtractor.fromText(text));
    }

    @Test
    void testBareEmphasisOnlyWithoutPhraseMatches() {
        assertEquals(List.of("Camp Smith"), AltNameExtractor.fromText("The post **Camp Smith** was built here."));
        assertEquals(List.of("Fort A"), AltNameExtractor.fromText("Also known as **Fort A**. See **Fort B** nearby."));
    }

    @Test
    void testLeadingArticleRejected() {
        assertEquals(List.of("Theodore Post"), AltNameExtractor.fromText("**The Old Fort** and **Theodore Post**"));
    }

    @Test
    void testFromHtml() {
        String html = "<b>Fort Hill</b> and <STRONG>Camp Ord</STRONG>, <b>see below</b>, <b>Ft</b>, "
            + "<b>Click Here</b>, <b>lower case</b>, <b>Fort Hill</b>";
        assertEquals(List.of("Fort Hill", "Camp Ord"), AltNameExtractor.fromHtml(html));
    }

    @Test
    void testFromHtmlDecodesEntities() {
        assertEquals(List.of("Fort Hill"), AltNameExtractor.fromHtml("<b>Fort&nbsp;Hill</b>"));
    }

    @Test
    void testEmptyInput() {
        assertTrue(AltNameExtractor.fromText(null).isEmpty());
        assertTrue(AltNameExtractor.fromHtml("").isEmpty());
    }
}
