package com.gdin.inspection.lodbook.index.operation;

import com.gdin.inspection.lodbook.LodBookFixtures;
import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.ReferenceIndex;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ReferenceIndexBuilderTest {

    private final MarkerRenderer markerRenderer = new MarkerRenderer();
    private final ReferenceIndexBuilder builder = new ReferenceIndexBuilder();
    private final ParagraphNumberer numberer = new ParagraphNumberer();

    @Test
    void testCollectsMarkedLabels() {
        BuildContext ctx = LodBookFixtures.context();
        Document document = Jsoup.parse("<div id=\"text\">"
                + "<p>" + markerRenderer.renderLink(ctx, "James Minahan", "Mr Minahan") + " and "
                + markerRenderer.renderLink(ctx, null, "James") + "</p>"
                + "<blockquote><p>quoted</p></blockquote>"
                + "<p>" + markerRenderer.renderLink(ctx, "James", "Mr Minahan") + "</p>"
                + "</div>");

        ReferenceIndex index = builder.build(ctx, document);
        assertEquals(2, index.size());
        // 同一标签以最后一次为准
        assertEquals("James", index.get("Mr Minahan").getName());
        assertEquals("people", index.get("James").getCollection());
        assertEquals(List.of("Mr Minahan", "James"), index.labelsByLengthDesc());

        numberer.number(ctx, document);
        assertEquals("para-0", document.select("#text p").get(0).id());
        assertEquals("para-2", document.select("#text p").get(2).id());
        assertEquals("quote-0", document.selectFirst("blockquote").id());
    }
}
