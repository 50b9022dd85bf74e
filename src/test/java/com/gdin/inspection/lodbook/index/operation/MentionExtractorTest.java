package com.gdin.inspection.lodbook.index.operation;

import com.gdin.inspection.lodbook.LodBookFixtures;
import com.gdin.inspection.lodbook.doc.tokenizer.WordTokenizer;
import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.Mention;
import com.gdin.inspection.lodbook.models.NarrativeDocument;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MentionExtractorTest {

    private final MarkerRenderer markerRenderer = new MarkerRenderer();
    private final ParagraphNumberer numberer = new ParagraphNumberer();
    private final ReferenceIndexBuilder referenceIndexBuilder = new ReferenceIndexBuilder();
    private final LabelMarkupEngine engine = new LabelMarkupEngine(new WordTokenizer());
    private final MentionExtractor extractor = new MentionExtractor();

    private NarrativeDocument marked(BuildContext ctx, String body) {
        NarrativeDocument document = NarrativeDocument.builder()
                .title("Arrival")
                .chapter("1")
                .url("/chapters/one/")
                .output("<html><body><div id=\"text\">" + body + "</div></body></html>")
                .build();
        Document html = document.parsed();
        numberer.number(ctx, html);
        engine.markup(ctx, html, referenceIndexBuilder.build(ctx, html));
        return document;
    }

    @Test
    void testContextWindow() {
        BuildContext ctx = LodBookFixtures.context();
        NarrativeDocument document = marked(ctx,
                "<p>Intro text only.</p>"
                        + "<p>I met " + markerRenderer.renderLink(ctx, null, "James Minahan")
                        + " in Dublin. Later James Minahan said hello to James.</p>");

        List<Mention> mentions = extractor.extract(ctx, document, "James Minahan");
        assertEquals(2, mentions.size());

        Mention first = mentions.get(0);
        assertEquals("1", first.getParagraphId());
        assertEquals("Arrival", first.getDocumentTitle());
        assertEquals("1", first.getDocumentChapter());
        assertEquals("/chapters/one/", first.getDocumentUrl());
        assertEquals("I met <em>James Minahan</em> in Dublin. Later James Minahan", first.getContext());

        assertEquals("James Minahan in Dublin. Later <em>James Minahan</em> said hello to James.",
                mentions.get(1).getContext());
    }

    @Test
    void testMentionAtParagraphEdges() {
        BuildContext ctx = LodBookFixtures.context();
        NarrativeDocument document = marked(ctx,
                "<p>" + markerRenderer.renderLink(ctx, null, "Dublin") + "</p>");

        List<Mention> mentions = extractor.extract(ctx, document, "Dublin");
        assertEquals(1, mentions.size());
        assertEquals("<em>Dublin</em>", mentions.get(0).getContext());
        assertEquals("0", mentions.get(0).getParagraphId());
    }

    @Test
    void testContextKeepsQuotes() {
        BuildContext ctx = LodBookFixtures.context();
        NarrativeDocument document = marked(ctx,
                "<p>O'Brien said \"hello\" to " + markerRenderer.renderLink(ctx, null, "James")
                        + " &amp; friends.</p>");

        List<Mention> mentions = extractor.extract(ctx, document, "James");
        assertEquals(1, mentions.size());
        assertEquals("O'Brien said \"hello\" to <em>James</em> &amp; friends.", mentions.get(0).getContext());
    }

    @Test
    void testNoMentions() {
        BuildContext ctx = LodBookFixtures.context();
        NarrativeDocument document = marked(ctx, "<p>Nobody here.</p>");
        assertTrue(extractor.extract(ctx, document, "Dublin").isEmpty());
        assertTrue(extractor.extract(ctx, document, "").isEmpty());
    }
}
