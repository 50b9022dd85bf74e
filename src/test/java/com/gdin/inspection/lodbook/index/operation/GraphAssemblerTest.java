package com.gdin.inspection.lodbook.index.operation;

import com.gdin.inspection.lodbook.LodBookFixtures;
import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.DocumentGraph;
import com.gdin.inspection.lodbook.models.GraphNode;
import com.gdin.inspection.lodbook.models.Mention;
import com.gdin.inspection.lodbook.models.MentionedBy;
import com.gdin.inspection.lodbook.models.NarrativeDocument;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GraphAssemblerTest {

    private final GraphCompiler graphCompiler = new GraphCompiler();
    private final GraphAssembler assembler = new GraphAssembler(new MentionExtractor());

    private GraphNode dublin(BuildContext ctx) {
        return graphCompiler.hydrate(ctx, ctx.getRecordStore().findByName("Dublin").orElseThrow());
    }

    private NarrativeDocument document(String title, String url, String body, List<Map<String, Object>> mentions) {
        NarrativeDocument document = NarrativeDocument.builder()
                .title(title)
                .chapter("1")
                .url(url)
                .output("<html><body><div id=\"text\">" + body + "</div></body></html>")
                .build();
        document.setGraph(DocumentGraph.builder()
                .id("https://example.org/lodbook" + url)
                .name("Chapter 1: " + title)
                .mentions(mentions)
                .build());
        return document;
    }

    @Test
    void testNoMentionsLeavesNoKey() {
        BuildContext ctx = LodBookFixtures.context();
        GraphNode graph = assembler.assemble(dublin(ctx), List.of(), List.of());
        assertFalse(graph.toGraph().containsKey("mentionedBy"));
        assertTrue(graph.getContexts().isEmpty());
    }

    @Test
    void testAssembleTwiceFails() {
        BuildContext ctx = LodBookFixtures.context();
        GraphNode graph = dublin(ctx);
        assembler.assemble(graph, List.of(MentionedBy.webPage("urn:page", "Page")), List.of());
        assertThrows(IllegalStateException.class, () -> assembler.assemble(graph, List.of(), List.of()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testCollectsFromMentioningDocuments() {
        BuildContext ctx = LodBookFixtures.context();
        GraphNode graph = dublin(ctx);
        String link = new MarkerRenderer().renderLink(ctx, null, "Dublin");

        NarrativeDocument one = document("Arrival", "/chapters/one/",
                "<p id=\"para-0\">Landed in " + link + " at dawn.</p>", List.of(Map.of("@id", graph.getId())));
        NarrativeDocument two = document("Elsewhere", "/chapters/two/",
                "<p id=\"para-0\">Nothing here.</p>", List.of());
        NarrativeDocument three = document("Return", "/chapters/three/",
                "<p id=\"para-0\">Intro.</p><p id=\"para-1\">Back to " + link + ".</p>",
                List.of(Map.of("@id", graph.getId())));

        assembler.assemble(ctx, graph, List.of(one, two, three));

        Map<String, Object> out = graph.toGraph();
        List<Map<String, Object>> mentionedBy = (List<Map<String, Object>>) out.get("mentionedBy");
        assertEquals(2, mentionedBy.size());
        assertEquals(Map.of("id", "https://example.org/lodbook/chapters/one/", "name", "Arrival", "type", "WebPage"),
                mentionedBy.get(0));
        assertEquals("Return", mentionedBy.get(1).get("name"));

        // 多篇文档的上下文累加，不互相覆盖
        List<Mention> contexts = graph.getContexts();
        assertEquals(2, contexts.size());
        assertEquals("Landed in <em>Dublin</em> at dawn.", contexts.get(0).getContext());
        assertEquals("1", contexts.get(1).getParagraphId());
        assertFalse(out.containsKey("contexts"));
    }

    @Test
    void testRejectsUnenrichedDocument() {
        BuildContext ctx = LodBookFixtures.context();
        NarrativeDocument raw = NarrativeDocument.builder().title("Raw").url("/raw/").output("<p></p>").build();
        assertThrows(IllegalStateException.class, () -> assembler.assemble(ctx, dublin(ctx), List.of(raw)));
    }
}
