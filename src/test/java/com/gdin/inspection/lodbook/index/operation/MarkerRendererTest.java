package com.gdin.inspection.lodbook.index.operation;

import com.gdin.inspection.lodbook.LodBookFixtures;
import com.gdin.inspection.lodbook.models.AdvisoryKind;
import com.gdin.inspection.lodbook.models.BuildContext;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class MarkerRendererTest {

    private final MarkerRenderer renderer = new MarkerRenderer();

    @Test
    void testRenderLink() {
        BuildContext ctx = LodBookFixtures.context();
        assertEquals("<a class=\"lod-link\" data-name=\"James Minahan\" data-collection=\"people\" property=\"name\""
                        + " href=\"/lodbook/people/james-minahan/\">Mr Minahan</a>",
                renderer.renderLink(ctx, "James Minahan", "Mr Minahan"));
        // name 为空时用内容查找
        assertEquals("<a class=\"lod-link\" data-name=\"Dublin\" data-collection=\"places\" property=\"name\""
                        + " href=\"/lodbook/places/dublin/\">Dublin</a>",
                renderer.renderLink(ctx, "", "Dublin"));
    }

    @Test
    void testUnresolvedAndMalformed() {
        BuildContext ctx = LodBookFixtures.context();
        assertEquals("the ghost", renderer.renderLink(ctx, "Ghost", "the ghost"));
        assertEquals(1, ctx.getAdvisories().list(AdvisoryKind.UNRESOLVED_REFERENCE).size());

        assertEquals("", renderer.renderLink(ctx, null, ""));
        assertEquals(1, ctx.getAdvisories().list(AdvisoryKind.MALFORMED_MARKER).size());
    }

    @Test
    void testRenderIgnore() {
        assertEquals("<span class=\"lod-ignore\">Dublin</span>", renderer.renderIgnore("Dublin"));
    }
}
