package com.gdin.inspection.lodbook.index.operation;

import com.gdin.inspection.lodbook.LodBookFixtures;
import com.gdin.inspection.lodbook.models.AdvisoryKind;
import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.EntityPage;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EntityPageBuilderTest {

    private final EntityPageBuilder builder = new EntityPageBuilder(new GraphCompiler(), new ImageResolver());

    @Test
    void testBuildPage() {
        BuildContext ctx = LodBookFixtures.context();
        EntityPage page = builder.build(ctx, ctx.getRecordStore().findByName("James Minahan").orElseThrow()).orElseThrow();

        assertEquals("people", page.getCollection());
        assertEquals("person", page.getTemplate());
        assertEquals("people/james-minahan/", page.getDir());
        assertEquals("minahan-portrait.jpg", page.getImageFile());
        assertEquals("https://example.org/lodbook/people/james-minahan/index.html",
                page.getGraph().toGraph().get("mainEntityOfPage"));
    }

    @Test
    void testJsonLdTypedRecord() {
        BuildContext ctx = LodBookFixtures.context(
                "{\"@graph\":[{\"@id\":\"https://x.org/jm\",\"@type\":\"person\",\"name\":\"James Minahan\"}]}");
        EntityPage page = builder.build(ctx, ctx.getRecordStore().findByName("James Minahan").orElseThrow()).orElseThrow();

        assertEquals("people", page.getCollection());
        assertEquals("https://x.org/jm", page.getGraph().getId());
        assertEquals("Person", page.getGraph().getType());
        assertTrue(ctx.getAdvisories().list(AdvisoryKind.UNCONFIGURED_TYPE).isEmpty());
    }

    @Test
    void testUnconfiguredTypeSkipped() {
        BuildContext ctx = LodBookFixtures.context();
        Optional<EntityPage> page = builder.build(ctx, ctx.getRecordStore().findByName("Old Ledger").orElseThrow());
        assertTrue(page.isEmpty());
        assertEquals(1, ctx.getAdvisories().list(AdvisoryKind.UNCONFIGURED_TYPE).size());
    }
}
