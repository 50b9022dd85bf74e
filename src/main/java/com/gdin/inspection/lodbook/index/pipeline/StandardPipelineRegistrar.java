package com.gdin.inspection.lodbook.index.pipeline;

import com.gdin.inspection.lodbook.index.workflows.AssembleEntityGraphsWorkflow;
import com.gdin.inspection.lodbook.index.workflows.CompileEntityPagesWorkflow;
import com.gdin.inspection.lodbook.index.workflows.EnrichNarrativeDocumentsWorkflow;
import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.EntityPage;
import com.gdin.inspection.lodbook.models.NarrativeDocument;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.Resource;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class StandardPipelineRegistrar {
    public static final String PIPELINE_STANDARD = "standard";

    public static final String KEY_RECORDS = "records";
    public static final String KEY_DOCUMENTS = "documents";
    public static final String KEY_ENRICHED_DOCUMENTS = "enriched_documents";
    public static final String KEY_ENTITY_PAGES = "entity_pages";
    public static final String KEY_CONCURRENT_REQUESTS = "concurrent_requests";
    public static final int DEFAULT_CONCURRENT_REQUESTS = 1;

    @Resource
    private CompileEntityPagesWorkflow compileEntityPagesWorkflow;
    @Resource
    private EnrichNarrativeDocumentsWorkflow enrichNarrativeDocumentsWorkflow;
    @Resource
    private AssembleEntityGraphsWorkflow assembleEntityGraphsWorkflow;

    @Resource
    public PipelineFactory<BuildContext> factory;

    @PostConstruct
    public void init() {

        // 1) compile_entity_pages
        factory.register("compile_entity_pages", (cfg, ctx) -> {
            List<EntityPage> pages = compileEntityPagesWorkflow.run(
                    cfg,
                    ctx.get(KEY_RECORDS),
                    ctx.getOrDefault(KEY_CONCURRENT_REQUESTS, DEFAULT_CONCURRENT_REQUESTS)
            );
            ctx.put(KEY_ENTITY_PAGES, pages);
            return WorkflowFunctionOutput.builder().result("compile_entity_pages_done").build();
        });

        // 2) enrich_narrative_documents
        factory.register("enrich_narrative_documents", (cfg, ctx) -> {
            List<NarrativeDocument> enriched = enrichNarrativeDocumentsWorkflow.run(
                    cfg,
                    ctx.get(KEY_DOCUMENTS),
                    ctx.getOrDefault(KEY_CONCURRENT_REQUESTS, DEFAULT_CONCURRENT_REQUESTS)
            );
            ctx.put(KEY_ENRICHED_DOCUMENTS, enriched);
            return WorkflowFunctionOutput.builder().result("enrich_narrative_documents_done").build();
        });

        // 3) assemble_entity_graphs：必须在全部文档处理完之后
        factory.register("assemble_entity_graphs", (cfg, ctx) -> {
            List<EntityPage> pages = assembleEntityGraphsWorkflow.run(
                    cfg,
                    ctx.get(KEY_ENTITY_PAGES),
                    ctx.get(KEY_ENRICHED_DOCUMENTS),
                    ctx.getOrDefault(KEY_CONCURRENT_REQUESTS, DEFAULT_CONCURRENT_REQUESTS)
            );
            ctx.put(KEY_ENTITY_PAGES, pages);
            return WorkflowFunctionOutput.builder().result("assemble_entity_graphs_done").build();
        });

        factory.registerPipeline(PIPELINE_STANDARD, List.of(
                "compile_entity_pages",
                "enrich_narrative_documents",
                "assemble_entity_graphs"
        ));
    }
}
