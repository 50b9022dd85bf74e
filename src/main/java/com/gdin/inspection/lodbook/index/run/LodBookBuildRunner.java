package com.gdin.inspection.lodbook.index.run;

import com.gdin.inspection.lodbook.config.properties.LodBookProperties;
import com.gdin.inspection.lodbook.index.pipeline.Pipeline;
import com.gdin.inspection.lodbook.index.pipeline.PipelineFactory;
import com.gdin.inspection.lodbook.index.pipeline.StandardPipelineRegistrar;
import com.gdin.inspection.lodbook.index.pipeline.context.PipelineRunContext;
import com.gdin.inspection.lodbook.index.pipeline.context.PipelineRunResult;
import com.gdin.inspection.lodbook.index.pipeline.context.RunPipeline;
import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.NarrativeDocument;
import com.gdin.inspection.lodbook.models.Record;
import jakarta.annotation.Resource;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class LodBookBuildRunner {
    @Resource
    private LodBookProperties lodBookProperties;

    @Resource
    private BuildContext buildContext;

    @Resource
    private PipelineFactory<BuildContext> factory;

    public List<PipelineRunResult> runStandard(List<NarrativeDocument> documents) {
        return runStandard(buildContext, buildContext.getRecordStore().listAll(), documents);
    }

    public List<PipelineRunResult> runStandard(BuildContext ctx, List<Record> records, List<NarrativeDocument> documents) {
        return runStandard(ctx, records, documents, StandardPipelineRegistrar.PIPELINE_STANDARD);
    }

    public List<PipelineRunResult> runStandard(BuildContext ctx,
                                               List<Record> records,
                                               List<NarrativeDocument> documents,
                                               String pipelineName) {
        PipelineRunContext runContext = new PipelineRunContext();
        runContext.put(StandardPipelineRegistrar.KEY_CONCURRENT_REQUESTS,
                lodBookProperties.getIndex().getConcurrentRequests());
        runContext.put(StandardPipelineRegistrar.KEY_RECORDS, records);
        runContext.put(StandardPipelineRegistrar.KEY_DOCUMENTS, documents);

        Pipeline<BuildContext> pipeline = factory.createPipeline(pipelineName);
        return new RunPipeline<BuildContext>().run(pipeline, ctx, runContext);
    }
}
