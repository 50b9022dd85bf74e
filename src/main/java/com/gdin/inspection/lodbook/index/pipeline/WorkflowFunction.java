package com.gdin.inspection.lodbook.index.pipeline;

import com.gdin.inspection.lodbook.index.pipeline.context.PipelineRunContext;

public interface WorkflowFunction<C> {
    WorkflowFunctionOutput run(C config, PipelineRunContext context) throws Exception;
}
