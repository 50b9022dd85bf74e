package com.gdin.inspection.lodbook.index.pipeline.context;

import com.gdin.inspection.lodbook.index.pipeline.Pipeline;
import com.gdin.inspection.lodbook.index.pipeline.WorkflowFunctionOutput;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 顺序执行各 workflow；前一个 workflow 全部完成后才会开始下一个。
 * 某个 workflow 抛出异常时停止，异常记录在该 workflow 的结果中返回。
 */
@Slf4j
public class RunPipeline<C> {

    public List<PipelineRunResult> run(Pipeline<C> pipeline, C config, PipelineRunContext context) {
        long start = System.nanoTime();
        List<PipelineRunResult> results = new ArrayList<>();
        String last = "<startup>";

        try {
            for (Pipeline.Step<C> step : pipeline) {
                last = step.getName();
                long t0 = System.nanoTime();

                WorkflowFunctionOutput out = step.getFn().run(config, context);

                double sec = (System.nanoTime() - t0) / 1_000_000_000.0;
                context.getStats().getWorkflowSeconds().put(last, sec);
                log.info("workflow {} finished in {}s", last, String.format("%.3f", sec));

                results.add(PipelineRunResult.builder()
                        .workflow(last)
                        .result(out == null ? null : out.getResult())
                        .context(context)
                        .errors(null)
                        .build());
            }

            context.getStats().setTotalSeconds((System.nanoTime() - start) / 1_000_000_000.0);
            return results;

        } catch (Exception e) {
            log.error("error running workflow {}", last, e);
            results.add(PipelineRunResult.builder()
                    .workflow(last)
                    .result(null)
                    .context(context)
                    .errors(List.of(e))
                    .build());
            context.getStats().setTotalSeconds((System.nanoTime() - start) / 1_000_000_000.0);
            return results;
        }
    }
}
