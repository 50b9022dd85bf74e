package com.gdin.inspection.lodbook.index.pipeline;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WorkflowFunctionOutput {
    Object result;
}
