package com.purchasingpower.fullcycle.workflow.pipeline;

import com.purchasingpower.fullcycle.model.PipelineConfig;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class PipelineRequest {

    @NonNull
    String taskDescription;

    /**
     * Working copy to change; must be a git repository with an origin remote.
     */
    @NonNull
    Path projectRoot;

    @Builder.Default
    PipelineConfig config = PipelineConfig.defaults();

    @Builder.Default
    PlanConfirmation confirmation = PlanConfirmation.autoApprove();

    @Builder.Default
    PipelineListener listener = PipelineListener.NONE;
}
