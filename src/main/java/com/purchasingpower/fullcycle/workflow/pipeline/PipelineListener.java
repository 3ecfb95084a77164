package com.purchasingpower.fullcycle.workflow.pipeline;

import com.purchasingpower.fullcycle.workflow.state.PipelineState;

/**
 * Observer of a running pipeline. Purely informational: exceptions thrown here are logged
 * and otherwise ignored.
 */
public interface PipelineListener {

    PipelineListener NONE = new PipelineListener() {
    };

    default void onProgress(String message) {
    }

    default void onStateChange(PipelineState state) {
    }
}
