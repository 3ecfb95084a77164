package com.purchasingpower.fullcycle.service.impl;

import com.purchasingpower.fullcycle.service.ContextProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Used when no retrieval index is wired in; the pipeline then works from the file listing alone.
 */
@Slf4j
@Component
public class NoContextProvider implements ContextProvider {

    @Override
    public String search(String query, int topK, double minSimilarity) {
        log.debug("No context provider configured, returning empty context");
        return "";
    }
}
