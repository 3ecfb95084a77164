package com.purchasingpower.fullcycle.service;

/**
 * Source of retrieved project context (code snippets, docs) for a query.
 */
public interface ContextProvider {

    /**
     * @param topK          maximum number of snippets
     * @param minSimilarity snippets scoring below this are dropped
     * @return context text, empty when nothing relevant was found
     */
    String search(String query, int topK, double minSimilarity);
}
