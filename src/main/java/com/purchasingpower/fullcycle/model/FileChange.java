package com.purchasingpower.fullcycle.model;

/**
 * Result record for one file the pipeline wrote or deleted.
 */
public record FileChange(String path, int linesAdded, int linesRemoved, boolean isNew) {

    /**
     * Combine two records for the same path (e.g. the plan change and a later review fix).
     * The combined record stays "new" if the first write created the file.
     */
    public FileChange mergedWith(FileChange later) {
        return new FileChange(path, linesAdded + later.linesAdded(),
                linesRemoved + later.linesRemoved(), isNew || later.isNew());
    }
}
