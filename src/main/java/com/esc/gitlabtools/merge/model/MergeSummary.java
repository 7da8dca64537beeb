package com.esc.gitlabtools.merge.model;

import lombok.Data;

@Data
public class MergeSummary {
    private int merged;
    private int skipped;
    private int errors;

    public void incrementMerged() {
        merged++;
    }

    public void incrementSkipped() {
        skipped++;
    }

    public void incrementErrors() {
        errors++;
    }

    public boolean hasErrors() {
        return errors > 0;
    }
}
