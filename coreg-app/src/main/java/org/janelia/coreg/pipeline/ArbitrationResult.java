package org.janelia.coreg.pipeline;

import java.nio.file.Path;

import org.janelia.coreg.convert.ExportedTransforms;
import org.janelia.coreg.selection.SelectionResult;

/**
 * Everything produced by one pipeline run.
 */
public class ArbitrationResult {

    private final SelectionResult selection;
    private final Path selectedTransformCopy;
    private final Path selectedReportCopy;
    private final ExportedTransforms exported;
    private final Path summaryFile;

    public ArbitrationResult(final SelectionResult selection,
                             final Path selectedTransformCopy,
                             final Path selectedReportCopy,
                             final ExportedTransforms exported,
                             final Path summaryFile) {
        this.selection = selection;
        this.selectedTransformCopy = selectedTransformCopy;
        this.selectedReportCopy = selectedReportCopy;
        this.exported = exported;
        this.summaryFile = summaryFile;
    }

    public SelectionResult getSelection() {
        return selection;
    }

    public boolean isRejectRefined() {
        return selection.isRejectRefined();
    }

    public Path getSelectedTransformCopy() {
        return selectedTransformCopy;
    }

    public Path getSelectedReportCopy() {
        return selectedReportCopy;
    }

    public ExportedTransforms getExported() {
        return exported;
    }

    public Path getSummaryFile() {
        return summaryFile;
    }

    @Override
    public String toString() {
        return "{selection: " + selection + ", exported: " + exported + ", summaryFile: " + summaryFile + '}';
    }
}
