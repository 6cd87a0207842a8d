package uk.gegc.manuscript.features.compile.domain;

public record CompileResult(ExportFile file, CompileStatistics statistics) {
}
