package uk.gegc.manuscript.features.compile.domain;

public enum CompilePhase {
    COLLECTING,
    PROCESSING,
    GENERATING,
    COMPLETE
}
