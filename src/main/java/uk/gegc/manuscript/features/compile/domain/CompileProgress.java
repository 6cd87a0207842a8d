package uk.gegc.manuscript.features.compile.domain;

/**
 * Snapshot of a running compile.
 * <p>
 * {@link #overallFraction()} places the phase on one monotonic scale: collecting at 0, processing
 * across [0.05, 0.90], generating at 0.95 and complete at 1.
 */
public record CompileProgress(int currentDocument, int totalDocuments, CompilePhase phase) {

    public static CompileProgress collecting() {
        return new CompileProgress(0, 0, CompilePhase.COLLECTING);
    }

    public static CompileProgress processing(int currentDocument, int totalDocuments) {
        return new CompileProgress(currentDocument, totalDocuments, CompilePhase.PROCESSING);
    }

    public static CompileProgress generating(int totalDocuments) {
        return new CompileProgress(totalDocuments, totalDocuments, CompilePhase.GENERATING);
    }

    public static CompileProgress complete(int totalDocuments) {
        return new CompileProgress(totalDocuments, totalDocuments, CompilePhase.COMPLETE);
    }

    /** Share of documents processed so far. */
    public double fraction() {
        if (totalDocuments <= 0) {
            return 0;
        }
        return Math.min(1.0, (double) currentDocument / totalDocuments);
    }

    public double overallFraction() {
        return switch (phase) {
            case COLLECTING -> 0.0;
            case PROCESSING -> 0.05 + fraction() * 0.85;
            case GENERATING -> 0.95;
            case COMPLETE -> 1.0;
        };
    }

    public String description() {
        return switch (phase) {
            case COLLECTING -> "Collecting documents...";
            case PROCESSING -> "Processing document " + currentDocument + " of " + totalDocuments + "...";
            case GENERATING -> "Generating output...";
            case COMPLETE -> "Complete";
        };
    }
}
