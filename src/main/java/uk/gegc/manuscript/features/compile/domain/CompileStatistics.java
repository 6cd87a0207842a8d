package uk.gegc.manuscript.features.compile.domain;

import java.util.List;

public record CompileStatistics(int documentCount, int wordCount, int characterCount, int estimatedPages) {

    /**
     * @param wordsPerPage words assumed on one printed page; the estimate is never below one page
     */
    public static CompileStatistics of(List<CompilableDocument> documents, int wordsPerPage) {
        int words = documents.stream().mapToInt(CompilableDocument::wordCount).sum();
        int characters = documents.stream().mapToInt(CompilableDocument::characterCount).sum();
        int pages = Math.max(1, words / Math.max(1, wordsPerPage));
        return new CompileStatistics(documents.size(), words, characters, pages);
    }
}
