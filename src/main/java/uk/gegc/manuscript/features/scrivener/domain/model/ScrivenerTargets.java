package uk.gegc.manuscript.features.scrivener.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrivenerTargets {

    private Integer draftWordCount;

    private Instant draftDeadline;

    private boolean ignoreDeadline;

    @Builder.Default
    private boolean countIncludedOnly = true;

    private Integer sessionWordCount;

    private String sessionResetType;

    private String sessionResetTime;

    private boolean allowNegatives;
}
