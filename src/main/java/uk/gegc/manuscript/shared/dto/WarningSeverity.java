package uk.gegc.manuscript.shared.dto;

public enum WarningSeverity {
    INFO,
    WARNING,
    ERROR
}
