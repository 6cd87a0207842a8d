package uk.gegc.manuscript.features.scrivener.domain.model;

public record ScrivenerStatus(int id, String name) {
}
