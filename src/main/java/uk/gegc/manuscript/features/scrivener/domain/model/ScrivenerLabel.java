package uk.gegc.manuscript.features.scrivener.domain.model;

public record ScrivenerLabel(int id, String name, RgbColor color) {
}
