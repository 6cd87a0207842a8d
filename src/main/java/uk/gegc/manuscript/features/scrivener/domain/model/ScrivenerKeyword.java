package uk.gegc.manuscript.features.scrivener.domain.model;

public record ScrivenerKeyword(int id, String name, RgbColor color) {
}
