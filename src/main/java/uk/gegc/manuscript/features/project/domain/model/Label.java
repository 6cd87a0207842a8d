package uk.gegc.manuscript.features.project.domain.model;

import java.util.List;

/**
 * Project label. {@code color} is a {@code #rrggbb} hex string.
 */
public record Label(String id, String name, String color) {

    public static List<Label> defaults() {
        return List.of(
                new Label("label-chapter", "Chapter", "#4A90D9"),
                new Label("label-scene", "Scene", "#7ED321"),
                new Label("label-idea", "Idea", "#F5A623"),
                new Label("label-revision", "Needs Revision", "#D0021B")
        );
    }
}
