package uk.gegc.manuscript.features.project.domain.model;

import java.util.List;

public record Status(String id, String name) {

    public static List<Status> defaults() {
        return List.of(
                new Status("status-todo", "To Do"),
                new Status("status-progress", "In Progress"),
                new Status("status-draft", "First Draft"),
                new Status("status-revised", "Revised"),
                new Status("status-done", "Done")
        );
    }
}
