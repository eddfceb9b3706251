package dev.resumetailor.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A pre-written resume bullet point belonging to one role.
 */
@Value
@Builder
public class BulletRecord {
    String role;
    String bullet;

    // Estimated number of physical lines the bullet takes on the page
    int lines;

    String category;

    @Builder.Default
    List<String> keywords = List.of();
}
