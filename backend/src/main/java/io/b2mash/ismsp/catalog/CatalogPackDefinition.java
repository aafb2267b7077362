package io.b2mash.ismsp.catalog;

import java.util.List;

/** DTO record for deserializing catalog pack JSON files from the classpath. */
public record CatalogPackDefinition(
    String packId, int version, String name, String description, List<Requirement> requirements) {}
