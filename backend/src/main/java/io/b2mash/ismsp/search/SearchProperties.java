package io.b2mash.ismsp.search;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param indexEnabled maintain {@code requirement_search_index} when the catalog is a base table
 * @param maxResults cap on returned matches; zero or less means unlimited
 */
@ConfigurationProperties("isms.search")
public record SearchProperties(
    @DefaultValue("true") boolean indexEnabled, @DefaultValue("50") int maxResults) {}
