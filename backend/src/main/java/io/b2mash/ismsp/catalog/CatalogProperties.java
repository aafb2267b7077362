package io.b2mash.ismsp.catalog;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param seedOnStartup load the classpath catalog packs into an empty store at startup
 * @param packLocation resource pattern of the pack files
 */
@ConfigurationProperties("isms.catalog")
public record CatalogProperties(
    @DefaultValue("true") boolean seedOnStartup,
    @DefaultValue("classpath:catalog-packs/*/pack.json") String packLocation) {}
