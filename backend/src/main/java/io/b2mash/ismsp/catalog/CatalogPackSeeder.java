package io.b2mash.ismsp.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.ismsp.schema.SchemaAdapter;
import io.b2mash.ismsp.store.StoreTemplate;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Service;

/**
 * Loads catalog packs from {@code classpath:catalog-packs/&#42;/pack.json} into a store that has
 * no requirements yet. A missing catalog is provisioned as the canonical table first; a catalog
 * that already holds rows, or that is a compatibility view, is left alone. Safe on every boot.
 */
@Service
@EnableConfigurationProperties(CatalogProperties.class)
public class CatalogPackSeeder {

  private static final Logger log = LoggerFactory.getLogger(CatalogPackSeeder.class);

  private final ResourcePatternResolver resourceResolver;
  private final ObjectMapper objectMapper;
  private final SchemaAdapter schemaAdapter;
  private final RequirementCatalog catalog;
  private final StoreTemplate store;
  private final CatalogProperties properties;

  public CatalogPackSeeder(
      ResourcePatternResolver resourceResolver,
      ObjectMapper objectMapper,
      SchemaAdapter schemaAdapter,
      RequirementCatalog catalog,
      StoreTemplate store,
      CatalogProperties properties) {
    this.resourceResolver = resourceResolver;
    this.objectMapper = objectMapper;
    this.schemaAdapter = schemaAdapter;
    this.catalog = catalog;
    this.store = store;
    this.properties = properties;
  }

  /**
   * @return number of requirements inserted
   */
  public int seed() {
    var packs = loadPacks();
    if (packs.isEmpty()) {
      log.info("No catalog packs found at {}", properties.packLocation());
      return 0;
    }

    var source = schemaAdapter.provisionCanonicalCatalog().requireSource();
    if (!source.writable()) {
      log.info(
          "Catalog is the read-only view {} (resolved by {}), skipping pack seeding",
          source.relation(),
          source.probe());
      return 0;
    }

    return store.execute(
        "catalog.seed",
        jdbc -> {
          long existing = catalog.count(null);
          if (existing > 0) {
            log.info("Catalog already holds {} requirements, skipping pack seeding", existing);
            return 0;
          }
          int inserted = 0;
          for (CatalogPackDefinition pack : packs) {
            for (Requirement requirement : pack.requirements()) {
              catalog.save(requirement);
              inserted++;
            }
            log.info(
                "Applied catalog pack {} v{} ({} requirements)",
                pack.packId(),
                pack.version(),
                pack.requirements().size());
          }
          return inserted;
        });
  }

  List<CatalogPackDefinition> loadPacks() {
    try {
      Resource[] resources = resourceResolver.getResources(properties.packLocation());
      return Arrays.stream(resources)
          .map(
              resource -> {
                try {
                  return objectMapper.readValue(
                      resource.getInputStream(), CatalogPackDefinition.class);
                } catch (Exception e) {
                  throw new IllegalStateException(
                      "Failed to parse catalog pack: " + resource.getFilename(), e);
                }
              })
          .toList();
    } catch (IOException e) {
      log.warn("Failed to scan for catalog packs at {}", properties.packLocation(), e);
      return List.of();
    }
  }
}
