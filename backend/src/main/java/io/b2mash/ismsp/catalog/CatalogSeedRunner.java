package io.b2mash.ismsp.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Seeds the requirement catalog at startup when {@code isms.catalog.seed-on-startup} is set. */
@Component
@Order(100)
public class CatalogSeedRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(CatalogSeedRunner.class);

  private final CatalogPackSeeder seeder;
  private final CatalogProperties properties;

  public CatalogSeedRunner(CatalogPackSeeder seeder, CatalogProperties properties) {
    this.seeder = seeder;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (!properties.seedOnStartup()) {
      log.info("Catalog seeding disabled");
      return;
    }
    try {
      int inserted = seeder.seed();
      log.info("Catalog seeding completed: {} requirements inserted", inserted);
    } catch (RuntimeException e) {
      // The service still starts; catalog operations report SCHEMA_MISSING until fixed.
      log.error("Catalog seeding failed", e);
    }
  }
}
