package io.b2mash.ismsp.schema;

import io.b2mash.ismsp.search.SearchProperties;
import io.b2mash.ismsp.store.StoreTemplate;
import io.b2mash.ismsp.store.StoreTimestamps;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Guarantees the canonical store shape before any catalog or evidence work runs. The first call
 * provisions the evidence objects and resolves the requirement source through the probes in their
 * fixed order; the outcome, including "no catalog found", is cached until {@link #refresh()}.
 * Storage failures are not cached, so the next call tries again.
 */
@Service
@EnableConfigurationProperties(SearchProperties.class)
public class SchemaAdapter {

  private static final Logger log = LoggerFactory.getLogger(SchemaAdapter.class);

  static final String CANONICAL_CATALOG_SQL =
      """
      CREATE TABLE isms_requirements (
          id                INTEGER PRIMARY KEY AUTOINCREMENT,
          item_code         TEXT NOT NULL UNIQUE,
          category          TEXT,
          title             TEXT NOT NULL,
          description       TEXT,
          requirement_text  TEXT,
          control_objective TEXT,
          created_at        TEXT NOT NULL DEFAULT (%1$s),
          updated_at        TEXT NOT NULL DEFAULT (%1$s)
      )
      """
          .formatted(StoreTimestamps.SQL_NOW);

  private final StoreTemplate store;
  private final SchemaInspector inspector;
  private final List<SchemaProbe> probes;
  private final EvidenceSchemaProvisioner evidenceProvisioner;
  private final SearchIndexProvisioner searchIndexProvisioner;
  private final SearchProperties searchProperties;

  private volatile SchemaState state;

  public SchemaAdapter(
      StoreTemplate store,
      SchemaInspector inspector,
      List<SchemaProbe> probes,
      EvidenceSchemaProvisioner evidenceProvisioner,
      SearchIndexProvisioner searchIndexProvisioner,
      SearchProperties searchProperties) {
    this.store = store;
    this.inspector = inspector;
    this.probes = List.copyOf(probes);
    this.evidenceProvisioner = evidenceProvisioner;
    this.searchIndexProvisioner = searchIndexProvisioner;
    this.searchProperties = searchProperties;
  }

  public SchemaState ensureSchema() {
    var current = state;
    if (current != null) {
      return current;
    }
    synchronized (this) {
      if (state == null) {
        var adapted = adapt();
        state = adapted;
        discardOnRollback(adapted);
      }
      return state;
    }
  }

  /** Resolved requirement source, or {@code SchemaMissingException} when there is none. */
  public RequirementSource requireSource() {
    return ensureSchema().requireSource();
  }

  /** Drops the cached outcome and adapts again. */
  public synchronized SchemaState refresh() {
    state = null;
    return ensureSchema();
  }

  /**
   * Creates an empty canonical {@code isms_requirements} table when no probe finds a catalog. Used
   * by catalog provisioning only; {@link #ensureSchema()} itself never creates requirement tables.
   */
  public synchronized SchemaState provisionCanonicalCatalog() {
    if (ensureSchema().ready()) {
      return state;
    }
    store.executeWithoutResult(
        "provision-catalog",
        jdbc -> {
          if (inspector.relationKind(jdbc, SchemaNames.REQUIREMENTS).isEmpty()) {
            jdbc.sql(CANONICAL_CATALOG_SQL).update();
            log.info("Created canonical table {}", SchemaNames.REQUIREMENTS);
          }
        });
    return refresh();
  }

  /**
   * When adaptation joined a caller's transaction, whatever it created only exists if that
   * transaction commits; otherwise the cached outcome would describe objects that were rolled back.
   */
  private void discardOnRollback(SchemaState adapted) {
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      return;
    }
    TransactionSynchronizationManager.registerSynchronization(
        new TransactionSynchronization() {
          @Override
          public void afterCompletion(int status) {
            if (status != STATUS_COMMITTED) {
              synchronized (SchemaAdapter.this) {
                if (state == adapted) {
                  state = null;
                  log.debug("Discarded schema state adapted in a rolled back transaction");
                }
              }
            }
          }
        });
  }

  private SchemaState adapt() {
    return store.execute(
        "ensure-schema",
        jdbc -> {
          var provisioned = new ArrayList<String>();
          evidenceProvisioner.ensureTable(jdbc, inspector, provisioned);
          evidenceProvisioner.ensureTouchTrigger(jdbc, inspector, provisioned);

          var source = resolve(jdbc);
          if (source == null) {
            log.warn(
                "No usable requirement catalog in store; catalog operations will report"
                    + " SCHEMA_MISSING until it is provisioned");
            return new SchemaState(null, List.copyOf(provisioned));
          }

          evidenceProvisioner.ensureItemCodeGuard(
              jdbc, inspector, source.relation(), provisioned);
          if (searchProperties.indexEnabled()) {
            source =
                source.withSearchIndex(
                    searchIndexProvisioner.ensure(jdbc, inspector, source, provisioned));
          }

          log.info(
              "Requirement catalog resolved by {} to {} {} (search index: {}), provisioned {}",
              source.probe(),
              source.kind(),
              source.relation(),
              source.searchIndexed(),
              provisioned);
          return new SchemaState(source, List.copyOf(provisioned));
        });
  }

  private RequirementSource resolve(JdbcClient jdbc) {
    for (SchemaProbe probe : probes) {
      var source = probe.probe(jdbc, inspector);
      if (source.isPresent()) {
        return source.get();
      }
      log.debug("Schema probe {} did not match", probe.name());
    }
    return null;
  }
}
