package io.b2mash.ismsp.schema;

import java.util.Optional;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * One known physical layout of the requirement catalog. Probes are tried in a fixed order; the
 * first to return a source wins. A probe may create the compatibility view its layout needs, but
 * only when that view is absent.
 */
public interface SchemaProbe {

  /** Versioned probe name, recorded on the resolved source. */
  String name();

  Optional<RequirementSource> probe(JdbcClient jdbc, SchemaInspector inspector);
}
