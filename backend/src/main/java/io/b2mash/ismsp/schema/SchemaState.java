package io.b2mash.ismsp.schema;

import io.b2mash.ismsp.exception.SchemaMissingException;
import java.util.List;

/**
 * Outcome of one schema adaptation pass.
 *
 * @param source resolved requirement relation, or {@code null} when no known shape was found
 * @param provisioned objects created by this pass (empty on an already adapted store)
 */
public record SchemaState(RequirementSource source, List<String> provisioned) {

  public boolean ready() {
    return source != null;
  }

  public RequirementSource requireSource() {
    if (source == null) {
      throw new SchemaMissingException(
          "No requirement catalog found: expected table or view '"
              + SchemaNames.REQUIREMENTS
              + "' or the '"
              + SchemaNames.CONTROLS
              + "'/'"
              + SchemaNames.CONTROL_SECTIONS
              + "' tables");
    }
    return source;
  }
}
