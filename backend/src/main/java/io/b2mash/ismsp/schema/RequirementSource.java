package io.b2mash.ismsp.schema;

/**
 * The relation every catalog read goes through, as resolved by a {@link SchemaProbe}. It always
 * exposes the canonical columns {@code item_code, category, title, description, requirement_text,
 * control_objective}.
 *
 * @param probe name of the probe that resolved it, e.g. {@code canonical/v1}
 * @param relation table or view name, drawn from a fixed set of identifiers
 * @param kind whether writes can target the relation directly
 * @param searchIndexed whether a synchronized search index mirrors the relation
 */
public record RequirementSource(
    String probe, String relation, RelationKind kind, boolean searchIndexed) {

  public boolean writable() {
    return kind == RelationKind.TABLE;
  }

  RequirementSource withSearchIndex(boolean indexed) {
    return new RequirementSource(probe, relation, kind, indexed);
  }
}
