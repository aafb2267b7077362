package io.b2mash.ismsp.schema;

public enum RelationKind {
  TABLE,
  VIEW;

  static RelationKind fromSqliteType(String type) {
    return "view".equalsIgnoreCase(type) ? VIEW : TABLE;
  }
}
