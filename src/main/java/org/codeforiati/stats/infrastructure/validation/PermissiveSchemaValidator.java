package org.codeforiati.stats.infrastructure.validation;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import org.codeforiati.stats.application.port.SchemaValidationPort;
import org.codeforiati.stats.domain.record.Node;
import org.codeforiati.stats.domain.record.Record;
import org.codeforiati.stats.domain.reference.ReferenceTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SchemaValidationPort} that checks only what every schema version requires of a record's root: an
 * identifier and a reporting organisation.
 *
 * <p>Versions outside the recognised version list have no schema and fail; the legacy {@code 1.01} is always
 * accepted. Deployments with access to the published XSDs plug in a full validator instead.</p>
 *
 * @since 0.1.0
 */
public final class PermissiveSchemaValidator implements SchemaValidationPort {
  private static final Logger log = LoggerFactory.getLogger(PermissiveSchemaValidator.class);

  private final Set<String> schemaVersions;

  /**
   * Creates a validator accepting the recognised versions of {@code tables}.
   *
   * @param tables reference tables supplying the Version codelist
   */
  public PermissiveSchemaValidator(ReferenceTables tables) {
    this(Objects.requireNonNull(tables, "tables").recognisedVersions());
  }

  /**
   * Creates a validator for an explicit set of schema versions.
   *
   * @param schemaVersions versions that have a schema; {@code 1.01} is always included
   */
  public PermissiveSchemaValidator(Set<String> schemaVersions) {
    Set<String> versions = new HashSet<>(Objects.requireNonNull(schemaVersions, "schemaVersions"));
    versions.add("1.01");
    this.schemaVersions = Set.copyOf(versions);
  }

  @Override
  public boolean isValid(Record record, String schemaVersion) {
    if (schemaVersion == null || !schemaVersions.contains(schemaVersion)) {
      log.debug("No schema for version {}", schemaVersion);
      return false;
    }
    Node root = record.element();
    boolean identified = record.isActivity()
        ? root.child("iati-identifier") != null
        : root.child("organisation-identifier") != null || root.child("iati-identifier") != null;
    return identified && root.child("reporting-org") != null;
  }
}
