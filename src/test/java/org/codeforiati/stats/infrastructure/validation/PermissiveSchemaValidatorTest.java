package org.codeforiati.stats.infrastructure.validation;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.codeforiati.stats.domain.record.MalformedRecordException;
import org.codeforiati.stats.domain.record.Node;
import org.codeforiati.stats.domain.record.Record;
import org.codeforiati.stats.fixtures.RecordFixtures;
import org.junit.jupiter.api.Test;

class PermissiveSchemaValidatorTest {
  private final PermissiveSchemaValidator validator = new PermissiveSchemaValidator(RecordFixtures.tables());

  @Test
  void identifiedActivityPassesForRecognisedVersion() throws MalformedRecordException {
    Record record = Record.of(RecordFixtures.activity("A-1").build(), "2.03");

    assertTrue(validator.isValid(record, "2.03"));
    assertTrue(validator.isValid(record, "1.01"));
  }

  @Test
  void unknownOrMissingVersionFails() throws MalformedRecordException {
    Record record = Record.of(RecordFixtures.activity("A-1").build(), "2.03");

    assertFalse(validator.isValid(record, "9.99"));
    assertFalse(validator.isValid(record, null));
  }

  @Test
  void activityWithoutIdentifierOrReporterFails() throws MalformedRecordException {
    Record noIdentifier = Record.of(Node.builder("iati-activity")
        .child(Node.builder("reporting-org").attribute("ref", "GB-COH-1")).build(), "2.03");
    Record noReporter = Record.of(Node.builder("iati-activity")
        .child(Node.builder("iati-identifier").text("A-1")).build(), "2.03");

    assertFalse(validator.isValid(noIdentifier, "2.03"));
    assertFalse(validator.isValid(noReporter, "2.03"));
  }

  @Test
  void organisationAcceptsEitherIdentifierElement() throws MalformedRecordException {
    Record organisation = Record.of(RecordFixtures.organisation("GB-COH-1").build(), "2.03");

    assertTrue(validator.isValid(organisation, "2.03"));
  }

  @Test
  void explicitVersionSetAlwaysAcceptsLegacyVersion() throws MalformedRecordException {
    PermissiveSchemaValidator only203 = new PermissiveSchemaValidator(Set.of("2.03"));
    Record record = Record.of(RecordFixtures.activity("A-1").build(), "2.03");

    assertTrue(only203.isValid(record, "1.01"));
    assertFalse(only203.isValid(record, "2.02"));
  }
}
