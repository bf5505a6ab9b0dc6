package org.codeforiati.stats.application.leaf;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.codeforiati.stats.domain.record.IsoDates;
import org.codeforiati.stats.domain.record.Node;
import org.codeforiati.stats.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Derived per-record facts shared by many statistics: effective version and the
 * version-dependent codes for dates, transaction types, sector vocabularies and organisation roles.
 * <p><strong>Why:</strong> Version 1 and version 2 of the standard spell the same concepts differently; resolving
 * them once keeps statistic bodies version-agnostic.</p>
 * <p><strong>Thread-safety:</strong> Immutable once built; confined to one record's evaluation.</p>
 *
 * @since 0.1.0
 */
public final class ActivityFacts {
  private static final Logger log = LoggerFactory.getLogger(ActivityFacts.class);

  private final Node element;
  private final String version;
  private final boolean versionRecognised;
  private final String majorVersion;

  ActivityFacts(LeafContext ctx) {
    this.element = ctx.element();
    String declared = ctx.record().documentVersion();
    this.versionRecognised = declared != null && ctx.tables().recognisedVersions().contains(declared);
    if (versionRecognised) {
      this.version = declared;
    } else {
      this.version = ctx.settings().legacyVersion();
      log.debug("Record {} declares unsupported version {}; assuming {}",
          Logs.identifier(ctx.record().identifier()), declared, version);
    }
    this.majorVersion = version.startsWith("2.") ? "2" : "1";
  }

  /** Effective version: the declared one when recognised, otherwise the legacy default. */
  public String version() {
    return version;
  }

  public boolean versionRecognised() {
    return versionRecognised;
  }

  public String majorVersion() {
    return majorVersion;
  }

  public boolean isV1() {
    return majorVersion.equals("1");
  }

  public String plannedStartCode() {
    return isV1() ? "start-planned" : "1";
  }

  public String actualStartCode() {
    return isV1() ? "start-actual" : "2";
  }

  public String plannedEndCode() {
    return isV1() ? "end-planned" : "3";
  }

  public String actualEndCode() {
    return isV1() ? "end-actual" : "4";
  }

  public String incomingFundsCode() {
    return isV1() ? "IF" : "1";
  }

  public String commitmentCode() {
    return isV1() ? "C" : "2";
  }

  public String disbursementCode() {
    return isV1() ? "D" : "3";
  }

  public String expenditureCode() {
    return isV1() ? "E" : "4";
  }

  public String dac5Code() {
    return isV1() ? "DAC" : "1";
  }

  public String dac3Code() {
    return isV1() ? "DAC-3" : "2";
  }

  public String fundingRoleCode() {
    return isV1() ? "Funding" : "1";
  }

  public String extendingRoleCode() {
    return isV1() ? "Extending" : "3";
  }

  public String implementingRoleCode() {
    return isV1() ? "Implementing" : "4";
  }

  /** Raw identifier text, untrimmed, or {@code null}. */
  public String identifier() {
    Node id = element.child("iati-identifier");
    return id == null ? null : id.text();
  }

  /** Transaction type code, or {@code null} when absent. */
  public String transactionType(Node transaction) {
    Node type = transaction.child("transaction-type");
    return type == null ? null : type.attribute("code");
  }

  /** Transactions whose type code is one of {@code codes}. */
  public List<Node> transactionsOfType(String... codes) {
    List<Node> out = new ArrayList<>();
    for (Node transaction : element.children("transaction")) {
      String type = transactionType(transaction);
      for (String code : codes) {
        if (code.equals(type)) {
          out.add(transaction);
          break;
        }
      }
    }
    return out;
  }

  /** {@code value/@currency} of a budget, transaction or planned disbursement, else the default currency. */
  public String currencyOf(Node financial) {
    String explicit = financial.firstValue("value/@currency");
    return explicit != null ? explicit : element.attribute("default-currency");
  }

  /** Amount of a financial element; missing or malformed values count as zero. */
  public BigDecimal amountOf(Node financial) {
    Node value = financial.child("value");
    if (value == null) {
      return BigDecimal.ZERO;
    }
    BigDecimal parsed = ValueFormats.parseDecimal(value.text());
    if (parsed == null) {
      log.debug("Unparseable value '{}' in {}; counting as zero",
          Logs.truncate(value.text(), 40), Logs.identifier(identifier()));
      return BigDecimal.ZERO;
    }
    return parsed;
  }

  public Integer transactionYear(Node transaction) {
    LocalDate date = IsoDates.transactionDate(transaction);
    return date == null ? null : date.getYear();
  }

  /** Parsed dates of {@code activity-date} elements of the given type, skipping unparseable ones. */
  public List<LocalDate> activityDates(String typeCode) {
    List<LocalDate> out = new ArrayList<>();
    for (Node date : activityDateElements(typeCode)) {
      LocalDate parsed = IsoDates.of(date);
      if (parsed != null) {
        out.add(parsed);
      }
    }
    return out;
  }

  public List<Node> activityDateElements(String typeCode) {
    List<Node> out = new ArrayList<>();
    for (Node date : element.children("activity-date")) {
      if (Objects.equals(typeCode, date.attribute("type"))) {
        out.add(date);
      }
    }
    return out;
  }

  /** Start date: first actual start date element, else first planned start date element. */
  public LocalDate startDate() {
    List<Node> dates = new ArrayList<>(activityDateElements(actualStartCode()));
    dates.addAll(activityDateElements(plannedStartCode()));
    return dates.isEmpty() ? null : IsoDates.of(dates.get(0));
  }

  /** Year of the start date, reading only {@code @iso-date}. */
  public Integer startYear() {
    List<Node> actual = activityDateElements(actualStartCode());
    Node date = !actual.isEmpty() ? actual.get(0) : first(activityDateElements(plannedStartCode()));
    if (date == null) {
      return null;
    }
    String raw = date.attribute("iso-date");
    if (raw == null || raw.isEmpty()) {
      return null;
    }
    LocalDate parsed = IsoDates.parse(raw);
    return parsed == null ? null : parsed.getYear();
  }

  /** End date: first actual end date element, else first planned end date element. */
  public LocalDate endDate() {
    List<Node> actual = activityDateElements(actualEndCode());
    Node date = !actual.isEmpty() ? actual.get(0) : first(activityDateElements(plannedEndCode()));
    return IsoDates.of(date);
  }

  /** First non-empty {@code reporting-org/@ref}, or {@code null}. */
  public String reportingOrgRef() {
    for (Node org : element.children("reporting-org")) {
      String ref = org.attribute("ref");
      if (ref != null && !ref.isEmpty()) {
        return ref;
      }
    }
    return null;
  }

  /**
   * Whether the reporter funds or extends this activity without implementing it.
   */
  public boolean isDonorPublisher() {
    String reporter = element.firstValue("reporting-org/@ref");
    if (reporter == null) {
      return false;
    }
    boolean fundsOrExtends = false;
    boolean implementsIt = false;
    for (Node org : element.children("participating-org")) {
      String role = org.attribute("role");
      if (!reporter.equals(org.attribute("ref"))) {
        continue;
      }
      if (fundingRoleCode().equals(role) || extendingRoleCode().equals(role)) {
        fundsOrExtends = true;
      }
      if (implementingRoleCode().equals(role)) {
        implementsIt = true;
      }
    }
    return fundsOrExtends && !implementsIt;
  }

  /** Whether {@code reporting-org/@secondary-reporter} is set to a true value. */
  public boolean isSecondaryReported() {
    Node reportingOrg = element.child("reporting-org");
    if (reportingOrg == null) {
      return false;
    }
    String secondary = reportingOrg.attribute("secondary-reporter");
    return "1".equals(secondary) || "true".equals(secondary);
  }

  /** Attribute value of {@code budget-not-provided}, or {@code null}. */
  public String budgetNotProvided() {
    return element.attribute("budget-not-provided");
  }

  private static Node first(List<Node> nodes) {
    return nodes.isEmpty() ? null : nodes.get(0);
  }
}
