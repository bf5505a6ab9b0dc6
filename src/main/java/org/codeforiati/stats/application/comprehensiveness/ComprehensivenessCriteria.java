package org.codeforiati.stats.application.comprehensiveness;

import static org.codeforiati.stats.application.comprehensiveness.ComprehensivenessCriterion.presenceOnly;
import static org.codeforiati.stats.application.comprehensiveness.ComprehensivenessCriterion.refined;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.codeforiati.stats.application.leaf.ActivityFacts;
import org.codeforiati.stats.application.leaf.LeafContext;
import org.codeforiati.stats.application.leaf.ValueFormats;
import org.codeforiati.stats.domain.record.Node;
import org.codeforiati.stats.domain.reference.Codelists;

/**
 * <strong>What:</strong> The fixed battery of comprehensiveness criteria for activities, in reporting order.
 * <p><strong>Role:</strong> Presence tests check that a field exists; validity tests additionally check dates,
 * decimals, codelist membership and percentage splits. Three criteria carry denominator overrides:
 * {@code recipient_language}, {@code transaction_spend} and {@code transaction_traceability}.</p>
 * <p><strong>Thread-safety:</strong> Stateless predicates; reference data comes from the context.</p>
 *
 * @since 0.1.0
 */
public final class ComprehensivenessCriteria {
  private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);
  private static final String COMMITMENT_V2_ALIAS = "11";
  private static final String INCOMING_COMMITMENT = "13";
  private static final String WEBSITE_CATEGORY = "A12";
  private static final long SPEND_DENOMINATOR_DAYS = 365;

  /** All criteria in reporting order. */
  public static final List<ComprehensivenessCriterion> ALL = List.of(
      refined("version", ComprehensivenessCriteria::hasDocumentVersion, ComprehensivenessCriteria::knownDocumentVersion),
      presenceOnly("reporting-org", ctx -> ctx.element().has("reporting-org/@ref") && hasNarrative(ctx, "reporting-org")),
      refined("iati-identifier", ComprehensivenessCriteria::hasIdentifierText,
          ComprehensivenessCriteria::identifierPrefixedByReporter),
      refined("participating-org", ctx -> ctx.element().child("participating-org") != null,
          ctx -> ctx.element().values("participating-org/@role").contains(ctx.facts().fundingRoleCode())),
      presenceOnly("title", ctx -> hasNarrative(ctx, "title")),
      presenceOnly("description", ctx -> hasNarrative(ctx, "description")),
      refined("activity-status", ctx -> ctx.element().child("activity-status") != null,
          ctx -> allInCodelist(ctx, ctx.element().values("activity-status/@code"), Codelists.ACTIVITY_STATUS)),
      refined("activity-date", ctx -> ctx.element().child("activity-date") != null,
          ComprehensivenessCriteria::startDatedAndValid),
      refined("sector", ComprehensivenessCriteria::hasSector,
          ctx -> percentagesSumTo100(ctx.element().children("sector"), true)),
      refined("country_or_region", ComprehensivenessCriteria::hasCountryOrRegion,
          ctx -> percentagesSumTo100(countriesAndRegions(ctx.element()), false)),
      refined("transaction_commitment", ctx -> !commitments(ctx).isEmpty(),
          ctx -> transactionsValuedAndDated(commitments(ctx))),
      refined("transaction_spend", ctx -> !spends(ctx).isEmpty(), ctx -> transactionsValuedAndDated(spends(ctx)))
          .withDenominator(ComprehensivenessCriteria::startedOverAYearAgo),
      refined("transaction_currency", ComprehensivenessCriteria::transactionsCarryCurrency,
          ComprehensivenessCriteria::transactionCurrenciesValid),
      presenceOnly("transaction_traceability", ComprehensivenessCriteria::traceable)
          .withDenominator(ComprehensivenessCriteria::traceabilityApplies),
      refined("budget", ctx -> ctx.element().child("budget") != null, ComprehensivenessCriteria::budgetsValid),
      refined("budget_not_provided", ctx -> ctx.facts().budgetNotProvided() != null,
          ctx -> ctx.tables().inCodelist(ctx.facts().majorVersion(), Codelists.BUDGET_NOT_PROVIDED,
              ctx.facts().budgetNotProvided())),
      presenceOnly("contact-info", ctx -> !ctx.element().select("contact-info/email").isEmpty()),
      presenceOnly("location", ComprehensivenessCriteria::hasLocation),
      refined("location_point_pos", ctx -> !ctx.element().select("location/point/pos").isEmpty(),
          ctx -> allMatch(ctx.element().values("location/point/pos"), ValueFormats::validCoordinates)),
      refined("sector_dac", ComprehensivenessCriteria::hasDacSector, ComprehensivenessCriteria::dacSectorCodesValid),
      presenceOnly("capital-spend", ctx -> ctx.element().has("capital-spend/@percentage")),
      refined("document-link", ctx -> ctx.element().child("document-link") != null,
          ComprehensivenessCriteria::documentLinksValid),
      refined("activity-website", ctx -> !websites(ctx).isEmpty(),
          ctx -> allMatch(websites(ctx), ValueFormats::validUrl)),
      presenceOnly("recipient_language", ComprehensivenessCriteria::recipientLanguageUsed)
          .withDenominator(ctx -> ctx.element().children("recipient-country").size() == 1),
      presenceOnly("conditions_attached", ctx -> ctx.element().has("conditions/@attached")),
      presenceOnly("result_indicator", ctx -> !ctx.element().select("result/indicator").isEmpty()),
      refined("aid_type", ComprehensivenessCriteria::hasAidType, ComprehensivenessCriteria::aidTypesValid));

  private ComprehensivenessCriteria() {
    // Utility
  }

  // version

  private static boolean hasDocumentVersion(LeafContext ctx) {
    return ctx.record().documentVersion() != null;
  }

  private static boolean knownDocumentVersion(LeafContext ctx) {
    return ctx.tables().inCodelist(ctx.facts().majorVersion(), Codelists.VERSION, ctx.record().documentVersion());
  }

  // identification

  private static boolean hasIdentifierText(LeafContext ctx) {
    for (String text : ctx.element().values("iati-identifier")) {
      if (!text.isEmpty()) {
        return true;
      }
    }
    return false;
  }

  /** Version 1 data passes automatically. */
  private static boolean identifierPrefixedByReporter(LeafContext ctx) {
    ActivityFacts facts = ctx.facts();
    if (facts.isV1()) {
      return true;
    }
    String identifier = facts.identifier();
    if (identifier == null) {
      return false;
    }
    Node reportingOrg = ctx.element().child("reporting-org");
    String ref = reportingOrg == null ? null : reportingOrg.attribute("ref");
    if (ref != null && !ref.isEmpty() && identifier.startsWith(ref)) {
      return true;
    }
    for (Node other : ctx.element().children("other-identifier")) {
      String previousRef = other.attribute("ref");
      if ("B1".equals(other.attribute("type")) && previousRef != null && identifier.startsWith(previousRef)) {
        return true;
      }
    }
    return false;
  }

  /** Narrative text: {@code narrative} children for version 2, element text for version 1. */
  private static boolean hasNarrative(LeafContext ctx, String tag) {
    String major = ctx.facts().majorVersion();
    String path = switch (major) {
      case "2" -> tag + "/narrative";
      case "1" -> tag;
      default -> null;
    };
    if (path == null) {
      return false;
    }
    for (String text : ctx.element().values(path)) {
      if (!text.isEmpty()) {
        return true;
      }
    }
    return false;
  }

  // dates

  private static boolean startDatedAndValid(LeafContext ctx) {
    ActivityFacts facts = ctx.facts();
    boolean hasStart = !facts.activityDateElements(facts.plannedStartCode()).isEmpty()
        || !facts.activityDateElements(facts.actualStartCode()).isEmpty();
    return hasStart && allMatch(ctx.element().children("activity-date"), ValueFormats::validDate);
  }

  private static boolean startedOverAYearAgo(LeafContext ctx) {
    LocalDate start = ctx.facts().startDate();
    LocalDate today = ctx.today();
    return start != null && start.isBefore(today) && ChronoUnit.DAYS.between(start, today) > SPEND_DENOMINATOR_DAYS;
  }

  // classifications

  private static boolean hasSector(LeafContext ctx) {
    Node activity = ctx.element();
    if (activity.child("sector") != null) {
      return true;
    }
    return !ctx.facts().isV1() && allMatch(activity.children("transaction"), t -> t.child("sector") != null);
  }

  private static boolean hasCountryOrRegion(LeafContext ctx) {
    Node activity = ctx.element();
    if (!countriesAndRegions(activity).isEmpty()) {
      return true;
    }
    return !ctx.facts().isV1() && allMatch(activity.children("transaction"), t -> !countriesAndRegions(t).isEmpty());
  }

  private static List<Node> countriesAndRegions(Node parent) {
    List<Node> out = new ArrayList<>();
    for (Node child : parent.children()) {
      if (child.tag().equals("recipient-country") || child.tag().equals("recipient-region")) {
        out.add(child);
      }
    }
    return out;
  }

  /**
   * Percentage splits must total exactly 100 unless a group has a single entry; no entries passes.
   * Missing or malformed percentages count as zero.
   */
  static boolean percentagesSumTo100(List<Node> elements, boolean byVocabulary) {
    Map<String, List<Node>> groups = new LinkedHashMap<>();
    for (Node element : elements) {
      String key = byVocabulary ? element.attribute("vocabulary") : "";
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(element);
    }
    for (List<Node> group : groups.values()) {
      if (group.size() == 1) {
        continue;
      }
      BigDecimal total = BigDecimal.ZERO;
      for (Node element : group) {
        total = total.add(ValueFormats.decimalOrZero(element.attribute("percentage")));
      }
      if (total.compareTo(ONE_HUNDRED) != 0) {
        return false;
      }
    }
    return true;
  }

  private static List<Node> dacSectors(LeafContext ctx, Node parent, boolean includeCategories) {
    ActivityFacts facts = ctx.facts();
    List<Node> out = new ArrayList<>();
    for (Node sector : parent.children("sector")) {
      String vocabulary = sector.attribute("vocabulary");
      if (vocabulary == null || vocabulary.equals(facts.dac5Code())
          || (includeCategories && vocabulary.equals(facts.dac3Code()))) {
        out.add(sector);
      }
    }
    return out;
  }

  private static boolean hasDacSector(LeafContext ctx) {
    if (!dacSectors(ctx, ctx.element(), true).isEmpty()) {
      return true;
    }
    return !ctx.facts().isV1()
        && allMatch(ctx.element().children("transaction"), t -> !dacSectors(ctx, t, true).isEmpty());
  }

  private static boolean dacSectorCodesValid(LeafContext ctx) {
    ActivityFacts facts = ctx.facts();
    String major = facts.majorVersion();
    for (Node sector : ctx.element().children("sector")) {
      String vocabulary = sector.attribute("vocabulary");
      String code = sector.attribute("code");
      if (vocabulary == null || vocabulary.equals(facts.dac5Code())) {
        if (!ctx.tables().inCodelist(major, Codelists.SECTOR, code)) {
          return false;
        }
      } else if (vocabulary.equals(facts.dac3Code())) {
        if (!ctx.tables().inCodelist(major, Codelists.SECTOR_CATEGORY, code)) {
          return false;
        }
      }
    }
    return true;
  }

  // transactions

  private static List<Node> commitments(LeafContext ctx) {
    return ctx.facts().transactionsOfType(ctx.facts().commitmentCode(), COMMITMENT_V2_ALIAS);
  }

  private static List<Node> spends(LeafContext ctx) {
    return ctx.facts().transactionsOfType(ctx.facts().disbursementCode(), ctx.facts().expenditureCode());
  }

  private static boolean transactionsValuedAndDated(List<Node> transactions) {
    if (transactions.isEmpty()) {
      return false;
    }
    for (Node transaction : transactions) {
      if (!ValueFormats.validValue(transaction.child("value"))) {
        return false;
      }
      boolean dated = false;
      for (Node child : transaction.children()) {
        if (child.tag().equals("transaction-date") || child.tag().equals("value")) {
          dated |= ValueFormats.validDate(child);
        }
      }
      if (!dated) {
        return false;
      }
    }
    return true;
  }

  private static boolean transactionsCarryCurrency(LeafContext ctx) {
    boolean defaultCurrency = ctx.element().hasAttribute("default-currency");
    return allMatch(ctx.element().children("transaction"),
        t -> t.has("value/@value-date") && (defaultCurrency || t.has("value/@currency")));
  }

  private static boolean transactionCurrenciesValid(LeafContext ctx) {
    String major = ctx.facts().majorVersion();
    String defaultCurrency = ctx.element().attribute("default-currency");
    for (Node transaction : ctx.element().children("transaction")) {
      if (!allMatchOrEmpty(transaction.children("value"), ValueFormats::validDate)) {
        return false;
      }
      List<String> currencies = new ArrayList<>(transaction.values("value/@currency"));
      if (defaultCurrency != null) {
        currencies.add(defaultCurrency);
      }
      for (String currency : currencies) {
        if (!ctx.tables().inCodelist(major, Codelists.CURRENCY, currency)) {
          return false;
        }
      }
    }
    return true;
  }

  private static List<Node> fundsReceived(LeafContext ctx) {
    return ctx.facts().transactionsOfType(ctx.facts().incomingFundsCode(), COMMITMENT_V2_ALIAS, INCOMING_COMMITMENT);
  }

  private static boolean traceable(LeafContext ctx) {
    boolean linked = allMatch(fundsReceived(ctx), t -> t.has("provider-org/@provider-activity-id"));
    return linked || ctx.facts().isDonorPublisher();
  }

  private static boolean traceabilityApplies(LeafContext ctx) {
    return !fundsReceived(ctx).isEmpty() || ctx.facts().isDonorPublisher();
  }

  // budgets

  private static boolean budgetsValid(LeafContext ctx) {
    for (Node budget : ctx.element().children("budget")) {
      Node value = budget.child("value");
      boolean valid = ValueFormats.validDate(budget.child("period-start"))
          && ValueFormats.validDate(budget.child("period-end"))
          && ValueFormats.validDate(value)
          && ValueFormats.validValue(value);
      if (!valid) {
        return false;
      }
    }
    return true;
  }

  // geography and documents

  private static boolean hasLocation(LeafContext ctx) {
    Node activity = ctx.element();
    return !activity.select("location/point/pos").isEmpty()
        || !activity.select("location/name").isEmpty()
        || !activity.select("location/description").isEmpty()
        || !activity.select("location/location-administrative").isEmpty();
  }

  private static boolean documentLinksValid(LeafContext ctx) {
    String major = ctx.facts().majorVersion();
    return allMatch(ctx.element().children("document-link"), link -> {
      Node category = link.child("category");
      return ValueFormats.validUrl(link)
          && category != null
          && ctx.tables().inCodelist(major, Codelists.DOCUMENT_CATEGORY, category.attribute("code"));
    });
  }

  /** Version 1 uses {@code activity-website}; version 2 uses document links in the website category. */
  private static List<Node> websites(LeafContext ctx) {
    if (ctx.facts().isV1()) {
      return ctx.element().children("activity-website");
    }
    List<Node> out = new ArrayList<>();
    for (Node link : ctx.element().children("document-link")) {
      if (link.values("category/@code").contains(WEBSITE_CATEGORY)) {
        out.add(link);
      }
    }
    return out;
  }

  /**
   * With exactly one recipient country, a language of that country must appear in both a title and a
   * description.
   */
  private static boolean recipientLanguageUsed(LeafContext ctx) {
    Node activity = ctx.element();
    List<Node> countries = activity.children("recipient-country");
    if (countries.size() != 1) {
      return false;
    }
    String code = countries.get(0).attribute("code");
    Set<String> countryLanguages = code == null ? Set.of() : new HashSet<>(ctx.tables().countryLanguages(code));
    return usesAny(ctx, "title", countryLanguages) && usesAny(ctx, "description", countryLanguages);
  }

  private static boolean usesAny(LeafContext ctx, String tag, Set<String> languages) {
    for (Node element : ctx.element().children(tag)) {
      for (String language : languages(ctx, element)) {
        if (languages.contains(language)) {
          return true;
        }
      }
    }
    return false;
  }

  /** Declared languages of a title or description, falling back to the activity default language. */
  static Set<String> languages(LeafContext ctx, Node textElement) {
    String defaultLanguage = ctx.element().attribute(Node.XML_LANG);
    Set<String> out = new HashSet<>();
    if ("2".equals(ctx.facts().majorVersion())) {
      for (Node narrative : textElement.children("narrative")) {
        String language = narrative.attribute(Node.XML_LANG);
        if (language != null) {
          out.add(language);
        } else if (defaultLanguage != null) {
          out.add(defaultLanguage);
        }
      }
    } else {
      String language = textElement.attribute(Node.XML_LANG);
      if (language != null) {
        out.add(language);
      } else if (defaultLanguage != null) {
        out.add(defaultLanguage);
      }
    }
    return out;
  }

  // aid type

  private static boolean hasAidType(LeafContext ctx) {
    Node activity = ctx.element();
    if (allMatch(activity.values("default-aid-type/@code"), code -> !code.isEmpty())) {
      return true;
    }
    return allMatch(activity.children("transaction"), t -> t.has("aid-type/@code"));
  }

  private static boolean aidTypesValid(LeafContext ctx) {
    String major = ctx.facts().majorVersion();
    Node activity = ctx.element();
    if (allMatch(activity.values("default-aid-type/@code"),
        code -> ctx.tables().inCodelist(major, Codelists.AID_TYPE, code))) {
      return true;
    }
    return allMatch(activity.children("transaction"), t -> {
      for (String code : t.values("aid-type/@code")) {
        if (ctx.tables().inCodelist(major, Codelists.AID_TYPE, code)) {
          return true;
        }
      }
      return false;
    });
  }

  // helpers

  /** True when {@code items} is non-empty and every item passes. */
  private static <T> boolean allMatch(List<T> items, Predicate<T> test) {
    return !items.isEmpty() && allMatchOrEmpty(items, test);
  }

  /** True when {@code codes} is non-empty and every code is on the named codelist for the record's major version. */
  private static boolean allInCodelist(LeafContext ctx, List<String> codes, String codelist) {
    String major = ctx.facts().majorVersion();
    return allMatch(codes, code -> ctx.tables().inCodelist(major, codelist, code));
  }

  private static <T> boolean allMatchOrEmpty(List<T> items, Predicate<T> test) {
    for (T item : items) {
      if (!test.test(item)) {
        return false;
      }
    }
    return true;
  }
}
