package org.codeforiati.stats.domain.reference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Read-only lookup data shared by all statistics: codelists per major version, organisation
 * identifier prefixes, country languages and reference spend.
 * <p><strong>Why:</strong> Built once at start-up and injected explicitly, so no statistic reaches for global
 * state.</p>
 * <p><strong>Role:</strong> Domain value supplied by the composition root; loading from files is the caller's
 * concern.</p>
 * <p><strong>Thread-safety:</strong> Immutable after {@link Builder#build()}; safe for unsynchronised reads.</p>
 *
 * @since 0.1.0
 */
public final class ReferenceTables {
  public static final ReferenceTables EMPTY = builder().build();

  private final Map<String, Map<String, Set<String>>> codelists;
  private final Map<String, List<String>> orgPrefixesByMajor;
  private final Map<String, List<String>> countryLanguages;
  private final Map<String, ReferenceSpend> referenceSpend;
  private final Map<String, String> publisherAliases;
  private final Map<String, List<CodelistMapping>> codelistMappings;

  private ReferenceTables(Builder builder) {
    Map<String, Map<String, Set<String>>> lists = new HashMap<>();
    builder.codelists.forEach((major, byName) -> {
      Map<String, Set<String>> copy = new HashMap<>();
      byName.forEach((name, codes) -> copy.put(name, Set.copyOf(codes)));
      lists.put(major, Collections.unmodifiableMap(copy));
    });
    this.codelists = Collections.unmodifiableMap(lists);
    this.countryLanguages = Map.copyOf(builder.countryLanguages);
    this.publisherAliases = Map.copyOf(builder.publisherAliases);
    Map<String, List<CodelistMapping>> mappings = new HashMap<>();
    builder.codelistMappings.forEach((major, list) -> mappings.put(major, List.copyOf(list)));
    this.codelistMappings = Collections.unmodifiableMap(mappings);
    Map<String, ReferenceSpend> spend = new HashMap<>();
    builder.referenceSpend.forEach((publisher, data) -> spend.put(resolveAlias(publisher), data));
    this.referenceSpend = Collections.unmodifiableMap(spend);
    Map<String, List<String>> prefixes = new HashMap<>();
    for (String major : codelists.keySet()) {
      prefixes.put(major, sortedPrefixes(major));
    }
    this.orgPrefixesByMajor = Collections.unmodifiableMap(prefixes);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the codes of a codelist for a major version.
   *
   * @param majorVersion {@code "1"} or {@code "2"}
   * @param name codelist name, see {@link Codelists}
   * @return code set; empty when the list is unknown
   */
  public Set<String> codelist(String majorVersion, String name) {
    Map<String, Set<String>> byName = codelists.get(majorVersion);
    if (byName == null) {
      return Set.of();
    }
    return byName.getOrDefault(name, Set.of());
  }

  public boolean inCodelist(String majorVersion, String name, String code) {
    return code != null && codelist(majorVersion, name).contains(code);
  }

  /** Recognised standard versions, taken from the version 2 Version codelist. */
  public Set<String> recognisedVersions() {
    return codelist("2", Codelists.VERSION);
  }

  /**
   * Finds the registration agency or CRS channel prefix an organisation identifier starts with.
   *
   * @param majorVersion major version whose codelists apply
   * @param ref organisation identifier
   * @return the longest matching registration agency prefix, else the longest matching channel code
   */
  public Optional<String> validOrgPrefix(String majorVersion, String ref) {
    if (ref == null) {
      return Optional.empty();
    }
    for (String prefix : orgPrefixesByMajor.getOrDefault(majorVersion, List.of())) {
      if (ref.startsWith(prefix)) {
        return Optional.of(prefix);
      }
    }
    return Optional.empty();
  }

  /** Codelist usage locations for a major version, in registration order; empty when none are loaded. */
  public List<CodelistMapping> codelistMappings(String majorVersion) {
    return codelistMappings.getOrDefault(majorVersion, List.of());
  }

  /** ISO 639-1 languages spoken in a country; empty when unknown. */
  public List<String> countryLanguages(String countryCode) {
    return countryCode == null ? List.of() : countryLanguages.getOrDefault(countryCode, List.of());
  }

  /** Reference spend for a publisher, following registry identifier renames. */
  public Optional<ReferenceSpend> referenceSpend(String publisher) {
    return Optional.ofNullable(referenceSpend.get(resolveAlias(publisher)));
  }

  private String resolveAlias(String publisher) {
    return publisherAliases.getOrDefault(publisher, publisher);
  }

  // Registration agencies first, then channel codes; longest first within each group.
  private List<String> sortedPrefixes(String major) {
    Comparator<String> longestFirst = Comparator.comparingInt(String::length).reversed()
        .thenComparing(Comparator.naturalOrder());
    List<String> agencies = new ArrayList<>(codelist(major, Codelists.ORGANISATION_REGISTRATION_AGENCY));
    agencies.sort(longestFirst);
    List<String> channels = new ArrayList<>(codelist(major, Codelists.CRS_CHANNEL_CODE));
    channels.sort(longestFirst);
    LinkedHashSet<String> ordered = new LinkedHashSet<>(agencies);
    ordered.addAll(channels);
    return List.copyOf(ordered);
  }

  /** Mutable builder used by loaders and tests. */
  public static final class Builder {
    private final Map<String, Map<String, Set<String>>> codelists = new HashMap<>();
    private final Map<String, List<String>> countryLanguages = new HashMap<>();
    private final Map<String, ReferenceSpend> referenceSpend = new HashMap<>();
    private final Map<String, String> publisherAliases = new HashMap<>();
    private final Map<String, List<CodelistMapping>> codelistMappings = new HashMap<>();

    private Builder() {}

    public Builder codelist(String majorVersion, String name, Set<String> codes) {
      Objects.requireNonNull(majorVersion, "majorVersion");
      Objects.requireNonNull(name, "name");
      codelists.computeIfAbsent(majorVersion, m -> new HashMap<>()).put(name, Set.copyOf(codes));
      return this;
    }

    /** Registers the same codes for both major versions. */
    public Builder codelist(String name, Set<String> codes) {
      return codelist("1", name, codes).codelist("2", name, codes);
    }

    public Builder countryLanguage(String countryCode, String language) {
      countryLanguages.merge(countryCode, List.of(language), (a, b) -> {
        List<String> merged = new ArrayList<>(a);
        merged.addAll(b);
        return List.copyOf(merged);
      });
      return this;
    }

    public Builder referenceSpend(String publisher, ReferenceSpend data) {
      referenceSpend.put(Objects.requireNonNull(publisher, "publisher"), Objects.requireNonNull(data, "data"));
      return this;
    }

    /** Maps a former publisher registry identifier to its current one. */
    public Builder publisherAlias(String formerId, String currentId) {
      publisherAliases.put(formerId, currentId);
      return this;
    }

    /**
     * Registers where a codelist is used.
     *
     * @throws IllegalArgumentException when the path or condition cannot be evaluated
     */
    public Builder codelistMapping(String majorVersion, String path, String condition) {
      Objects.requireNonNull(majorVersion, "majorVersion");
      codelistMappings.computeIfAbsent(majorVersion, m -> new ArrayList<>()).add(CodelistMapping.of(path, condition));
      return this;
    }

    public ReferenceTables build() {
      return new ReferenceTables(this);
    }
  }
}
