package org.codeforiati.stats.application.leaf;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.codeforiati.stats.application.comprehensiveness.ComprehensivenessEngine;
import org.codeforiati.stats.application.group.CorpusStatistics;
import org.codeforiati.stats.application.group.FileStatistics;
import org.codeforiati.stats.application.group.GroupContext;
import org.codeforiati.stats.application.group.PublisherStatistics;
import org.codeforiati.stats.application.group.PublisherTimeliness;
import org.codeforiati.stats.domain.record.RecordKind;
import org.codeforiati.stats.domain.stats.AggregationMode;
import org.codeforiati.stats.domain.stats.HierarchyLevel;
import org.codeforiati.stats.domain.stats.Shape;
import org.codeforiati.stats.domain.stats.StatisticDeclaration;

/**
 * <strong>What:</strong> Explicit catalogue of every declared statistic: leaf statistics per record kind and group
 * statistics per hierarchy level.
 * <p><strong>Why:</strong> Evaluation iterates declarations built at start-up; aggregation consults declared modes
 * to exclude {@link AggregationMode#NO_AGGREGATION} values from folds.</p>
 * <p><strong>Thread-safety:</strong> Immutable after {@link Builder#build()}.</p>
 *
 * @since 0.1.0
 */
public final class StatisticRegistry {
  private final Map<RecordKind, Map<String, StatisticDeclaration<LeafContext>>> leaf;
  private final Map<HierarchyLevel, List<StatisticDeclaration<GroupContext>>> group;
  private final Map<String, AggregationMode> modes;
  private final Map<String, Shape> shapes;

  private StatisticRegistry(Builder builder) {
    Map<RecordKind, Map<String, StatisticDeclaration<LeafContext>>> leafCopy = new EnumMap<>(RecordKind.class);
    builder.leaf.forEach((kind, byName) -> leafCopy.put(kind, Collections.unmodifiableMap(new LinkedHashMap<>(byName))));
    this.leaf = Collections.unmodifiableMap(leafCopy);
    Map<HierarchyLevel, List<StatisticDeclaration<GroupContext>>> groupCopy = new EnumMap<>(HierarchyLevel.class);
    builder.group.forEach((level, declarations) -> groupCopy.put(level, List.copyOf(declarations.values())));
    this.group = Collections.unmodifiableMap(groupCopy);
    this.modes = Map.copyOf(builder.modes);
    this.shapes = Map.copyOf(builder.shapes);
  }

  /** Registry with every built-in statistic. */
  public static StatisticRegistry standard() {
    List<StatisticDeclaration<LeafContext>> common = CommonStatistics.declarations();
    return builder()
        .leaf(RecordKind.ACTIVITY, common)
        .leaf(RecordKind.ACTIVITY, ActivityStatistics.declarations())
        .leaf(RecordKind.ACTIVITY, FinancialStatistics.declarations())
        .leaf(RecordKind.ACTIVITY, OrganisationReferenceStatistics.declarations())
        .leaf(RecordKind.ACTIVITY, HumanitarianClassifier.declarations())
        .leaf(RecordKind.ACTIVITY, ComprehensivenessEngine.declarations())
        .leaf(RecordKind.ACTIVITY, CodelistStatistics.declarations())
        .leaf(RecordKind.ORGANISATION, common)
        .leaf(RecordKind.ORGANISATION, OrganisationStatistics.declarations())
        .group(HierarchyLevel.FILE, FileStatistics.declarations())
        .group(HierarchyLevel.PUBLISHER, PublisherStatistics.declarations())
        .group(HierarchyLevel.PUBLISHER, PublisherTimeliness.declarations())
        .group(HierarchyLevel.CORPUS, CorpusStatistics.declarations())
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Leaf declarations for a record kind, in registration order. */
  public Collection<StatisticDeclaration<LeafContext>> leaf(RecordKind kind) {
    Map<String, StatisticDeclaration<LeafContext>> byName = leaf.get(kind);
    return byName == null ? List.of() : byName.values();
  }

  /** Leaf declaration by name, or {@code null}. */
  public StatisticDeclaration<LeafContext> leaf(RecordKind kind, String name) {
    Map<String, StatisticDeclaration<LeafContext>> byName = leaf.get(kind);
    return byName == null ? null : byName.get(name);
  }

  /** Group declarations applied when closing a level. */
  public List<StatisticDeclaration<GroupContext>> group(HierarchyLevel level) {
    return group.getOrDefault(level, List.of());
  }

  /** Whether values with this name are folded; names without a declaration fold. */
  public boolean isFoldable(String name) {
    return modes.getOrDefault(name, AggregationMode.SUMMED) == AggregationMode.SUMMED;
  }

  /** Declared shape for a name, or {@code null} when undeclared. */
  public Shape shapeOf(String name) {
    return shapes.get(name);
  }

  /** Collects declarations and rejects conflicting names. */
  public static final class Builder {
    private final Map<RecordKind, Map<String, StatisticDeclaration<LeafContext>>> leaf = new EnumMap<>(RecordKind.class);
    private final Map<HierarchyLevel, Map<String, StatisticDeclaration<GroupContext>>> group =
        new EnumMap<>(HierarchyLevel.class);
    private final Map<String, AggregationMode> modes = new HashMap<>();
    private final Map<String, Shape> shapes = new HashMap<>();

    private Builder() {}

    public Builder leaf(RecordKind kind, List<StatisticDeclaration<LeafContext>> declarations) {
      Objects.requireNonNull(kind, "kind");
      Map<String, StatisticDeclaration<LeafContext>> byName = leaf.computeIfAbsent(kind, k -> new LinkedHashMap<>());
      for (StatisticDeclaration<LeafContext> declaration : declarations) {
        register(declaration);
        if (byName.putIfAbsent(declaration.name(), declaration) != null) {
          throw new IllegalArgumentException("duplicate statistic " + declaration.name() + " for " + kind);
        }
      }
      return this;
    }

    public Builder group(HierarchyLevel level, List<StatisticDeclaration<GroupContext>> declarations) {
      Objects.requireNonNull(level, "level");
      Map<String, StatisticDeclaration<GroupContext>> byName = group.computeIfAbsent(level, l -> new LinkedHashMap<>());
      for (StatisticDeclaration<GroupContext> declaration : declarations) {
        register(declaration);
        if (byName.putIfAbsent(declaration.name(), declaration) != null) {
          throw new IllegalArgumentException("duplicate statistic " + declaration.name() + " at " + level);
        }
      }
      return this;
    }

    private void register(StatisticDeclaration<?> declaration) {
      AggregationMode previousMode = modes.putIfAbsent(declaration.name(), declaration.mode());
      Shape previousShape = shapes.putIfAbsent(declaration.name(), declaration.shape());
      if ((previousMode != null && previousMode != declaration.mode())
          || (previousShape != null && previousShape != declaration.shape())) {
        throw new IllegalArgumentException("statistic " + declaration.name() + " declared inconsistently");
      }
    }

    public StatisticRegistry build() {
      return new StatisticRegistry(this);
    }
  }
}
