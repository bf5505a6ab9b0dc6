package org.codeforiati.stats.domain.stats;

/** Grouping levels, from a single record up to the whole corpus. */
public enum HierarchyLevel {
  RECORD,
  FILE,
  PUBLISHER,
  CORPUS
}
