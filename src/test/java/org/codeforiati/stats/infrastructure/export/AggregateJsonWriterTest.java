package org.codeforiati.stats.infrastructure.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import org.codeforiati.stats.application.pipeline.CorpusReport;
import org.codeforiati.stats.domain.record.GroupingKey;
import org.codeforiati.stats.domain.stats.Aggregate;
import org.codeforiati.stats.domain.stats.Counter1;
import org.codeforiati.stats.domain.stats.Counter2;
import org.codeforiati.stats.domain.stats.Counter3;
import org.codeforiati.stats.domain.stats.NestedStat;
import org.codeforiati.stats.domain.stats.NumberStat;
import org.codeforiati.stats.domain.stats.StatResult;
import org.junit.jupiter.api.Test;

class AggregateJsonWriterTest {
  private final AggregateJsonWriter writer = new AggregateJsonWriter();

  @Test
  void writesShapesAsNestedObjectsWithPlainNumbers() {
    SortedMap<String, StatResult> values = new TreeMap<>();
    values.put("amount", new NumberStat(new BigDecimal("125.000")));
    values.put("budget", new NumberStat(new BigDecimal("100")));
    values.put("counts", Counter1.builder().add("x", 1).build());
    values.put("nested", Counter2.builder().add("D", 2020, new BigDecimal("2.50")).build());
    values.put("deep", Counter3.builder().add("min", "start", "2020-01-01", 1).build());

    String json = writer.toJson(new Aggregate(values, 3, 1));

    assertEquals("{\"_records\":3,\"_skipped_records\":1,"
        + "\"amount\":125,\"budget\":100,\"counts\":{\"x\":1},"
        + "\"deep\":{\"min\":{\"start\":{\"2020-01-01\":1}}},"
        + "\"nested\":{\"D\":{\"2020\":2.5}}}", json);
  }

  @Test
  void groupsOfStatisticsAreWrittenAsObjects() {
    NestedStat level = new NestedStat(new TreeMap<>(Map.of(
        "activities", NumberStat.of(2),
        "elements", Counter1.builder().add("iati-activity", 2).build())));

    String json = writer.toJson(Aggregate.EMPTY.withValues(Map.of("by_hierarchy", NestedStat.of("1", level))));

    assertEquals("{\"_records\":0,\"_skipped_records\":0,"
        + "\"by_hierarchy\":{\"1\":{\"activities\":2,\"elements\":{\"iati-activity\":2}}}}", json);
  }

  @Test
  void zeroIsWrittenWithoutScale() {
    String json = writer.toJson(Aggregate.EMPTY.withValues(
        Map.of("total", new NumberStat(new BigDecimal("0.000")))));

    assertEquals("{\"_records\":0,\"_skipped_records\":0,\"total\":0}", json);
  }

  @Test
  void reportGroupsFilesByPublisher() throws IOException {
    Aggregate file = Aggregate.ofRecord(Map.of("activities", NumberStat.ONE));
    Map<GroupingKey, Aggregate> files = new LinkedHashMap<>();
    files.put(new GroupingKey("pub-b", "b.xml"), file);
    files.put(new GroupingKey("pub-a", "a.xml"), file);
    SortedMap<String, Aggregate> publishers = new TreeMap<>(Map.of("pub-a", file, "pub-b", file));
    CorpusReport report = new CorpusReport(files, publishers, file);

    StringWriter out = new StringWriter();
    writer.write(report, out);
    String json = out.toString();

    String one = "{\"_records\":1,\"_skipped_records\":0,\"activities\":1}";
    assertEquals("{\"corpus\":" + one
        + ",\"publishers\":{\"pub-a\":" + one + ",\"pub-b\":" + one + "}"
        + ",\"files\":{\"pub-a\":{\"a.xml\":" + one + "},\"pub-b\":{\"b.xml\":" + one + "}}}", json);
  }

  @Test
  void prettyOutputIsIndented() {
    String json = new AggregateJsonWriter(true).toJson(Aggregate.EMPTY);

    assertTrue(json.contains("\n"));
    assertTrue(json.contains("\"_records\" : 0"));
  }
}
