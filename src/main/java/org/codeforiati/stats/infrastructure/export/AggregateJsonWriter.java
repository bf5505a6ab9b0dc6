package org.codeforiati.stats.infrastructure.export;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteFeature;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
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

/**
 * Renders aggregates as nested JSON key-value documents with Jackson's streaming generator.
 *
 * <p>Statistics appear under their names; counters become nested objects and numbers are written in plain
 * notation. Record bookkeeping is written as {@code _records} and {@code _skipped_records}.</p>
 *
 * @since 0.1.0
 */
public final class AggregateJsonWriter {
  private final JsonFactory jsonFactory = JsonFactory.builder()
      .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
      .build();
  private final boolean pretty;

  public AggregateJsonWriter() {
    this(false);
  }

  /**
   * Creates a writer.
   *
   * @param pretty whether to indent the output
   */
  public AggregateJsonWriter(boolean pretty) {
    this.pretty = pretty;
  }

  /**
   * Writes one aggregate as a JSON object. The writer is flushed but not closed.
   *
   * @throws IOException when the writer fails
   */
  public void write(Aggregate aggregate, Writer out) throws IOException {
    Objects.requireNonNull(aggregate, "aggregate");
    try (JsonGenerator gen = open(out)) {
      writeAggregate(gen, aggregate);
    }
  }

  /**
   * Writes a corpus report with {@code corpus}, {@code publishers} and {@code files} sections; files are nested
   * by publisher.
   *
   * @throws IOException when the writer fails
   */
  public void write(CorpusReport report, Writer out) throws IOException {
    Objects.requireNonNull(report, "report");
    SortedMap<String, Map<String, Aggregate>> filesByPublisher = new TreeMap<>();
    for (Map.Entry<GroupingKey, Aggregate> entry : report.files().entrySet()) {
      filesByPublisher.computeIfAbsent(entry.getKey().publisher(), p -> new LinkedHashMap<>())
          .put(entry.getKey().file(), entry.getValue());
    }
    try (JsonGenerator gen = open(out)) {
      gen.writeStartObject();
      gen.writeFieldName("corpus");
      writeAggregate(gen, report.corpus());
      gen.writeObjectFieldStart("publishers");
      for (Map.Entry<String, Aggregate> entry : report.publishers().entrySet()) {
        gen.writeFieldName(entry.getKey());
        writeAggregate(gen, entry.getValue());
      }
      gen.writeEndObject();
      gen.writeObjectFieldStart("files");
      for (Map.Entry<String, Map<String, Aggregate>> publisher : filesByPublisher.entrySet()) {
        gen.writeObjectFieldStart(publisher.getKey());
        for (Map.Entry<String, Aggregate> file : publisher.getValue().entrySet()) {
          gen.writeFieldName(file.getKey());
          writeAggregate(gen, file.getValue());
        }
        gen.writeEndObject();
      }
      gen.writeEndObject();
      gen.writeEndObject();
    }
  }

  /** Renders one aggregate to a string. */
  public String toJson(Aggregate aggregate) {
    StringWriter out = new StringWriter();
    try {
      write(aggregate, out);
    } catch (IOException ex) {
      throw new UncheckedIOException("StringWriter failed", ex);
    }
    return out.toString();
  }

  private JsonGenerator open(Writer out) throws IOException {
    JsonGenerator gen = jsonFactory.createGenerator(Objects.requireNonNull(out, "out"));
    gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    if (pretty) {
      gen.useDefaultPrettyPrinter();
    }
    return gen;
  }

  private void writeAggregate(JsonGenerator gen, Aggregate aggregate) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("_records", aggregate.records());
    gen.writeNumberField("_skipped_records", aggregate.skippedRecords());
    for (Map.Entry<String, StatResult> entry : aggregate.values().entrySet()) {
      gen.writeFieldName(entry.getKey());
      writeValue(gen, entry.getValue());
    }
    gen.writeEndObject();
  }

  private void writeValue(JsonGenerator gen, StatResult value) throws IOException {
    switch (value.shape()) {
      case NUMBER -> gen.writeNumber(plain(((NumberStat) value).value()));
      case COUNTER1 -> writeCounter1(gen, (Counter1) value);
      case COUNTER2 -> {
        gen.writeStartObject();
        for (Map.Entry<String, Counter1> entry : ((Counter2) value).values().entrySet()) {
          gen.writeFieldName(entry.getKey());
          writeCounter1(gen, entry.getValue());
        }
        gen.writeEndObject();
      }
      case COUNTER3 -> {
        gen.writeStartObject();
        for (Map.Entry<String, Counter2> entry : ((Counter3) value).values().entrySet()) {
          gen.writeFieldName(entry.getKey());
          writeValue(gen, entry.getValue());
        }
        gen.writeEndObject();
      }
      case NESTED -> {
        gen.writeStartObject();
        for (Map.Entry<String, StatResult> entry : ((NestedStat) value).values().entrySet()) {
          gen.writeFieldName(entry.getKey());
          writeValue(gen, entry.getValue());
        }
        gen.writeEndObject();
      }
    }
  }

  private void writeCounter1(JsonGenerator gen, Counter1 counter) throws IOException {
    gen.writeStartObject();
    for (Map.Entry<String, BigDecimal> entry : counter.values().entrySet()) {
      gen.writeFieldName(entry.getKey());
      gen.writeNumber(plain(entry.getValue()));
    }
    gen.writeEndObject();
  }

  /** Drops trailing zeros so exact sums such as {@code 125.000} render as {@code 125}. */
  private static BigDecimal plain(BigDecimal value) {
    return value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
  }
}
