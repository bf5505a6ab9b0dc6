package org.codeforiati.stats.application.leaf;

import java.math.BigDecimal;
import java.net.URI;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.codeforiati.stats.domain.record.Node;

/**
 * Lexical checks mirroring the XML Schema simple types used by validity criteria, plus lenient number parsing.
 *
 * @since 0.1.0
 */
public final class ValueFormats {
  private static final Pattern XSD_DATE =
      Pattern.compile("^(-?\\d{4,})-(\\d{2})-(\\d{2})(Z|[+-]\\d{2}:\\d{2})?$");
  private static final Pattern XSD_DECIMAL = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)$");

  private ValueFormats() {
    // Utility
  }

  /**
   * Checks the date attribute of a dated element: {@code @value-date} for {@code value}, else {@code @iso-date}.
   *
   * @param element element to check; {@code null} is invalid
   * @return whether the required attribute holds an {@code xsd:date}
   */
  public static boolean validDate(Node element) {
    if (element == null) {
      return false;
    }
    String attribute = element.tag().equals("value") ? "value-date" : "iso-date";
    return isXsdDate(element.attribute(attribute));
  }

  public static boolean isXsdDate(String raw) {
    if (raw == null) {
      return false;
    }
    Matcher m = XSD_DATE.matcher(raw.trim());
    if (!m.matches()) {
      return false;
    }
    try {
      LocalDate.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
      return true;
    } catch (DateTimeException | NumberFormatException ex) {
      return false;
    }
  }

  /** Whether a {@code value} element's text is an {@code xsd:decimal}. */
  public static boolean validValue(Node value) {
    return value != null && value.text() != null && XSD_DECIMAL.matcher(value.text().trim()).matches();
  }

  /**
   * Checks the link of a {@code document-link} ({@code @url}) or {@code activity-website} (text).
   *
   * @return whether the link is a non-empty absolute URI
   */
  public static boolean validUrl(Node element) {
    if (element == null) {
      return false;
    }
    String url = switch (element.tag()) {
      case "document-link" -> element.attribute("url");
      case "activity-website" -> element.text();
      default -> null;
    };
    if (url == null || url.isEmpty() || !url.contains("://")) {
      return false;
    }
    try {
      URI.create(url.trim());
      return true;
    } catch (IllegalArgumentException ex) {
      return false;
    }
  }

  /**
   * Validates a {@code pos} text of two space separated decimals.
   *
   * @param text raw text
   * @return {@code false} for (0, 0) and coordinates outside latitude/longitude bounds
   */
  public static boolean validCoordinates(String text) {
    if (text == null) {
      return false;
    }
    String[] parts = text.split(" ");
    if (parts.length != 2) {
      return false;
    }
    BigDecimal lat = parseDecimal(parts[0]);
    BigDecimal lng = parseDecimal(parts[1]);
    if (lat == null || lng == null) {
      return false;
    }
    if (lat.signum() == 0 && lng.signum() == 0) {
      return false;
    }
    return lat.abs().compareTo(BigDecimal.valueOf(90)) <= 0 && lng.abs().compareTo(BigDecimal.valueOf(180)) <= 0;
  }

  /** Parses a decimal, returning {@code null} for absent or malformed text. */
  public static BigDecimal parseDecimal(String raw) {
    if (raw == null) {
      return null;
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    try {
      return new BigDecimal(trimmed);
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  /** Parses a decimal, treating absent or malformed text as zero. */
  public static BigDecimal decimalOrZero(String raw) {
    BigDecimal value = parseDecimal(raw);
    return value == null ? BigDecimal.ZERO : value;
  }
}
