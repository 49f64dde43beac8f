package org.budgetanalyzer.marketdata.service.normalizer;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Set;
import java.util.regex.Pattern;

import org.budgetanalyzer.marketdata.exception.ObservationParseException;

/** Date and value coercion shared by the source adapters. */
public final class ObservationNormalizer {

  /** FRED's marker for a date with no data. */
  public static final String MISSING_VALUE_SENTINEL = ".";

  /** BLS's marker for a period whose value is unavailable. */
  public static final String UNAVAILABLE_VALUE_SENTINEL = "-";

  private static final Set<String> NO_DATA_SENTINELS =
      Set.of(MISSING_VALUE_SENTINEL, UNAVAILABLE_VALUE_SENTINEL);

  private static final Pattern MONTHLY_PERIOD = Pattern.compile("M(0[1-9]|1[0-2])");

  private ObservationNormalizer() {}

  /**
   * Maps a BLS period code to a calendar month.
   *
   * <p>{@code M01}..{@code M12} map to 1..12. Every other code, including the annual average
   * {@code M13}, quarterly and semiannual codes, falls back to January.
   *
   * @param periodCode BLS period code, may be null
   * @return month number 1..12
   */
  public static int periodCodeToMonth(String periodCode) {
    if (!isMonthlyPeriodCode(periodCode)) {
      return 1;
    }

    return Integer.parseInt(periodCode.substring(1));
  }

  /** Whether the code names a calendar month rather than falling back to January. */
  public static boolean isMonthlyPeriodCode(String periodCode) {
    return periodCode != null && MONTHLY_PERIOD.matcher(periodCode).matches();
  }

  /**
   * Whether a raw value means "no data": null, empty, whitespace only, FRED's "." or BLS's "-".
   *
   * @param rawValue raw value as sent by the source
   * @return true if the entry carries no reading
   */
  public static boolean isBlankOrSentinel(String rawValue) {
    if (rawValue == null) {
      return true;
    }

    var trimmed = rawValue.trim();
    return trimmed.isEmpty() || NO_DATA_SENTINELS.contains(trimmed);
  }

  /**
   * Parses a raw value exactly, keeping the source's precision.
   *
   * @param rawValue raw value as sent by the source
   * @return the parsed decimal
   * @throws ObservationParseException if the value is blank or not a number
   */
  public static BigDecimal parseDecimal(String rawValue) {
    if (rawValue == null || rawValue.isBlank()) {
      throw new ObservationParseException("Value is blank");
    }

    try {
      return new BigDecimal(rawValue.trim());
    } catch (NumberFormatException e) {
      throw new ObservationParseException("Value is not numeric: '" + rawValue + "'", e);
    }
  }

  /**
   * Parses a calendar date in {@code yyyy-MM-dd} form.
   *
   * @param rawDate raw date as sent by the source
   * @return the parsed date
   * @throws ObservationParseException if the date is blank or not a valid calendar date
   */
  public static LocalDate parseDate(String rawDate) {
    if (rawDate == null || rawDate.isBlank()) {
      throw new ObservationParseException("Date is missing");
    }

    try {
      return LocalDate.parse(rawDate.trim());
    } catch (DateTimeParseException e) {
      throw new ObservationParseException("Date is not a calendar date: '" + rawDate + "'", e);
    }
  }
}
