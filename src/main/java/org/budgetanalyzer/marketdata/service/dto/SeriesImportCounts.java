package org.budgetanalyzer.marketdata.service.dto;

/**
 * Per series outcome of an import run.
 *
 * @param inserted new rows written
 * @param updated rows whose stored value was revised
 * @param unchanged observations matching the stored value
 * @param skipped observations that could not be parsed or written
 */
public record SeriesImportCounts(int inserted, int updated, int unchanged, int skipped) {

  public static final SeriesImportCounts EMPTY = new SeriesImportCounts(0, 0, 0, 0);

  public SeriesImportCounts plus(SeriesImportCounts other) {
    return new SeriesImportCounts(
        inserted + other.inserted,
        updated + other.updated,
        unchanged + other.unchanged,
        skipped + other.skipped);
  }

  public int total() {
    return inserted + updated + unchanged + skipped;
  }
}
