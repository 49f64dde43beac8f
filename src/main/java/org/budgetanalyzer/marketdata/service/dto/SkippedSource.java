package org.budgetanalyzer.marketdata.service.dto;

/**
 * A source whose fetch or adapter call failed during a run.
 *
 * @param source source name, e.g. metals:gold
 * @param seriesType series the source feeds
 * @param reason failure message
 */
public record SkippedSource(String source, String seriesType, String reason) {}
