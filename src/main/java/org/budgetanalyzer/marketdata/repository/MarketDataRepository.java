package org.budgetanalyzer.marketdata.repository;

import java.time.LocalDate;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import org.budgetanalyzer.marketdata.domain.MarketData;

public interface MarketDataRepository extends JpaRepository<MarketData, Long> {

  Optional<MarketData> findBySeriesTypeAndDate(String seriesType, LocalDate date);
}
