package io.b2mash.payables.report;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ReportPeriodRepository extends JpaRepository<ReportPeriod, UUID> {

  Optional<ReportPeriod> findByMonthAndYear(int month, int year);

  List<ReportPeriod> findByYearOrderByMonthDesc(int year);
}
