package com.hydrowatch.detection.repo;

import com.hydrowatch.detection.model.AnomalyEvent;
import java.time.Instant;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

public interface AnomalyEventRepository extends JpaRepository<AnomalyEvent, Long>, JpaSpecificationExecutor<AnomalyEvent> {
  List<AnomalyEvent> findAllByOrderByDetectedAtDesc(Pageable pageable);

  long countByDetectedAtBetween(Instant start, Instant end);
}
