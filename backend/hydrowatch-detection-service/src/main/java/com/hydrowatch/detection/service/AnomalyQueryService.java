package com.hydrowatch.detection.service;

import com.hydrowatch.detection.controller.dto.AnomaliesResponse;
import com.hydrowatch.detection.controller.dto.AnomalyEventView;
import com.hydrowatch.detection.model.AnomalyEvent;
import com.hydrowatch.detection.repo.AnomalyEventRepository;
import jakarta.persistence.criteria.Predicate;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;

@Service
public class AnomalyQueryService {

  private final AnomalyEventRepository repo;

  public AnomalyQueryService(AnomalyEventRepository repo) {
    this.repo = repo;
  }

  public AnomaliesResponse latest(int page, int limit, String deviceId, String type, Instant since) {
    int size = Math.max(1, Math.min(limit, 200));
    var pageable = PageRequest.of(Math.max(0, page), size);
    List<AnomalyEvent> rows;
    if (isBlank(deviceId) && isBlank(type) && since == null) {
      rows = repo.findAllByOrderByDetectedAtDesc(pageable);
    } else {
      rows = repo.findAll(buildSpec(deviceId, type, since), pageable).getContent();
    }

    List<AnomalyEventView> events = rows.stream().map(AnomalyEventView::from).toList();

    Instant nowUtc = Instant.now();
    Instant startOfDayUtc = LocalDate.now(ZoneOffset.UTC).atStartOfDay().toInstant(ZoneOffset.UTC);
    long todayCount = repo.countByDetectedAtBetween(startOfDayUtc, nowUtc);
    return new AnomaliesResponse(events, new AnomaliesResponse.Meta(todayCount, page, size));
  }

  static Specification<AnomalyEvent> buildSpec(String deviceId, String type, Instant since) {
    return (root, query, cb) -> {
      List<Predicate> predicates = new ArrayList<>();
      if (!isBlank(deviceId)) {
        predicates.add(cb.equal(root.get("deviceId"), deviceId));
      }
      if (!isBlank(type)) {
        predicates.add(cb.equal(cb.lower(root.get("anomalyType")), type.toLowerCase()));
      }
      if (since != null) {
        predicates.add(cb.greaterThanOrEqualTo(root.get("detectedAt"), since));
      }
      query.orderBy(cb.desc(root.get("detectedAt")));
      return cb.and(predicates.toArray(new Predicate[0]));
    };
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
