package com.testinsight.repository;

import com.testinsight.model.AggregationWatermark;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AggregationWatermarkRepository extends JpaRepository<AggregationWatermark, String> {
}
