package com.driftmonitor.repository;

import com.driftmonitor.entity.DriftRunRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface DriftRunRepository extends JpaRepository<DriftRunRecord, UUID> {

    Page<DriftRunRecord> findByModelIdOrderByCreatedAtDesc(String modelId, Pageable pageable);

    Page<DriftRunRecord> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
