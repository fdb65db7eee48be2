package com.example.workflowdispatch.repository;

import com.example.workflowdispatch.domain.DispatchRecord;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface DispatchRecordRepository extends JpaRepository<DispatchRecord, UUID> {

    List<DispatchRecord> findAllByOrderByCreatedAtDesc();
}
