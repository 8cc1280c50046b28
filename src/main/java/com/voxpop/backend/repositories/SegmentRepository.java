package com.voxpop.backend.repositories;

import com.voxpop.backend.models.Segment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SegmentRepository extends JpaRepository<Segment, Long> {

    List<Segment> findAllByOrderByCreatedAtDesc();

    List<Segment> findByIsActiveOrderByCreatedAtDesc(Boolean isActive);
}
