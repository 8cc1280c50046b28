package com.voxpop.backend.repositories;

import com.voxpop.backend.models.ImportJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ImportJobRepository extends JpaRepository<ImportJob, Long> {

    List<ImportJob> findTop50ByOrderByCreatedAtDesc();
}
