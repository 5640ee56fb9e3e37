package com.fueltrack.archival.repository;

import com.fueltrack.archival.model.ArchivalJob;
import com.fueltrack.archival.model.enums.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ArchivalJobRepository extends MongoRepository<ArchivalJob, String> {
    Optional<ArchivalJob> findFirstByStatusOrderByCompletedAtDesc(JobStatus status);

    List<ArchivalJob> findAllByOrderByArchivalDateDesc(Pageable pageable);
}
