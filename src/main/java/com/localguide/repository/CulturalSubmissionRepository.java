package com.localguide.repository;

import com.localguide.entity.CulturalSubmission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CulturalSubmissionRepository extends JpaRepository<CulturalSubmission, Long> {
}
