package com.workflowtrader.repository.jpa;

import com.workflowtrader.entity.ReviewRawLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ReviewRawLogJpaRepository extends JpaRepository<ReviewRawLogEntity, Long> {}
