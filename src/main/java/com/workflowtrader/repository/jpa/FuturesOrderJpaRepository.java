package com.workflowtrader.repository.jpa;

import com.workflowtrader.entity.FuturesOrderEntity;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface FuturesOrderJpaRepository extends JpaRepository<FuturesOrderEntity, Long> {

    List<FuturesOrderEntity> findByReviewResultIdIn(Collection<Long> reviewResultIds);
}
