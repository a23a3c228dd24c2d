package com.workflowtrader.repository.jpa;

import com.workflowtrader.entity.AiApiKeyEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AiApiKeyJpaRepository extends JpaRepository<AiApiKeyEntity, Long> {

    Optional<AiApiKeyEntity> findByIdAndUserId(Long id, String userId);
}
