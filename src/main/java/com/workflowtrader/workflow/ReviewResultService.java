package com.workflowtrader.workflow;

import com.workflowtrader.domain.model.ReviewRawLog;
import com.workflowtrader.domain.model.ReviewResult;
import com.workflowtrader.entity.ReviewRawLogEntity;
import com.workflowtrader.entity.ReviewResultEntity;
import com.workflowtrader.exception.ResourceNotFoundException;
import com.workflowtrader.mapper.ReviewResultMapper;
import com.workflowtrader.repository.jpa.ReviewRawLogJpaRepository;
import com.workflowtrader.repository.jpa.ReviewResultJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/** Insert-only store of review results and their raw prompt/response logs. */
@Service
public class ReviewResultService {

    private final ReviewResultJpaRepository reviewResultJpaRepository;
    private final ReviewRawLogJpaRepository reviewRawLogJpaRepository;
    private final ReviewResultMapper reviewResultMapper;

    public ReviewResultService(
            ReviewResultJpaRepository reviewResultJpaRepository,
            ReviewRawLogJpaRepository reviewRawLogJpaRepository,
            ReviewResultMapper reviewResultMapper) {
        this.reviewResultJpaRepository = reviewResultJpaRepository;
        this.reviewRawLogJpaRepository = reviewRawLogJpaRepository;
        this.reviewResultMapper = reviewResultMapper;
    }

    public ReviewRawLog saveRawLog(Long workflowId, String prompt, String response) {
        ReviewRawLog rawLog = ReviewRawLog.builder()
                .workflowId(workflowId)
                .prompt(prompt)
                .response(response)
                .createdAt(LocalDateTime.now())
                .build();
        ReviewRawLogEntity saved = reviewRawLogJpaRepository.save(reviewResultMapper.toEntity(rawLog));
        rawLog.setId(saved.getId());
        return rawLog;
    }

    public ReviewResult saveResult(ReviewResult result) {
        result.setCreatedAt(LocalDateTime.now());
        ReviewResultEntity saved = reviewResultJpaRepository.save(reviewResultMapper.toEntity(result));
        result.setId(saved.getId());
        return result;
    }

    /** Most recent results first. */
    public List<ReviewResult> findRecent(Long workflowId, int limit) {
        return reviewResultMapper.toDomainList(
                reviewResultJpaRepository.findByWorkflowIdOrderByCreatedAtDesc(workflowId, PageRequest.of(0, limit)));
    }

    /**
     * @throws ResourceNotFoundException when the result does not exist or belongs to another workflow
     */
    public ReviewResult getForWorkflow(Long workflowId, Long resultId) {
        return reviewResultJpaRepository
                .findByIdAndWorkflowId(resultId, workflowId)
                .map(reviewResultMapper::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("ReviewResult", resultId));
    }
}
