package com.workflowtrader.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ReviewRawLog {

    private Long id;
    private Long workflowId;
    private String prompt;
    private String response;
    private LocalDateTime createdAt;
}
