package com.workflowtrader.mapper;

import com.workflowtrader.domain.model.ReviewRawLog;
import com.workflowtrader.domain.model.ReviewResult;
import com.workflowtrader.entity.ReviewRawLogEntity;
import com.workflowtrader.entity.ReviewResultEntity;
import java.util.List;
import org.mapstruct.Mapper;

/** MapStruct mapper for review results and their raw prompt/response logs. 1:1 fields. */
@Mapper
public interface ReviewResultMapper {

    ReviewResultEntity toEntity(ReviewResult reviewResult);

    ReviewResult toDomain(ReviewResultEntity entity);

    List<ReviewResult> toDomainList(List<ReviewResultEntity> entities);

    ReviewRawLogEntity toEntity(ReviewRawLog rawLog);

    ReviewRawLog toDomain(ReviewRawLogEntity entity);
}
