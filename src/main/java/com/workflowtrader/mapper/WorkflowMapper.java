package com.workflowtrader.mapper;

import com.workflowtrader.domain.model.Workflow;
import com.workflowtrader.domain.model.WorkflowToken;
import com.workflowtrader.entity.WorkflowEntity;
import com.workflowtrader.entity.WorkflowTokenEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between Workflow and WorkflowEntity.
 *
 * <p>Tokens live in their own table, so they are ignored here and attached by
 * WorkflowService after loading.
 */
@Mapper
public interface WorkflowMapper {

    @Mapping(target = "updatedAt", ignore = true)
    WorkflowEntity toEntity(Workflow workflow);

    @Mapping(target = "tokens", ignore = true)
    Workflow toDomain(WorkflowEntity entity);

    List<Workflow> toDomainList(List<WorkflowEntity> entities);

    WorkflowToken toToken(WorkflowTokenEntity entity);

    List<WorkflowToken> toTokenList(List<WorkflowTokenEntity> entities);
}
