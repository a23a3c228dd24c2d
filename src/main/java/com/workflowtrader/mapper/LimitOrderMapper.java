package com.workflowtrader.mapper;

import com.workflowtrader.domain.model.LimitOrder;
import com.workflowtrader.domain.model.LimitOrderIntent;
import com.workflowtrader.entity.LimitOrderEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between LimitOrder and LimitOrderEntity. The planned intent is stored as
 * versioned JSON and decoded through {@link OrderIntentCodec}.
 */
@Mapper
public interface LimitOrderMapper {

    @Mapping(source = "planned", target = "plannedJson", qualifiedByName = "limitIntentToJson")
    LimitOrderEntity toEntity(LimitOrder order);

    @Mapping(source = "plannedJson", target = "planned", qualifiedByName = "jsonToLimitIntent")
    LimitOrder toDomain(LimitOrderEntity entity);

    List<LimitOrder> toDomainList(List<LimitOrderEntity> entities);

    @Named("limitIntentToJson")
    default String limitIntentToJson(LimitOrderIntent intent) {
        return OrderIntentCodec.encodeLimit(intent);
    }

    @Named("jsonToLimitIntent")
    default LimitOrderIntent jsonToLimitIntent(String json) {
        return OrderIntentCodec.decodeLimit(json);
    }
}
