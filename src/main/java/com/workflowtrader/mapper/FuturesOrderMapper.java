package com.workflowtrader.mapper;

import com.workflowtrader.domain.model.FuturesOrder;
import com.workflowtrader.domain.model.FuturesOrderIntent;
import com.workflowtrader.entity.FuturesOrderEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

@Mapper
public interface FuturesOrderMapper {

    @Mapping(source = "planned", target = "plannedJson", qualifiedByName = "futuresIntentToJson")
    FuturesOrderEntity toEntity(FuturesOrder order);

    @Mapping(source = "plannedJson", target = "planned", qualifiedByName = "jsonToFuturesIntent")
    FuturesOrder toDomain(FuturesOrderEntity entity);

    List<FuturesOrder> toDomainList(List<FuturesOrderEntity> entities);

    @Named("futuresIntentToJson")
    default String futuresIntentToJson(FuturesOrderIntent intent) {
        return OrderIntentCodec.encodeFutures(intent);
    }

    @Named("jsonToFuturesIntent")
    default FuturesOrderIntent jsonToFuturesIntent(String json) {
        return OrderIntentCodec.decodeFutures(json);
    }
}
