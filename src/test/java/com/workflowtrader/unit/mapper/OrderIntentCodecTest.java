package com.workflowtrader.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.workflowtrader.domain.enums.FuturesActionType;
import com.workflowtrader.domain.enums.OrderSide;
import com.workflowtrader.domain.enums.PositionSide;
import com.workflowtrader.domain.model.FuturesOrderIntent;
import com.workflowtrader.domain.model.LimitOrderIntent;
import com.workflowtrader.exception.ValidationException;
import com.workflowtrader.mapper.OrderIntentCodec;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OrderIntentCodecTest {

    @Test
    @DisplayName("Limit intent keeps the requested and the exchange-ready values")
    void limitIntent() {
        LimitOrderIntent intent = LimitOrderIntent.builder()
                .symbol("BTCUSDT")
                .pair("BTC/USDT")
                .token("USDT")
                .side(OrderSide.BUY)
                .requestedQuantity(new BigDecimal("50"))
                .quantity(new BigDecimal("0.5005"))
                .price(new BigDecimal("99.90"))
                .build();

        String json = OrderIntentCodec.encodeLimit(intent);
        LimitOrderIntent decoded = OrderIntentCodec.decodeLimit(json);

        assertThat(json).contains("\"version\":1");
        assertThat(decoded.getRequestedQuantity()).isEqualByComparingTo("50");
        assertThat(decoded.getQuantity()).isEqualByComparingTo("0.5005");
        assertThat(decoded.getSide()).isEqualTo(OrderSide.BUY);
    }

    @Test
    @DisplayName("Unknown version is rejected")
    void unsupportedVersion() {
        assertThatThrownBy(() -> OrderIntentCodec.decodeLimit("{\"version\":2,\"pair\":\"BTC/USDT\"}"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Unsupported limit order intent version: 2");
    }

    @Test
    @DisplayName("Limit intent without a pair is rejected")
    void missingPair() {
        assertThatThrownBy(() -> OrderIntentCodec.decodeLimit("{\"version\":1,\"symbol\":\"BTCUSDT\"}"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Limit order intent is missing pair");
    }

    @Test
    @DisplayName("Malformed document is rejected, blank document decodes to null")
    void malformed() {
        assertThatThrownBy(() -> OrderIntentCodec.decodeFutures("{not json"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Malformed FuturesOrderIntent document");
        assertThat(OrderIntentCodec.decodeFutures(" ")).isNull();
    }

    @Test
    @DisplayName("Futures intent without an action is rejected")
    void futuresMissingAction() {
        String json = OrderIntentCodec.encodeFutures(FuturesOrderIntent.builder()
                .symbol("BTCUSDT")
                .positionSide(PositionSide.LONG)
                .build());

        assertThatThrownBy(() -> OrderIntentCodec.decodeFutures(json)).isInstanceOf(ValidationException.class);

        String valid = OrderIntentCodec.encodeFutures(FuturesOrderIntent.builder()
                .symbol("BTCUSDT")
                .positionSide(PositionSide.LONG)
                .action(FuturesActionType.OPEN)
                .leverage(10)
                .build());
        assertThat(OrderIntentCodec.decodeFutures(valid).getLeverage()).isEqualTo(10);
    }
}
