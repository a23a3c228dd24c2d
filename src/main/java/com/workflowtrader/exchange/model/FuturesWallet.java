package com.workflowtrader.exchange.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class FuturesWallet {

    private String accountType;
    private BigDecimal totalWalletBalance;
    private BigDecimal totalAvailableBalance;
    private List<Coin> coins;

    @Data
    @Builder
    public static class Coin {
        private String asset;
        private BigDecimal walletBalance;
        private BigDecimal availableBalance;
        private BigDecimal unrealizedPnl;
    }
}
