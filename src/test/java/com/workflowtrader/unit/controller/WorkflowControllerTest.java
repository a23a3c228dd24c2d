package com.workflowtrader.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.workflowtrader.agent.SpotOrderInstruction;
import com.workflowtrader.api.controller.UserWorkflowController;
import com.workflowtrader.api.controller.WorkflowController;
import com.workflowtrader.domain.enums.LimitOrderStatus;
import com.workflowtrader.domain.enums.OrderSide;
import com.workflowtrader.domain.enums.SupportedExchange;
import com.workflowtrader.domain.model.LimitOrder;
import com.workflowtrader.domain.model.LimitOrderIntent;
import com.workflowtrader.domain.model.ReviewResult;
import com.workflowtrader.exception.GlobalExceptionHandler;
import com.workflowtrader.exception.ResourceNotFoundException;
import com.workflowtrader.exception.ValidationException;
import com.workflowtrader.exception.WorkflowAlreadyRunningException;
import com.workflowtrader.oms.OrderLedgerService;
import com.workflowtrader.review.ManualExecutionService;
import com.workflowtrader.review.ReviewTriggerService;
import com.workflowtrader.workflow.ReviewResultService;
import com.workflowtrader.workflow.WorkflowDisableService;
import com.workflowtrader.workflow.WorkflowService;
import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for the workflow REST endpoints: manual review trigger (202 / 409), stop,
 * results listing with grouped orders, manual order execution and cancel, and the key-removal
 * disable hook.
 */
class WorkflowControllerTest {

    private MockMvc mockMvc;

    @Mock
    private ReviewTriggerService reviewTriggerService;

    @Mock
    private WorkflowDisableService workflowDisableService;

    @Mock
    private WorkflowService workflowService;

    @Mock
    private ReviewResultService reviewResultService;

    @Mock
    private OrderLedgerService orderLedgerService;

    @Mock
    private ManualExecutionService manualExecutionService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        WorkflowController controller = new WorkflowController(
                reviewTriggerService,
                workflowDisableService,
                workflowService,
                reviewResultService,
                orderLedgerService,
                manualExecutionService);
        UserWorkflowController userController = new UserWorkflowController(workflowDisableService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller, userController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void triggerReview_returns202() throws Exception {
        mockMvc.perform(post("/api/workflows/5/review"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.workflowId").value(5))
                .andExpect(jsonPath("$.status").value("ACCEPTED"));

        verify(reviewTriggerService).triggerManual(5L);
    }

    @Test
    void triggerReview_alreadyRunning_returns409() throws Exception {
        doThrow(new WorkflowAlreadyRunningException(5L)).when(reviewTriggerService).triggerManual(5L);

        mockMvc.perform(post("/api/workflows/5/review"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("WORKFLOW_ALREADY_RUNNING"))
                .andExpect(jsonPath("$.error.message").value("Agent is already reviewing portfolio"))
                .andExpect(jsonPath("$.error.retryable").value(true))
                .andExpect(header().string("Retry-After", "30"));
    }

    @Test
    void triggerReview_unknownWorkflow_returns404() throws Exception {
        doThrow(new ResourceNotFoundException("Workflow", 99L)).when(reviewTriggerService).triggerManual(99L);

        mockMvc.perform(post("/api/workflows/99/review"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.error.retryable").value(false))
                .andExpect(header().doesNotExist("Retry-After"));
    }

    @Test
    void triggerReview_inactiveWorkflow_returns400() throws Exception {
        doThrow(new ValidationException("Workflow 5 is not active")).when(reviewTriggerService).triggerManual(5L);

        mockMvc.perform(post("/api/workflows/5/review"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void triggerReview_executorSaturated_returns503() throws Exception {
        doThrow(new RejectedExecutionException("queue full")).when(reviewTriggerService).triggerManual(5L);

        mockMvc.perform(post("/api/workflows/5/review"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code").value("SERVICE_BUSY"))
                .andExpect(header().exists("Retry-After"));
    }

    @Test
    void triggerReview_nonNumericId_returns400() throws Exception {
        mockMvc.perform(post("/api/workflows/abc/review"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));

        verify(reviewTriggerService, never()).triggerManual(any());
    }

    @Test
    void stopWorkflow_returnsMessage() throws Exception {
        mockMvc.perform(post("/api/workflows/5/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Workflow stopped"));

        verify(workflowDisableService).stopWorkflow(5L);
    }

    @Test
    void getResults_groupsOrdersByResult() throws Exception {
        ReviewResult first = ReviewResult.builder()
                .id(11L)
                .workflowId(5L)
                .rebalance(true)
                .shortReport("Trimmed BTC")
                .build();
        ReviewResult second = ReviewResult.builder()
                .id(10L)
                .workflowId(5L)
                .rebalance(false)
                .error("Exchange unavailable")
                .build();
        LimitOrder order = LimitOrder.builder()
                .id(1L)
                .workflowId(5L)
                .reviewResultId(11L)
                .exchange(SupportedExchange.BINANCE)
                .symbol("BTCUSDT")
                .orderId("123")
                .planned(LimitOrderIntent.builder()
                        .side(OrderSide.SELL)
                        .quantity(new BigDecimal("0.1"))
                        .price(new BigDecimal("50100"))
                        .build())
                .status(LimitOrderStatus.OPEN)
                .build();

        when(reviewResultService.findRecent(5L, 20)).thenReturn(List.of(first, second));
        when(orderLedgerService.findLimitOrdersForResults(List.of(11L, 10L))).thenReturn(List.of(order));
        when(orderLedgerService.findFuturesOrdersForResults(List.of(11L, 10L))).thenReturn(List.of());

        mockMvc.perform(get("/api/workflows/5/results"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].id").value(11))
                .andExpect(jsonPath("$[0].shortReport").value("Trimmed BTC"))
                .andExpect(jsonPath("$[0].orders.length()").value(1))
                .andExpect(jsonPath("$[0].orders[0].kind").value("SPOT"))
                .andExpect(jsonPath("$[0].orders[0].side").value("SELL"))
                .andExpect(jsonPath("$[0].orders[0].status").value("OPEN"))
                .andExpect(jsonPath("$[1].error").value("Exchange unavailable"))
                .andExpect(jsonPath("$[1].orders.length()").value(0));

        verify(workflowService).getWorkflow(5L);
    }

    @Test
    void getResults_unknownWorkflow_returns404() throws Exception {
        when(workflowService.getWorkflow(99L)).thenThrow(new ResourceNotFoundException("Workflow", 99L));

        mockMvc.perform(get("/api/workflows/99/results").param("limit", "5"))
                .andExpect(status().isNotFound());

        verify(reviewResultService, never()).findRecent(eq(99L), anyInt());
    }

    @Test
    void disableUserWorkflows_returnsDisabledIds() throws Exception {
        when(workflowDisableService.disableUserWorkflows("user-1", 7L)).thenReturn(List.of(3L, 4L));

        mockMvc.perform(post("/api/users/user-1/workflows/disable").param("aiApiKeyId", "7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.disabledWorkflowIds.length()").value(2))
                .andExpect(jsonPath("$.disabledWorkflowIds[0]").value(3));
    }

    @Test
    void disableUserWorkflows_withoutKeyId_disablesAll() throws Exception {
        when(workflowDisableService.disableUserWorkflows("user-1", null)).thenReturn(List.of());

        mockMvc.perform(post("/api/users/user-1/workflows/disable"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.disabledWorkflowIds.length()").value(0));

        verify(workflowDisableService).disableUserWorkflows("user-1", null);
    }

    @Test
    void executeManualOrder_returns201WithPlacedOrder() throws Exception {
        LimitOrder placed = LimitOrder.builder()
                .id(40L)
                .workflowId(5L)
                .reviewResultId(11L)
                .symbol("BTCUSDT")
                .orderId("9001")
                .planned(LimitOrderIntent.builder()
                        .side(OrderSide.SELL)
                        .quantity(new BigDecimal("0.05"))
                        .price(new BigDecimal("50500"))
                        .build())
                .status(LimitOrderStatus.OPEN)
                .build();
        when(manualExecutionService.executeOrder(5L, 11L, 1, new BigDecimal("50500"), new BigDecimal("0.05")))
                .thenReturn(placed);

        mockMvc.perform(post("/api/workflows/5/results/11/rebalance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"orderIndex\":1,\"price\":50500,\"quantity\":0.05}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.orderId").value("9001"))
                .andExpect(jsonPath("$.side").value("SELL"))
                .andExpect(jsonPath("$.status").value("OPEN"));
    }

    @Test
    void executeManualOrder_withoutBody_usesStoredOrder() throws Exception {
        LimitOrder placed = LimitOrder.builder()
                .id(40L)
                .symbol("BTCUSDT")
                .orderId("9001")
                .status(LimitOrderStatus.OPEN)
                .build();
        when(manualExecutionService.executeOrder(5L, 11L, null, null, null)).thenReturn(placed);

        mockMvc.perform(post("/api/workflows/5/results/11/rebalance"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.orderId").value("9001"));

        verify(manualExecutionService).executeOrder(5L, 11L, null, null, null);
    }

    @Test
    void executeManualOrder_automaticWorkflow_returns400() throws Exception {
        when(manualExecutionService.executeOrder(5L, 11L, null, null, null))
                .thenThrow(new ValidationException("Manual rebalance disabled"));

        mockMvc.perform(post("/api/workflows/5/results/11/rebalance"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.message").value("Manual rebalance disabled"));
    }

    @Test
    void executeManualOrder_reviewInFlight_returns409() throws Exception {
        when(manualExecutionService.executeOrder(5L, 11L, null, null, null))
                .thenThrow(new WorkflowAlreadyRunningException(5L));

        mockMvc.perform(post("/api/workflows/5/results/11/rebalance"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("WORKFLOW_ALREADY_RUNNING"));
    }

    @Test
    void previewManualOrder_returnsStoredOrder() throws Exception {
        when(manualExecutionService.previewOrder(5L, 11L, 0))
                .thenReturn(SpotOrderInstruction.builder()
                        .pair("BTCUSDT")
                        .token("BTC")
                        .side(OrderSide.SELL)
                        .quantity(new BigDecimal("0.1"))
                        .limitPrice(new BigDecimal("50000"))
                        .build());

        mockMvc.perform(get("/api/workflows/5/results/11/rebalance/preview").param("orderIndex", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pair").value("BTCUSDT"))
                .andExpect(jsonPath("$.side").value("SELL"))
                .andExpect(jsonPath("$.price").value(50000));
    }

    @Test
    void cancelOrder_returnsOutcome() throws Exception {
        when(manualExecutionService.cancelOrder(5L, 11L, "9001")).thenReturn(LimitOrderStatus.CANCELED);

        mockMvc.perform(post("/api/workflows/5/results/11/orders/9001/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orderId").value("9001"))
                .andExpect(jsonPath("$.status").value("CANCELED"));
    }

    @Test
    void cancelOrder_unknownOrder_returns404() throws Exception {
        when(manualExecutionService.cancelOrder(5L, 11L, "777"))
                .thenThrow(new ResourceNotFoundException("Order", "777"));

        mockMvc.perform(post("/api/workflows/5/results/11/orders/777/cancel"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    void cancelOrder_notOpen_returns400() throws Exception {
        when(manualExecutionService.cancelOrder(5L, 11L, "9001")).thenThrow(new ValidationException("Order not open"));

        mockMvc.perform(post("/api/workflows/5/results/11/orders/9001/cancel"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.message").value("Order not open"));
    }
}
