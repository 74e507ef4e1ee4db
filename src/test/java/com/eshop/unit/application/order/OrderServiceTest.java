package com.eshop.unit.application.order;

import com.eshop.application.order.OrderService;
import com.eshop.application.order.OrderTransactionService;
import com.eshop.application.order.OrderValidator;
import com.eshop.application.order.dto.CreateOrderCommand;
import com.eshop.application.order.dto.OrderItemCommand;
import com.eshop.application.order.dto.OrderResult;
import com.eshop.application.order.dto.OrderSummaryResult;
import com.eshop.application.order.dto.UpdateOrderCommand;
import com.eshop.common.exception.ErrorCode;
import com.eshop.common.exception.ForbiddenException;
import com.eshop.common.exception.SystemException;
import com.eshop.domain.order.Order;
import com.eshop.domain.order.OrderItem;
import com.eshop.domain.order.OrderNotFoundException;
import com.eshop.domain.order.OrderRepository;
import com.eshop.domain.order.OrderStatus;
import com.eshop.unit.BaseUnitTest;
import com.eshop.unit.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.springframework.dao.PessimisticLockingFailureException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("OrderService 단위 테스트")
class OrderServiceTest extends BaseUnitTest {

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private OrderValidator orderValidator;

    @Mock
    private OrderTransactionService orderTransactionService;

    @InjectMocks
    private OrderService orderService;

    // ========== 주문 생성 ==========

    @Test
    @DisplayName("주문 생성 - 병합된 항목과 본인 user_id로 트랜잭션 위임")
    void testCreateOrder_DelegatesMergedLines() {
        CreateOrderCommand command = createCommand();
        SortedMap<Long, Integer> lines = new TreeMap<>();
        lines.put(1L, 2);
        OrderResult expected = OrderResult.builder().id(100L).userId(7L).status(OrderStatus.PENDING).build();
        when(orderValidator.validateAndMerge(command)).thenReturn(lines);
        when(orderTransactionService.createOrder(7L, TestFixtures.SHIPPING_ADDRESS, lines)).thenReturn(expected);

        OrderResult result = orderService.createOrder(TestFixtures.customer(7L), command);

        assertSame(expected, result);
    }

    @Test
    @DisplayName("주문 생성 - 실패 (락 재시도 소진 시 503)")
    void testCreateOrder_Failed_LockExhausted() {
        CreateOrderCommand command = createCommand();
        SortedMap<Long, Integer> lines = new TreeMap<>();
        lines.put(1L, 2);
        when(orderValidator.validateAndMerge(command)).thenReturn(lines);
        when(orderTransactionService.createOrder(7L, TestFixtures.SHIPPING_ADDRESS, lines))
                .thenThrow(new PessimisticLockingFailureException("Lock wait timeout exceeded"));

        SystemException exception = assertThrows(SystemException.class,
                () -> orderService.createOrder(TestFixtures.customer(7L), command));

        assertEquals(ErrorCode.LOCK_ACQUISITION_FAILED, exception.getErrorCode());
        assertEquals(503, exception.getStatusCode());
    }

    @Test
    @DisplayName("주문 변경 - 실패 (락 재시도 소진 시 503)")
    void testUpdateOrder_Failed_LockExhausted() {
        UpdateOrderCommand command = UpdateOrderCommand.builder()
                .status(Optional.of(OrderStatus.CANCELLED))
                .build();
        when(orderTransactionService.updateOrder(any(), any(), any()))
                .thenThrow(new PessimisticLockingFailureException("deadlock"));

        SystemException exception = assertThrows(SystemException.class,
                () -> orderService.updateOrder(TestFixtures.customer(7L), 100L, command));

        assertEquals(ErrorCode.LOCK_ACQUISITION_FAILED, exception.getErrorCode());
    }

    // ========== 조회 ==========

    @Test
    @DisplayName("주문 상세 조회 - 실패 (다른 사용자의 주문)")
    void testGetOrder_Failed_OtherUser() {
        when(orderRepository.findById(100L)).thenReturn(Optional.of(order(100L, 7L)));

        assertThrows(ForbiddenException.class, () -> orderService.getOrder(TestFixtures.customer(8L), 100L));
    }

    @Test
    @DisplayName("주문 상세 조회 - 실패 (존재하지 않음)")
    void testGetOrder_Failed_NotFound() {
        when(orderRepository.findById(404L)).thenReturn(Optional.empty());

        assertThrows(OrderNotFoundException.class, () -> orderService.getOrder(TestFixtures.admin(1L), 404L));
    }

    @Test
    @DisplayName("주문 목록 - 고객은 본인 주문만 조회")
    void testGetOrders_CustomerSeesOwnOrders() {
        when(orderRepository.findByUserId(7L)).thenReturn(List.of(order(100L, 7L)));

        List<OrderSummaryResult> results = orderService.getOrders(TestFixtures.customer(7L), null);

        assertEquals(1, results.size());
        assertEquals(100L, results.get(0).getId());
        verify(orderRepository, never()).findAll();
    }

    @Test
    @DisplayName("주문 목록 - 실패 (고객이 다른 사용자 필터 지정)")
    void testGetOrders_Failed_CustomerFiltersOtherUser() {
        assertThrows(ForbiddenException.class, () -> orderService.getOrders(TestFixtures.customer(7L), 8L));
        verifyNoInteractions(orderRepository);
    }

    @Test
    @DisplayName("주문 목록 - 관리자는 전체 또는 user_id 필터")
    void testGetOrders_Admin() {
        when(orderRepository.findAll()).thenReturn(List.of(order(100L, 7L), order(101L, 8L)));
        when(orderRepository.findByUserId(8L)).thenReturn(List.of(order(101L, 8L)));

        assertEquals(2, orderService.getOrders(TestFixtures.admin(1L), null).size());
        assertEquals(1, orderService.getOrders(TestFixtures.admin(1L), 8L).size());
    }

    private CreateOrderCommand createCommand() {
        return CreateOrderCommand.builder()
                .shippingAddress(TestFixtures.SHIPPING_ADDRESS)
                .items(List.of(OrderItemCommand.builder().productId(1L).quantity(2).build()))
                .build();
    }

    private Order order(Long orderId, Long userId) {
        return TestFixtures.order(orderId, userId, OrderStatus.PENDING,
                OrderItem.createOrderItem(1L, 1, new BigDecimal("1000.00")));
    }
}
