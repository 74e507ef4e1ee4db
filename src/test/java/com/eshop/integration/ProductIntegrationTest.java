package com.eshop.integration;

import com.eshop.application.order.OrderService;
import com.eshop.application.order.dto.CreateOrderCommand;
import com.eshop.application.order.dto.OrderItemCommand;
import com.eshop.application.product.ProductService;
import com.eshop.application.product.dto.UpdateProductCommand;
import com.eshop.domain.product.Product;
import com.eshop.domain.user.UserRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 상품 수정 통합 테스트
 *
 * 관리자 수정이 주문의 재고 차감과 겹칠 때
 * 수정이 읽은 오래된 stock_quantity로 차감 결과를 덮어쓰지 않는지 확인합니다.
 */
@DisplayName("[Integration] 상품 수정 통합 테스트")
class ProductIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private ProductService productService;

    @Autowired
    private OrderService orderService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("커넥션 세션의 락 대기 상한은 3초")
    void testLockWaitTimeout() {
        Integer timeout = jdbcTemplate.queryForObject("SELECT @@SESSION.innodb_lock_wait_timeout", Integer.class);

        assertEquals(3, timeout);
    }

    @Test
    @DisplayName("이름 수정 - 진행 중인 재고 차감이 커밋된 뒤의 재고를 유지")
    void testUpdateName_WhileStockDeductionInProgress() throws Exception {
        // Given
        Product product = createProduct("1000.00", 10);
        Long productId = product.getId();
        CountDownLatch rowLocked = new CountDownLatch(1);
        CountDownLatch updateStarted = new CountDownLatch(1);

        // When: 주문 트랜잭션이 행 락을 잡고 재고를 차감하는 도중에 관리자가 이름을 수정
        CompletableFuture<Void> deduction = CompletableFuture.runAsync(() ->
                new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
                    Product locked = productRepository.findByIdForUpdate(productId).orElseThrow();
                    locked.deductStock(3);
                    productRepository.save(locked);
                    rowLocked.countDown();
                    await(updateStarted);
                    sleep(500);
                }));

        await(rowLocked);
        CompletableFuture<Void> update = CompletableFuture.runAsync(() -> {
            updateStarted.countDown();
            productService.updateProduct(productId,
                    UpdateProductCommand.builder().name(Optional.of("이름 변경")).build());
        });

        deduction.get(10, TimeUnit.SECONDS);
        update.get(10, TimeUnit.SECONDS);

        // Then
        Product reloaded = productRepository.findById(productId).orElseThrow();
        assertEquals(7, reloaded.getStockQuantity());
        assertEquals("이름 변경", reloaded.getName());
    }

    @Test
    @DisplayName("이름 수정과 주문을 동시에 반복해도 재고 = 초기 재고 - 주문 수량")
    void testUpdateName_ConcurrentWithOrders() throws Exception {
        // Given
        Product product = createProduct("1000.00", 20);
        Long productId = product.getId();
        int rounds = 5;

        // When
        for (int i = 0; i < rounds; i++) {
            String name = "이름-" + i;
            CompletableFuture<Void> order = CompletableFuture.runAsync(() ->
                    orderService.createOrder(authUser(createUser(UserRole.CUSTOMER)), CreateOrderCommand.builder()
                            .items(List.of(OrderItemCommand.builder().productId(productId).quantity(2).build()))
                            .shippingAddress("서울시 강남구 테헤란로 123, 101호")
                            .build()));
            CompletableFuture<Void> update = CompletableFuture.runAsync(() ->
                    productService.updateProduct(productId,
                            UpdateProductCommand.builder().name(Optional.of(name)).build()));
            CompletableFuture.allOf(order, update).get(10, TimeUnit.SECONDS);
        }

        // Then
        assertEquals(20 - 2 * rounds, stockOf(productId));
    }

    private static void await(CountDownLatch latch) {
        try {
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
