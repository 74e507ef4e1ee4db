package com.eshop.presentation.cart;

import com.eshop.application.auth.AuthService;
import com.eshop.application.cart.CartService;
import com.eshop.application.cart.dto.CartItemResult;
import com.eshop.application.cart.dto.CartResult;
import com.eshop.common.exception.InvalidReferenceException;
import com.eshop.common.exception.ValidationException;
import com.eshop.domain.cart.CartItemNotFoundException;
import com.eshop.presentation.BaseControllerTest;
import com.eshop.presentation.cart.mapper.CartMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * CartControllerTest - Presentation Layer Unit Test
 * 장바구니는 항상 토큰의 사용자 본인 것만 다룹니다.
 */
@DisplayName("CartController 단위 테스트")
class CartControllerTest extends BaseControllerTest {

    private static final Long TEST_USER_ID = 1L;
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 1, 9, 0);

    @Mock
    private CartService cartService;

    @Mock
    private AuthService authService;

    private MockMvc mockMvc;

    @BeforeEach
    void setup() {
        mockMvc = buildMockMvc(new CartController(cartService, new CartMapper()), authService);
    }

    @Test
    @DisplayName("장바구니 조회 - 성공")
    void testGetCart() throws Exception {
        givenCustomer(authService, TEST_USER_ID);
        when(cartService.getCart(TEST_USER_ID)).thenReturn(cartResult(10L, 2));

        mockMvc.perform(get("/cart").header(HttpHeaders.AUTHORIZATION, bearer(CUSTOMER_TOKEN)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user_id").value(TEST_USER_ID))
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andExpect(jsonPath("$.items[0].product_id").value(10))
                .andExpect(jsonPath("$.items[0].quantity").value(2))
                .andExpect(jsonPath("$.items[0].added_at").exists())
                .andExpect(jsonPath("$.expires_at").exists());
    }

    @Test
    @DisplayName("상품 담기 - 성공 (201, quantity 생략 가능)")
    void testAddCartItem() throws Exception {
        givenCustomer(authService, TEST_USER_ID);
        when(cartService.addItem(TEST_USER_ID, 10L, null)).thenReturn(cartResult(10L, 1));

        mockMvc.perform(post("/cart/items")
                        .header(HttpHeaders.AUTHORIZATION, bearer(CUSTOMER_TOKEN))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"product_id\":10}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.items[0].quantity").value(1));
    }

    @Test
    @DisplayName("상품 담기 - 실패 (존재하지 않는 상품, 422)")
    void testAddCartItem_Failed_MissingProduct() throws Exception {
        givenCustomer(authService, TEST_USER_ID);
        when(cartService.addItem(TEST_USER_ID, 99L, 1)).thenThrow(new InvalidReferenceException("product_id", 99L));

        mockMvc.perform(post("/cart/items")
                        .header(HttpHeaders.AUTHORIZATION, bearer(CUSTOMER_TOKEN))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"product_id\":99,\"quantity\":1}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error_code").value("REFERENCE_ERROR"));
    }

    @Test
    @DisplayName("수량 변경 - 본문 없으면 quantity null로 전달되어 400")
    void testUpdateCartItem_Failed_NoBody() throws Exception {
        givenCustomer(authService, TEST_USER_ID);
        when(cartService.updateItem(TEST_USER_ID, 10L, null)).thenThrow(new ValidationException("quantity는 필수입니다"));

        mockMvc.perform(put("/cart/items/10")
                        .header(HttpHeaders.AUTHORIZATION, bearer(CUSTOMER_TOKEN))
                        .contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("상품 제거 - 실패 (담기지 않은 상품, 404)")
    void testRemoveCartItem_Failed_NotFound() throws Exception {
        givenCustomer(authService, TEST_USER_ID);
        when(cartService.removeItem(TEST_USER_ID, 10L)).thenThrow(new CartItemNotFoundException(TEST_USER_ID, 10L));

        mockMvc.perform(delete("/cart/items/10").header(HttpHeaders.AUTHORIZATION, bearer(CUSTOMER_TOKEN)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_CART_ITEM_NOT_FOUND"));
    }

    @Test
    @DisplayName("장바구니 비우기 - 204")
    void testClearCart() throws Exception {
        givenCustomer(authService, TEST_USER_ID);

        mockMvc.perform(delete("/cart").header(HttpHeaders.AUTHORIZATION, bearer(CUSTOMER_TOKEN)))
                .andExpect(status().isNoContent());

        verify(cartService).clearCart(TEST_USER_ID);
    }

    @Test
    @DisplayName("장바구니 조회 - 실패 (토큰 없음, 401)")
    void testGetCart_Failed_NoToken() throws Exception {
        mockMvc.perform(get("/cart"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(cartService);
    }

    private CartResult cartResult(Long productId, int quantity) {
        return CartResult.builder()
                .userId(TEST_USER_ID)
                .items(List.of(CartItemResult.builder().productId(productId).quantity(quantity).addedAt(NOW).build()))
                .expiresAt(NOW.plusDays(7))
                .build();
    }
}
