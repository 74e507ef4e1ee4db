package com.eshop.presentation.cart;

import com.eshop.application.auth.AuthUser;
import com.eshop.application.cart.CartService;
import com.eshop.common.exception.ValidationException;
import com.eshop.presentation.cart.mapper.CartMapper;
import com.eshop.presentation.cart.request.AddCartItemRequest;
import com.eshop.presentation.cart.request.UpdateQuantityRequest;
import com.eshop.presentation.cart.response.CartResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * CartController - Presentation 계층
 * 장바구니 API 요청 처리 (항상 인증된 사용자 본인의 장바구니)
 */
@RestController
@RequestMapping("/cart")
@PreAuthorize("isAuthenticated()")
public class CartController {

    private final CartService cartService;
    private final CartMapper cartMapper;

    public CartController(CartService cartService, CartMapper cartMapper) {
        this.cartService = cartService;
        this.cartMapper = cartMapper;
    }

    /**
     * GET /cart - 장바구니 조회
     */
    @GetMapping
    public ResponseEntity<CartResponse> getCart(@AuthenticationPrincipal AuthUser actor) {
        return ResponseEntity.ok(cartMapper.toCartResponse(cartService.getCart(actor.getUserId())));
    }

    /**
     * POST /cart/items - 장바구니 아이템 추가
     */
    @PostMapping("/items")
    public ResponseEntity<CartResponse> addCartItem(
            @AuthenticationPrincipal AuthUser actor,
            @RequestBody(required = false) AddCartItemRequest request) {
        if (request == null) {
            throw new ValidationException("요청 본문은 필수입니다");
        }
        var result = cartService.addItem(actor.getUserId(), request.getProductId(), request.getQuantity());
        return ResponseEntity.status(HttpStatus.CREATED).body(cartMapper.toCartResponse(result));
    }

    /**
     * PUT /cart/items/{product_id} - 장바구니 아이템 수량 수정
     */
    @PutMapping("/items/{product_id}")
    public ResponseEntity<CartResponse> updateCartItem(
            @AuthenticationPrincipal AuthUser actor,
            @PathVariable("product_id") Long productId,
            @RequestBody(required = false) UpdateQuantityRequest request) {
        Integer quantity = request == null ? null : request.getQuantity();
        var result = cartService.updateItem(actor.getUserId(), productId, quantity);
        return ResponseEntity.ok(cartMapper.toCartResponse(result));
    }

    /**
     * DELETE /cart/items/{product_id} - 장바구니 아이템 제거
     */
    @DeleteMapping("/items/{product_id}")
    public ResponseEntity<CartResponse> removeCartItem(
            @AuthenticationPrincipal AuthUser actor,
            @PathVariable("product_id") Long productId) {
        return ResponseEntity.ok(cartMapper.toCartResponse(cartService.removeItem(actor.getUserId(), productId)));
    }

    /**
     * DELETE /cart - 장바구니 비우기
     */
    @DeleteMapping
    public ResponseEntity<Void> clearCart(@AuthenticationPrincipal AuthUser actor) {
        cartService.clearCart(actor.getUserId());
        return ResponseEntity.noContent().build();
    }
}
