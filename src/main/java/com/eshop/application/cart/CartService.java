package com.eshop.application.cart;

import com.eshop.application.cart.dto.CartResult;
import com.eshop.common.exception.InvalidReferenceException;
import com.eshop.common.exception.ValidationException;
import com.eshop.config.EshopProperties;
import com.eshop.domain.cart.Cart;
import com.eshop.domain.cart.CartItemNotFoundException;
import com.eshop.domain.cart.CartRepository;
import com.eshop.domain.product.Product;
import com.eshop.domain.product.ProductRepository;
import com.eshop.infrastructure.lock.DistributedLock;
import com.eshop.infrastructure.lock.LockKeyGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * CartService - 장바구니 관리 (Application 계층)
 *
 * 책임:
 * - 사용자별 장바구니 조회/담기/수량 변경/삭제/비우기
 *
 * 비즈니스 규칙:
 * - 담을 상품은 존재하고 판매 중이어야 함
 * - 쓰기마다 TTL(eshop.cart.ttl)과 expires_at 갱신
 * - 같은 사용자의 쓰기는 분산락(lock:cart:{userId})으로 직렬화
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CartService {

    private static final int DEFAULT_QUANTITY = 1;

    private final CartRepository cartRepository;
    private final ProductRepository productRepository;
    private final EshopProperties properties;
    private final Clock clock;

    /**
     * 장바구니 조회 (없으면 빈 장바구니, 저장하지 않음)
     */
    public CartResult getCart(Long userId) {
        Cart cart = cartRepository.findByUserId(userId).orElseGet(() -> {
            Cart empty = Cart.empty(userId);
            empty.refreshExpiry(now().plus(ttl()));
            return empty;
        });
        return CartResult.from(cart);
    }

    /**
     * 상품 담기 (이미 담긴 상품이면 수량 누적)
     *
     * @param quantity null이면 1
     */
    @DistributedLock(key = LockKeyGenerator.CART_KEY_TEMPLATE)
    public CartResult addItem(Long userId, Long productId, Integer quantity) {
        if (productId == null) {
            throw new ValidationException("product_id는 필수입니다");
        }
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new InvalidReferenceException("product_id", productId));
        product.ensureActive();

        Cart cart = loadOrEmpty(userId);
        cart.addItem(productId, quantity == null ? DEFAULT_QUANTITY : quantity, now());
        log.info("[CartService] 상품 담기 - userId={}, productId={}, quantity={}", userId, productId, quantity);
        return store(cart);
    }

    /**
     * 수량 변경 (대체)
     *
     * @throws CartItemNotFoundException 담기지 않은 상품
     */
    @DistributedLock(key = LockKeyGenerator.CART_KEY_TEMPLATE)
    public CartResult updateItem(Long userId, Long productId, Integer quantity) {
        if (quantity == null) {
            throw new ValidationException("quantity는 필수입니다");
        }
        Cart cart = cartRepository.findByUserId(userId)
                .orElseThrow(() -> new CartItemNotFoundException(userId, productId));
        cart.updateQuantity(productId, quantity);
        return store(cart);
    }

    @DistributedLock(key = LockKeyGenerator.CART_KEY_TEMPLATE)
    public CartResult removeItem(Long userId, Long productId) {
        Cart cart = cartRepository.findByUserId(userId)
                .orElseThrow(() -> new CartItemNotFoundException(userId, productId));
        cart.removeItem(productId);
        log.info("[CartService] 상품 제거 - userId={}, productId={}", userId, productId);
        return store(cart);
    }

    @DistributedLock(key = LockKeyGenerator.CART_KEY_TEMPLATE)
    public void clearCart(Long userId) {
        cartRepository.deleteByUserId(userId);
        log.info("[CartService] 장바구니 비우기 - userId={}", userId);
    }

    private Cart loadOrEmpty(Long userId) {
        return cartRepository.findByUserId(userId).orElseGet(() -> Cart.empty(userId));
    }

    private CartResult store(Cart cart) {
        Duration ttl = ttl();
        cart.refreshExpiry(now().plus(ttl));
        cartRepository.save(cart, ttl);
        return CartResult.from(cart);
    }

    private Duration ttl() {
        return properties.getCart().getTtl();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
