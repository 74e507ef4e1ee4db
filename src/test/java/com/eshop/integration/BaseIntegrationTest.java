package com.eshop.integration;

import com.eshop.application.auth.AuthUser;
import com.eshop.domain.category.Category;
import com.eshop.domain.category.CategoryRepository;
import com.eshop.domain.product.Product;
import com.eshop.domain.product.ProductRepository;
import com.eshop.domain.user.PasswordHasher;
import com.eshop.domain.user.User;
import com.eshop.domain.user.UserRepository;
import com.eshop.domain.user.UserRole;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.ContextConfiguration;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * 기본 통합 테스트 - TestContainers 기반 (MySQL + Redis)
 *
 * 모든 통합 테스트가 상속하는 기본 클래스입니다.
 * - MySQL 8.0: 비관적 락, 트랜잭션 롤백 검증
 * - Redis 7.0: 장바구니 TTL, 분산락, 카테고리 캐시 검증
 *
 * 컨테이너는 첫 컨텍스트 로딩 시 한 번만 시작되어 모든 테스트 클래스가 공유합니다.
 * Spring 컨텍스트 캐시가 테스트 클래스 간에 재사용되므로 클래스 단위로 컨테이너를 재시작하지 않습니다.
 *
 * 동시성 테스트가 여러 스레드에서 커밋된 데이터를 읽어야 하므로 @Transactional 롤백을 쓰지 않습니다.
 * 대신 테스트마다 고유한 이메일/이름으로 데이터를 생성합니다.
 *
 * Docker가 없는 환경에서는 통합 테스트 전체를 건너뜁니다.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@ContextConfiguration(initializers = BaseIntegrationTest.TestContainersInitializer.class)
public abstract class BaseIntegrationTest {

    protected static final String PASSWORD = "password1234";

    static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
            .withDatabaseName("eshop_test")
            .withUsername("testuser")
            .withPassword("testpass");

    static final GenericContainer<?> redis = new GenericContainer<>("redis:7.0")
            .withExposedPorts(6379);

    @Autowired
    protected UserRepository userRepository;

    @Autowired
    protected CategoryRepository categoryRepository;

    @Autowired
    protected ProductRepository productRepository;

    @Autowired
    protected PasswordHasher passwordHasher;

    // ========== 테스트 데이터 ==========

    protected User createUser(UserRole role) {
        String email = role.getValue() + "-" + UUID.randomUUID() + "@example.com";
        return userRepository.save(User.create(email, passwordHasher.hash(PASSWORD), "테스터", role));
    }

    protected AuthUser authUser(User user) {
        return AuthUser.from(user);
    }

    protected Category createCategory() {
        return categoryRepository.save(Category.create("카테고리-" + UUID.randomUUID(), null, null));
    }

    protected Product createProduct(String price, int stock) {
        Category category = createCategory();
        return productRepository.save(Product.createProduct(
                "상품-" + UUID.randomUUID(), null, new BigDecimal(price), stock, category.getId(), null, true));
    }

    protected int stockOf(Long productId) {
        return productRepository.findById(productId).orElseThrow().getStockQuantity();
    }

    // ========== TestContainers ==========

    private static synchronized void startContainers() {
        if (!mysql.isRunning()) {
            mysql.start();
        }
        if (!redis.isRunning()) {
            redis.start();
        }
    }

    /**
     * 컨테이너 동적 포트를 Spring 설정에 전달하는 Initializer
     *
     * 주입되는 속성:
     * - spring.datasource.url / username / password
     * - spring.data.redis.host / port (RedissonConfig도 같은 값을 사용)
     */
    static class TestContainersInitializer implements ApplicationContextInitializer<ConfigurableApplicationContext> {
        @Override
        public void initialize(ConfigurableApplicationContext applicationContext) {
            startContainers();

            Map<String, Object> properties = applicationContext.getEnvironment().getSystemProperties();
            properties.put("spring.datasource.url", mysql.getJdbcUrl());
            properties.put("spring.datasource.username", mysql.getUsername());
            properties.put("spring.datasource.password", mysql.getPassword());
            properties.put("spring.data.redis.host", redis.getHost());
            properties.put("spring.data.redis.port", String.valueOf(redis.getMappedPort(6379)));
        }
    }
}
