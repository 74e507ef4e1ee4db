package com.eshop.integration;

import com.eshop.domain.product.Product;
import com.eshop.domain.user.UserRole;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP 전 구간 통합 테스트
 *
 * 회원 가입 → 로그인 → 토큰으로 주문 생성/조회, API prefix(/api/v1)와 헬스 체크 경로 확인
 */
@DisplayName("[Integration] API 흐름 통합 테스트")
class ApiFlowIntegrationTest extends BaseIntegrationTest {

    private static final String API = "/api/v1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("루트/헬스 체크는 prefix 없이 응답")
    void testHealthEndpoints() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").exists());
    }

    @Test
    @DisplayName("회원 가입 → 로그인 → 내 정보 → 주문 생성 → 주문 조회")
    void testRegisterLoginAndOrder() throws Exception {
        // 회원 가입
        String email = "flow-" + UUID.randomUUID() + "@Example.com";
        mockMvc.perform(post(API + "/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + email + "\",\"name\":\"김철수\",\"password\":\"" + PASSWORD + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.email").value(email.toLowerCase()))
                .andExpect(jsonPath("$.role").value("customer"))
                .andExpect(jsonPath("$.password_hash").doesNotExist());

        // 같은 이메일 재가입
        mockMvc.perform(post(API + "/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + email.toLowerCase() + "\",\"name\":\"김철수\",\"password\":\"" + PASSWORD + "\"}"))
                .andExpect(status().isConflict());

        // 로그인
        MvcResult login = mockMvc.perform(post(API + "/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + email + "\",\"password\":\"" + PASSWORD + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token_type").value("bearer"))
                .andReturn();
        String token = readField(login, "access_token");
        String authorization = "Bearer " + token;

        mockMvc.perform(get(API + "/users/me").header(HttpHeaders.AUTHORIZATION, authorization))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("김철수"));

        // 주문 생성
        Product product = createProduct("1999.99", 5);
        MvcResult created = mockMvc.perform(post(API + "/orders")
                        .header(HttpHeaders.AUTHORIZATION, authorization)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"shipping_address\":\"서울시 강남구 테헤란로 123, 101호\","
                                + "\"items\":[{\"product_id\":" + product.getId() + ",\"quantity\":2}]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.total_amount").value(3999.98))
                .andExpect(jsonPath("$.order_items[0].unit_price").value(1999.99))
                .andReturn();
        String orderId = readField(created, "id");

        mockMvc.perform(get(API + "/orders/" + orderId).header(HttpHeaders.AUTHORIZATION, authorization))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.order_items[0].quantity").value(2));

        // 다른 고객은 조회 불가
        String otherToken = login(createUser(UserRole.CUSTOMER).getEmail());
        mockMvc.perform(get(API + "/orders/" + orderId).header(HttpHeaders.AUTHORIZATION, "Bearer " + otherToken))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("인증 실패 - 토큰 없음/위조 토큰은 401")
    void testUnauthorized() throws Exception {
        mockMvc.perform(get(API + "/cart"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"));
        mockMvc.perform(get(API + "/cart").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error_code").value("APP_AUTH_INVALID_TOKEN"));
    }

    @Test
    @DisplayName("관리자 전용 API - 고객 토큰은 403, 관리자 토큰은 성공")
    void testAdminOnlyEndpoint() throws Exception {
        Product product = createProduct("1000.00", 5);
        String body = "{\"name\":\"이름 변경\"}";

        String customerToken = login(createUser(UserRole.CUSTOMER).getEmail());
        mockMvc.perform(patch(API + "/products/" + product.getId())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + customerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error_code").value("APP_AUTH_FORBIDDEN"));

        mockMvc.perform(patch(API + "/products/" + product.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isUnauthorized());

        String adminToken = login(createUser(UserRole.ADMIN).getEmail());
        mockMvc.perform(patch(API + "/products/" + product.getId())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("이름 변경"))
                .andExpect(jsonPath("$.stock_quantity").value(5));
    }

    private String login(String email) throws Exception {
        MvcResult result = mockMvc.perform(post(API + "/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + email + "\",\"password\":\"" + PASSWORD + "\"}"))
                .andExpect(status().isOk())
                .andReturn();
        return readField(result, "access_token");
    }

    private String readField(MvcResult result, String field) throws Exception {
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get(field).asText();
    }
}
