package io.hhplus.circulation.presentation.api.copy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.circulation.application.copy.dto.RegisterCopyRequest;
import io.hhplus.circulation.application.copy.dto.ReportLostRequest;
import io.hhplus.circulation.application.copy.dto.RetireCopyRequest;
import io.hhplus.circulation.application.loan.dto.CheckoutRequest;
import io.hhplus.circulation.infrastructure.external.MockCatalogClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CopyControllerIntegrationTest {

    private static final String USER_ID = "X-User-Id";
    private static final String USER_ROLE = "X-User-Role";
    private static final String CORRELATION_ID = "X-Correlation-Id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MockCatalogClient catalogClient;

    private String copyId;
    private String userId;

    @BeforeEach
    void setUp() throws Exception {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        copyId = "W-" + suffix;
        userId = "WU-" + suffix;
        catalogClient.register(copyId, "B-800");
    }

    private void register() throws Exception {
        mockMvc.perform(post("/api/copies")
                .header(USER_ID, "librarian")
                .header(USER_ROLE, "ADMIN")
                .header(CORRELATION_ID, "reg-" + copyId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RegisterCopyRequest(copyId, "B-800"))))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("AVAILABLE"));
    }

    @Test
    @DisplayName("소장본 등록 → 조회 → 감사 이벤트 조회")
    void 등록_조회() throws Exception {
        // When
        register();

        // Then
        mockMvc.perform(get("/api/copies/{copyId}", copyId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("FREE"))
            .andExpect(jsonPath("$.available").value(true));

        mockMvc.perform(get("/api/audit-events")
                .header(USER_ID, "librarian")
                .header(USER_ROLE, "ADMIN")
                .param("correlationId", "reg-" + copyId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].action").value("REGISTER"))
            .andExpect(jsonPath("$[0].actor").value("librarian"));
    }

    @Test
    @DisplayName("소장본 등록 - 회원은 403")
    void 등록_회원() throws Exception {
        mockMvc.perform(post("/api/copies")
                .header(USER_ID, userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RegisterCopyRequest(copyId, "B-800"))))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("M004"));
    }

    @Test
    @DisplayName("소장본 조회 - 없는 소장본은 404")
    void 조회_없음() throws Exception {
        mockMvc.perform(get("/api/copies/{copyId}", "X99-" + copyId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("CP001"));
    }

    @Test
    @DisplayName("대출 중 조회 → 분실 신고 → 폐기")
    void 분실_폐기() throws Exception {
        // Given
        register();
        mockMvc.perform(post("/api/loans/checkout")
                .header(USER_ID, userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new CheckoutRequest(copyId, userId, "K-" + copyId))))
            .andExpect(status().isCreated());

        mockMvc.perform(get("/api/copies/{copyId}/active-loan", copyId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.userId").value(userId));

        // When
        mockMvc.perform(post("/api/copies/{copyId}/lost", copyId)
                .header(USER_ID, userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new ReportLostRequest("L-" + copyId))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.copyStatus").value("LOST"));

        mockMvc.perform(post("/api/copies/{copyId}/retire", copyId)
                .header(USER_ID, "librarian")
                .header(USER_ROLE, "ADMIN")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RetireCopyRequest("RT-" + copyId))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("RETIRED"));

        // Then
        mockMvc.perform(get("/api/copies/{copyId}/active-loan", copyId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("L001"));
    }

    @Test
    @DisplayName("감사 이벤트 조회 - 조건 없으면 400")
    void 감사조회_조건없음() throws Exception {
        mockMvc.perform(get("/api/audit-events")
                .header(USER_ID, "librarian")
                .header(USER_ROLE, "ADMIN"))
            .andExpect(status().isBadRequest());
    }
}
