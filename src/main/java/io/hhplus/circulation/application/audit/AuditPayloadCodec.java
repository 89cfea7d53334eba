package io.hhplus.circulation.application.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import io.hhplus.circulation.domain.audit.AuditEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * AuditEntry 목록 ↔ JSON (멱등성 레코드의 pendingAudit, AuditGap의 payload)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditPayloadCodec {

    private static final TypeReference<List<AuditEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public String write(List<AuditEntry> entries) {
        try {
            return objectMapper.writeValueAsString(entries);
        } catch (JsonProcessingException e) {
            log.error("감사 항목 직렬화 실패: size={}", entries.size(), e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, e);
        }
    }

    public List<AuditEntry> read(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, ENTRY_LIST);
        } catch (JsonProcessingException e) {
            log.error("감사 항목 역직렬화 실패", e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, e);
        }
    }
}
