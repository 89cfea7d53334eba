package io.hhplus.circulation.application.usecase.audit;

import io.hhplus.circulation.application.audit.dto.AuditEventResponse;
import io.hhplus.circulation.application.common.Actor;
import io.hhplus.circulation.application.usecase.UseCase;
import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;
import io.hhplus.circulation.domain.audit.AuditEntityType;
import io.hhplus.circulation.domain.audit.AuditEvent;
import io.hhplus.circulation.domain.audit.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

/**
 * 감사 로그 조회 (관리자 전용)
 * <p>
 * correlationId가 있으면 요청 단위로, 없으면 (entityType, entityId) 단위로 조회한다.
 */
@UseCase
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class GetAuditEventsUseCase {

    private final AuditEventRepository auditEventRepository;

    public List<AuditEventResponse> execute(String entityType, String entityId, String correlationId, Actor actor) {
        actor.requireAdmin();

        List<AuditEvent> events;
        if (correlationId != null && !correlationId.isBlank()) {
            events = auditEventRepository.findByCorrelationIdOrderByIdAsc(correlationId);
        } else if (entityType != null && entityId != null && !entityId.isBlank()) {
            events = auditEventRepository.findByEntityTypeAndEntityIdOrderByIdAsc(parseEntityType(entityType), entityId);
        } else {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "correlationId 또는 entityType + entityId가 필요합니다");
        }
        return events.stream().map(AuditEventResponse::from).toList();
    }

    private AuditEntityType parseEntityType(String entityType) {
        try {
            return AuditEntityType.valueOf(entityType.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "알 수 없는 엔티티 유형입니다: " + entityType);
        }
    }
}
