package io.hhplus.circulation.application.audit;

import io.hhplus.circulation.domain.audit.AuditEntry;
import io.hhplus.circulation.domain.audit.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 감사 이벤트 append (별도 트랜잭션)
 * <p>
 * eventId가 이미 기록된 항목은 건너뛴다. 같은 항목을 emit/복구 스윕/누락 재처리에서
 * 여러 번 기록하려 해도 감사 로그에는 한 번만 남는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditEventWriter {

    private final AuditEventRepository auditEventRepository;

    /**
     * @return 새로 기록된 이벤트 수
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int appendAll(List<AuditEntry> entries) {
        int appended = 0;
        for (AuditEntry entry : entries) {
            if (auditEventRepository.existsByEventId(entry.eventId())) {
                log.debug("이미 기록된 감사 이벤트: eventId={}", entry.eventId());
                continue;
            }
            auditEventRepository.save(entry.toEvent());
            appended++;
        }
        return appended;
    }
}
