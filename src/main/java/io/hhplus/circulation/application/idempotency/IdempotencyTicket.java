package io.hhplus.circulation.application.idempotency;

/**
 * NEW 판정을 받은 요청의 IN_FLIGHT 레코드 식별자
 * <p>
 * 엔진은 이 ticket으로 자기 트랜잭션 안에서 결과를 첨부한다.
 */
public record IdempotencyTicket(
    Long recordId,
    String idempotencyKey,
    String correlationId
) {
}
