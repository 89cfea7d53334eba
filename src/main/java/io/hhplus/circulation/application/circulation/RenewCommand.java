package io.hhplus.circulation.application.circulation;

import io.hhplus.circulation.application.common.Actor;

/**
 * @param copyId 락 키로 쓰이는 대출 대상 소장본 (락 획득 후 대출과 다시 대조한다)
 */
public record RenewCommand(Long loanId, String copyId, Actor actor) {
}
