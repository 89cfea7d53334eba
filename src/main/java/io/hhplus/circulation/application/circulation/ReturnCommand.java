package io.hhplus.circulation.application.circulation;

import io.hhplus.circulation.application.common.Actor;

public record ReturnCommand(String copyId, String userId, Actor actor) {
}
