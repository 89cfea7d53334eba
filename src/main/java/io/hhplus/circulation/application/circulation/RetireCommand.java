package io.hhplus.circulation.application.circulation;

import io.hhplus.circulation.application.common.Actor;

public record RetireCommand(String copyId, Actor actor) {
}
