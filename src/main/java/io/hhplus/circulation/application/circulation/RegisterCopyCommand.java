package io.hhplus.circulation.application.circulation;

import io.hhplus.circulation.application.common.Actor;

public record RegisterCopyCommand(String copyId, String bookId, Actor actor) {
}
