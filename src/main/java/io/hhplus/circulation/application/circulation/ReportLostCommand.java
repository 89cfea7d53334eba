package io.hhplus.circulation.application.circulation;

import io.hhplus.circulation.application.common.Actor;

public record ReportLostCommand(String copyId, Actor actor) {
}
