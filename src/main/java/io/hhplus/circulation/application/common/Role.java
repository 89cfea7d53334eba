package io.hhplus.circulation.application.common;

public enum Role {
    MEMBER,
    ADMIN
}
