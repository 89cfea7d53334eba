package io.hhplus.circulation.application.common;

import io.hhplus.circulation.common.exception.BusinessException;
import io.hhplus.circulation.common.exception.ErrorCode;

/**
 * 요청 주체 (Identity 계층이 전달한 인증된 회원 ID + 역할)
 * <p>
 * 자격 증명은 검사하지 않고 전달된 값을 신뢰한다.
 */
public record Actor(String userId, Role role) {

    public static final int MAX_USER_ID_LENGTH = 50;

    public Actor {
        if (userId == null || userId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "요청자 ID는 필수입니다");
        }
        if (userId.length() > MAX_USER_ID_LENGTH) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "요청자 ID는 " + MAX_USER_ID_LENGTH + "자를 초과할 수 없습니다"
            );
        }
        if (role == null) {
            role = Role.MEMBER;
        }
    }

    public static Actor member(String userId) {
        return new Actor(userId, Role.MEMBER);
    }

    public static Actor admin(String userId) {
        return new Actor(userId, Role.ADMIN);
    }

    public static Actor of(String userId, String role) {
        if (role == null || role.isBlank()) {
            return member(userId);
        }
        try {
            return new Actor(userId, Role.valueOf(role.trim().toUpperCase()));
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "알 수 없는 역할입니다: " + role);
        }
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    /**
     * 회원은 자기 자신으로만 요청할 수 있다. (관리자는 대리 가능)
     */
    public void requireSelfOrAdmin(String targetUserId) {
        if (!isAdmin() && !userId.equals(targetUserId)) {
            throw new BusinessException(
                ErrorCode.ACTOR_MISMATCH,
                String.format("다른 회원을 대신해 요청할 수 없습니다. actor=%s, userId=%s", userId, targetUserId)
            );
        }
    }

    public void requireAdmin() {
        if (!isAdmin()) {
            throw new BusinessException(ErrorCode.ADMIN_ONLY);
        }
    }

    public boolean canActFor(String ownerUserId) {
        return isAdmin() || userId.equals(ownerUserId);
    }
}
