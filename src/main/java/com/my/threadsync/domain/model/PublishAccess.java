package com.my.threadsync.domain.model;

import java.util.List;

/**
 * 게시 대상 인증/권한 점검 결과. 잘못된 자격 증명과 권한 부족을 구분한다.
 */
public record PublishAccess(boolean authenticated,
                            boolean canPublish,
                            String username,
                            List<String> roles,
                            String error) {

    public PublishAccess {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public static PublishAccess denied(String error) {
        return new PublishAccess(false, false, null, List.of(), error);
    }
}
