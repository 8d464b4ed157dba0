package com.ryuqq.substrate.core.model;

import java.util.List;

/**
 * Dead-letter 저장소 통계.
 *
 * @param totalRecords 전체 기록 수
 * @param unresolvedRecords 미해결 기록 수
 * @param failedInWindow 조회 구간 내 실패 기록 수
 * @param failureTypes 미해결 기록의 작업 이름별 건수 (내림차순, 최대 10개)
 * @author Substrate Team
 * @since 1.0.0
 */
public record DeadLetterStats(
    long totalRecords,
    long unresolvedRecords,
    long failedInWindow,
    List<FailureTypeCount> failureTypes
) {

    public DeadLetterStats {
        failureTypes = failureTypes == null ? List.of() : List.copyOf(failureTypes);
    }

    /**
     * 작업 이름별 실패 건수.
     *
     * @param taskName 작업 이름
     * @param count 건수
     */
    public record FailureTypeCount(String taskName, long count) {
    }
}
