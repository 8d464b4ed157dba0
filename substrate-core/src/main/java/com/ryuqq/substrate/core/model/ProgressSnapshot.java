package com.ryuqq.substrate.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * UI/이벤트 노출용 Run 진행 스냅샷 (불변 record).
 *
 * <p><strong>계산 규칙:</strong></p>
 * <ul>
 *   <li>processed = success + failed</li>
 *   <li>percentComplete = success / total × 100 (소수 둘째 자리 반올림, total이 0이면 0)</li>
 *   <li>qps = processed / max(1초, 경과 시간) (소수 둘째 자리 반올림, 시작 시각이 없으면 0)</li>
 *   <li>processed ≥ total 이고 total &gt; 0 이면 COMPLETED, pending/processing은 0으로 표시</li>
 *   <li>그 외 pending + processing &gt; 0 이면 PROCESSING, 아니면 NOT_STARTED</li>
 * </ul>
 *
 * @param total 전체 Item 수
 * @param pending 대기 수
 * @param processing 처리 중 수
 * @param success 성공 수
 * @param failed 실패 수
 * @param processed 처리 완료 수
 * @param percentComplete 성공 비율 (%)
 * @param qps 초당 처리량
 * @param status 표시용 상태
 * @author Substrate Team
 * @since 1.0.0
 */
public record ProgressSnapshot(
    int total,
    int pending,
    int processing,
    int success,
    int failed,
    int processed,
    double percentComplete,
    double qps,
    RunStatus status
) {

    /**
     * 카운터로부터 스냅샷 계산.
     *
     * @param counters Run 카운터
     * @param nowMillis 현재 시각 (epoch 밀리초)
     * @return 계산된 스냅샷
     */
    public static ProgressSnapshot from(RunCounters counters, long nowMillis) {
        if (counters == null) {
            throw new IllegalArgumentException("counters cannot be null");
        }
        int total = counters.total();
        int pending = counters.pending();
        int processing = counters.processing();
        int success = counters.success();
        int failed = counters.failed();
        int processed = success + failed;

        double pct = total > 0 ? round2(success * 100.0 / total) : 0.0;

        double qps = 0.0;
        if (counters.startEpochSeconds() > 0) {
            double elapsedSeconds = Math.max(1.0, nowMillis / 1000.0 - counters.startEpochSeconds());
            qps = round2(processed / elapsedSeconds);
        }

        RunStatus status;
        if (total > 0 && processed >= total) {
            pending = 0;
            processing = 0;
            status = RunStatus.COMPLETED;
        } else if (pending + processing > 0) {
            status = RunStatus.PROCESSING;
        } else {
            status = RunStatus.NOT_STARTED;
        }

        return new ProgressSnapshot(total, pending, processing, success, failed, processed, pct, qps, status);
    }

    /**
     * 완료 여부.
     *
     * @return status가 COMPLETED이면 true
     */
    public boolean isComplete() {
        return status == RunStatus.COMPLETED;
    }

    /**
     * 대기 또는 처리 중인 Item이 남아 있는지 여부.
     *
     * @return pending + processing &gt; 0 이면 true
     */
    public boolean isRunning() {
        return pending + processing > 0;
    }

    /**
     * 이벤트 페이로드 형태로 변환.
     *
     * @return 필드 이름 → 값 맵 (삽입 순서 유지)
     */
    public Map<String, Object> toEventData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("total", total);
        data.put("pending", pending);
        data.put("processing", processing);
        data.put("success", success);
        data.put("failed", failed);
        data.put("processed", processed);
        data.put("percent_complete", percentComplete);
        data.put("qps", qps);
        data.put("is_complete", isComplete());
        data.put("running", isRunning());
        data.put("status", status.wireValue());
        return data;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
