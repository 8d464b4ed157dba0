package com.ryuqq.substrate.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * WriteBatcher가 영속화하는 범용 쓰기 페이로드.
 *
 * <p>필드 맵의 해석(어느 테이블/컬럼에 쓰는지)은 {@code PersistenceSession}
 * 구현체의 책임이며, 배처는 내용을 해석하지 않습니다.</p>
 *
 * <p>runId가 null이면 Run 진행 카운터와 연결되지 않은 단독 쓰기입니다.</p>
 *
 * @author Substrate Team
 * @since 1.0.0
 */
public final class BatchedWritePayload {

    private final RunId runId;
    private final ItemId itemId;
    private final Map<String, Object> fields;

    private BatchedWritePayload(RunId runId, ItemId itemId, Map<String, Object> fields) {
        if (itemId == null) {
            throw new IllegalArgumentException("itemId cannot be null");
        }
        this.runId = runId;
        this.itemId = itemId;
        this.fields = fields == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Run에 속한 페이로드 생성.
     *
     * @param runId Run ID (null 허용)
     * @param itemId Item ID
     * @param fields 영속화할 필드 맵
     * @return 페이로드
     */
    public static BatchedWritePayload of(RunId runId, ItemId itemId, Map<String, Object> fields) {
        return new BatchedWritePayload(runId, itemId, fields);
    }

    /**
     * Run과 연결되지 않은 페이로드 생성.
     *
     * @param itemId Item ID
     * @param fields 영속화할 필드 맵
     * @return 페이로드
     */
    public static BatchedWritePayload standalone(ItemId itemId, Map<String, Object> fields) {
        return new BatchedWritePayload(null, itemId, fields);
    }

    public RunId getRunId() {
        return runId;
    }

    public ItemId getItemId() {
        return itemId;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public boolean hasRun() {
        return runId != null;
    }

    @Override
    public String toString() {
        return "BatchedWritePayload{runId=" + runId + ", itemId=" + itemId + ", fields=" + fields.keySet() + '}';
    }
}
