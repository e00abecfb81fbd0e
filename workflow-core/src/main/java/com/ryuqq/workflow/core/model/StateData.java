package com.ryuqq.workflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 단계 간에 전달되는 불투명(opaque) 키-값 데이터.
 *
 * <p>코어는 값의 내용을 해석하지 않고 그대로 전달합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>추가만 가능 (append-only): 기존 키를 삭제하거나 다른 값으로 덮어쓸 수 없음</li>
 *   <li>같은 키에 같은 값을 다시 쓰는 것은 허용 (no-op)</li>
 *   <li>예약 키({@link #RESERVED_KEYS})는 payload로 쓸 수 없음</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class StateData {

    /**
     * 요청 내부 필드와 충돌하는 예약 키.
     */
    public static final Set<String> RESERVED_KEYS = Set.of(
        "id", "creator", "client_id", "workflow_type", "current_role", "status", "priority", "version"
    );

    private static final StateData EMPTY = new StateData(Map.of());

    private final Map<String, String> entries;

    private StateData(Map<String, String> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static StateData empty() {
        return EMPTY;
    }

    /**
     * 초기 payload로 StateData 생성.
     *
     * @param payload 초기 데이터 (null이면 빈 데이터)
     * @return StateData
     * @throws IllegalArgumentException 예약 키 또는 null 키/값이 포함된 경우
     */
    public static StateData of(Map<String, String> payload) {
        return EMPTY.append(payload);
    }

    /**
     * payload를 병합할 수 없는 이유를 찾습니다.
     *
     * @param payload 병합할 데이터 (null 허용)
     * @return 위반 사유 (예: {@code reserved_key:creator}), 문제가 없으면 빈 Optional
     */
    public Optional<String> findViolation(Map<String, String> payload) {
        if (payload == null) {
            return Optional.empty();
        }
        for (Map.Entry<String, String> entry : payload.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank()) {
                return Optional.of("blank_key");
            }
            if (entry.getValue() == null) {
                return Optional.of("null_value:" + key);
            }
            if (RESERVED_KEYS.contains(key)) {
                return Optional.of("reserved_key:" + key);
            }
            String existing = entries.get(key);
            if (existing != null && !existing.equals(entry.getValue())) {
                return Optional.of("state_data_conflict:" + key);
            }
        }
        return Optional.empty();
    }

    /**
     * payload를 추가한 새 StateData 반환.
     *
     * @param payload 추가할 데이터 (null 허용)
     * @return 병합된 StateData (이 인스턴스는 변경되지 않음)
     * @throws IllegalArgumentException {@link #findViolation(Map)}이 위반을 반환하는 경우
     */
    public StateData append(Map<String, String> payload) {
        Optional<String> violation = findViolation(payload);
        if (violation.isPresent()) {
            throw new IllegalArgumentException("payload cannot be appended: " + violation.get());
        }
        if (payload == null || payload.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new LinkedHashMap<>(entries);
        merged.putAll(payload);
        return new StateData(merged);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public Map<String, String> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entries.equals(((StateData) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "StateData" + entries.keySet();
    }
}
