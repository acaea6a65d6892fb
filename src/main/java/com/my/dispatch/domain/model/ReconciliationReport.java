package com.my.dispatch.domain.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * 왜: 리컨실 한 회차의 결과를 결과 유형별 건수로 요약해 로그와 수동 실행 응답에 함께 쓰기 위함.
 */
public record ReconciliationReport(Map<ReconciliationOutcome, Integer> counts) {
    public ReconciliationReport {
        Map<ReconciliationOutcome, Integer> copy = new EnumMap<>(ReconciliationOutcome.class);
        if (counts != null) {
            copy.putAll(counts);
        }
        counts = Map.copyOf(copy);
    }

    public static ReconciliationReport empty() {
        return new ReconciliationReport(Map.of());
    }

    public int count(ReconciliationOutcome outcome) {
        return counts.getOrDefault(outcome, 0);
    }

    public int checked() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int failed() {
        return count(ReconciliationOutcome.FAILED);
    }

    public static final class Tally {
        private final Map<ReconciliationOutcome, Integer> counts = new EnumMap<>(ReconciliationOutcome.class);

        public void add(ReconciliationOutcome outcome) {
            counts.merge(outcome, 1, Integer::sum);
        }

        public ReconciliationReport toReport() {
            return new ReconciliationReport(counts);
        }
    }
}
