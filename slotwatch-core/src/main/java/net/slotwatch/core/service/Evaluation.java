package net.slotwatch.core.service;

import net.slotwatch.core.model.CandidateSlot;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * 한 사이클의 평가 결과.
 * picks는 창고별 최선 후보이며 순위 순으로 정렬되어 있다.
 */
public record Evaluation(LocalDate effectiveMinDate, List<CandidateSlot> accepted, List<Pick> picks) {

    public record Pick(CandidateSlot best, boolean improved) {}

    public Evaluation {
        accepted = List.copyOf(accepted);
        picks = List.copyOf(picks);
    }

    public List<CandidateSlot> improvements() {
        return picks.stream().filter(Pick::improved).map(Pick::best).toList();
    }

    public Optional<CandidateSlot> overallBest() {
        return picks.isEmpty() ? Optional.empty() : Optional.of(picks.get(0).best());
    }
}
