package net.slotwatch.core.service;

import net.slotwatch.core.model.CandidateSlot;
import net.slotwatch.core.model.Monitoring;
import net.slotwatch.core.model.SlotOffer;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 조회 결과를 모니터링 조건으로 거르고, 창고별 최선 후보를 고른다.
 * 상태가 없으며 같은 입력에 항상 같은 결과를 낸다.
 */
public final class CandidateEvaluator {
    private final ZoneId zone;

    public CandidateEvaluator(ZoneId zone) {
        this.zone = zone;
    }

    /** dateFrom이 있으면 그것, 없으면 생성일 + 물류 여유일 */
    public LocalDate effectiveMinDate(Monitoring m) {
        if (m.dateFrom() != null) return m.dateFrom();
        return m.createdAt().atZone(zone).toLocalDate().plusDays(m.logisticsShoulderDays());
    }

    public boolean accepts(Monitoring m, SlotOffer o, LocalDate minDate) {
        if (o.date() == null) return false;
        if (o.coefficient() < 0) return false; // 업스트림에서 닫힌 슬롯
        if (o.coefficient() < m.coefficientMin() || o.coefficient() > m.coefficientMax()) return false;
        if (!o.unloadAllowed()) return false;
        if (!m.warehouseIds().contains(o.warehouseId())) return false;
        if (o.date().isBefore(minDate)) return false;
        if (m.dateTo() != null && o.date().isAfter(m.dateTo())) return false;
        if (m.failedDates().contains(o.date())) return false;
        return m.boxTypeId() == null || m.boxTypeId().equals(o.boxTypeId());
    }

    public List<CandidateSlot> accept(Monitoring m, List<SlotOffer> offers) {
        LocalDate minDate = effectiveMinDate(m);
        List<CandidateSlot> out = new ArrayList<>();
        for (SlotOffer o : offers) {
            if (accepts(m, o, minDate)) out.add(CandidateSlot.of(o));
        }
        return out;
    }

    /** 계수 오름차순, 최소일과의 거리, 날짜, 박스 타입 순 */
    public Comparator<CandidateSlot> ranking(LocalDate minDate) {
        return Comparator.comparingDouble(CandidateSlot::coefficient)
                .thenComparingLong(c -> distance(c, minDate))
                .thenComparing(CandidateSlot::date)
                .thenComparingInt(c -> c.boxTypeId() == null ? Integer.MAX_VALUE : c.boxTypeId());
    }

    /** 캐시된 최선과 비교. 계수와 거리만 보며 동률은 개선이 아니다. */
    public boolean isImprovement(CandidateSlot candidate, CandidateSlot current, LocalDate minDate) {
        if (current == null) return true;
        int byCoefficient = Double.compare(candidate.coefficient(), current.coefficient());
        if (byCoefficient != 0) return byCoefficient < 0;
        return distance(candidate, minDate) < distance(current, minDate);
    }

    public Evaluation evaluate(Monitoring m, List<SlotOffer> offers, Map<Long, CandidateSlot> bestByWarehouse) {
        LocalDate minDate = effectiveMinDate(m);
        Comparator<CandidateSlot> order = ranking(minDate);

        List<CandidateSlot> accepted = accept(m, offers);
        accepted.sort(order);

        // 정렬된 순서에서 창고별 첫 항목이 그 창고의 최선
        Map<Long, CandidateSlot> bestOfCycle = new LinkedHashMap<>();
        for (CandidateSlot c : accepted) bestOfCycle.putIfAbsent(c.warehouseId(), c);

        List<Evaluation.Pick> picks = new ArrayList<>();
        for (CandidateSlot best : bestOfCycle.values()) {
            boolean improved = isImprovement(best, bestByWarehouse.get(best.warehouseId()), minDate);
            picks.add(new Evaluation.Pick(best, improved));
        }
        return new Evaluation(minDate, accepted, picks);
    }

    private static long distance(CandidateSlot c, LocalDate minDate) {
        return Math.abs(ChronoUnit.DAYS.between(minDate, c.date()));
    }
}
