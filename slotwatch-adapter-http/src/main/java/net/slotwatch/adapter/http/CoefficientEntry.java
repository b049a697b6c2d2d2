package net.slotwatch.adapter.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.slotwatch.core.model.SlotOffer;

import java.time.LocalDate;

/** 계수 조회 응답의 원소 한 건 */
@JsonIgnoreProperties(ignoreUnknown = true)
record CoefficientEntry(
        @JsonProperty("warehouseID") Long warehouseId,
        @JsonProperty("warehouseName") String warehouseName,
        @JsonProperty("date") String date,
        @JsonProperty("coefficient") Double coefficient,
        @JsonProperty("boxTypeID") Integer boxTypeId,
        @JsonProperty("boxTypeName") String boxTypeName,
        @JsonProperty("allowUnload") Boolean allowUnload
) {
    private static final double CLOSED = -1;

    /**
     * @throws IllegalArgumentException 창고 또는 날짜가 없음
     * @throws java.time.format.DateTimeParseException 날짜 형식 불명
     */
    SlotOffer toOffer() {
        if (warehouseId == null) throw new IllegalArgumentException("warehouseID missing");
        return new SlotOffer(
                warehouseId,
                warehouseName,
                parseDate(date),
                coefficient == null ? CLOSED : coefficient,
                boxTypeId,
                boxTypeName,
                Boolean.TRUE.equals(allowUnload));
    }

    /** "2025-09-15" 또는 "2025-09-15T00:00:00Z" */
    static LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("date missing");
        String s = raw.trim();
        int t = s.indexOf('T');
        return LocalDate.parse(t < 0 ? s : s.substring(0, t));
    }
}
