package com.tourbooking.booking.api.controller;

import com.tourbooking.booking.domain.model.AvailabilityView;
import com.tourbooking.booking.domain.model.SlotKey;
import com.tourbooking.booking.domain.model.SlotSnapshot;
import com.tourbooking.booking.domain.service.CapacityLedger;
import com.tourbooking.common.dto.BaseResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/availability")
@RequiredArgsConstructor
public class AvailabilityController {

    private final CapacityLedger capacityLedger;

    @GetMapping("/{resourceId}")
    public ResponseEntity<BaseResponse<AvailabilityView>> checkAvailability(
            @PathVariable Long resourceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String timeslot) {
        AvailabilityView view = capacityLedger.checkAvailability(new SlotKey(resourceId, date, timeslot));
        return ResponseEntity.ok(BaseResponse.success(view));
    }

    @GetMapping("/{resourceId}/range")
    public ResponseEntity<BaseResponse<List<SlotSnapshot>>> getRange(
            @PathVariable Long resourceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        return ResponseEntity.ok(BaseResponse.success(capacityLedger.getRange(resourceId, start, end)));
    }
}
