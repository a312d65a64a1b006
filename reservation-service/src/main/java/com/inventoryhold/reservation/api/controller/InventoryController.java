package com.inventoryhold.reservation.api.controller;

import com.inventoryhold.common.dto.BaseResponse;
import com.inventoryhold.reservation.api.dto.CancelReservationResponse;
import com.inventoryhold.reservation.api.dto.InventoryUnitResponse;
import com.inventoryhold.reservation.api.dto.ReservationResponse;
import com.inventoryhold.reservation.api.dto.ReserveRequest;
import com.inventoryhold.reservation.domain.model.CancelOutcome;
import com.inventoryhold.reservation.domain.model.Reservation;
import com.inventoryhold.reservation.domain.service.ReservationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Saga endpoints called by the booking orchestrator: reserve (forward step), confirm, and
 * cancel (compensating step).
 */
@RestController
@RequestMapping("/api/v1/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final ReservationService reservationService;

    @PostMapping("/units/{unitId}/reservations")
    public ResponseEntity<BaseResponse<ReservationResponse>> reserve(
            @PathVariable String unitId,
            @Valid @RequestBody ReserveRequest request) {
        Reservation reservation = reservationService.reserve(
                unitId, request.externalBookingId(), request.quantity(), request.idempotencyKey());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Capacity reserved", ReservationResponse.from(reservation)));
    }

    @PostMapping("/reservations/{reservationId}/confirm")
    public ResponseEntity<BaseResponse<ReservationResponse>> confirm(@PathVariable String reservationId) {
        Reservation reservation = reservationService.confirm(reservationId);
        return ResponseEntity.ok(BaseResponse.success("Reservation confirmed", ReservationResponse.from(reservation)));
    }

    /**
     * Always 200 unless the store is unavailable; see {@link CancelOutcome}.
     */
    @DeleteMapping("/reservations/{reservationId}")
    public ResponseEntity<BaseResponse<CancelReservationResponse>> cancel(@PathVariable String reservationId) {
        CancelOutcome outcome = reservationService.cancel(reservationId);
        String message = outcome == CancelOutcome.CANCELLED
                ? "Reservation cancelled, capacity released"
                : "Reservation already processed or not found";
        return ResponseEntity.ok(BaseResponse.success(message, new CancelReservationResponse(reservationId, outcome)));
    }

    @GetMapping("/reservations/{reservationId}")
    public ResponseEntity<BaseResponse<ReservationResponse>> getReservation(@PathVariable String reservationId) {
        Reservation reservation = reservationService.getReservation(reservationId);
        return ResponseEntity.ok(BaseResponse.success(ReservationResponse.from(reservation)));
    }

    @GetMapping("/units/{unitId}")
    public ResponseEntity<BaseResponse<InventoryUnitResponse>> getInventoryUnit(@PathVariable String unitId) {
        return ResponseEntity.ok(BaseResponse.success(
                InventoryUnitResponse.from(reservationService.getInventoryUnit(unitId))));
    }
}
