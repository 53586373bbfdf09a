package com.ai.scheduling.controller;

import com.ai.scheduling.dto.AppointmentDetails;
import com.ai.scheduling.dto.BookingError;
import com.ai.scheduling.dto.BookingRequest;
import com.ai.scheduling.dto.BookingResult;
import com.ai.scheduling.dto.CancelRequest;
import com.ai.scheduling.dto.SlotAvailability;
import com.ai.scheduling.service.AppointmentQueryService;
import com.ai.scheduling.service.AvailabilitySearchService;
import com.ai.scheduling.service.BookingService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON front door for the booking engine. Holds no logic beyond mapping results to HTTP.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AppointmentController {

    private static final Logger log = LoggerFactory.getLogger(AppointmentController.class);

    private final BookingService bookingService;
    private final AppointmentQueryService appointmentQueryService;
    private final AvailabilitySearchService availabilitySearchService;

    @GetMapping("/availability")
    public List<SlotAvailability> availability(@RequestParam(value = "specialty", required = false) String specialty) {
        return availabilitySearchService.search(specialty);
    }

    @PostMapping("/appointments")
    public ResponseEntity<?> book(@RequestBody BookingRequest request) {
        BookingResult result = bookingService.book(request);
        if (!result.success()) {
            return errorResponse(result);
        }
        log.info("POST /api/appointments -> {}", result.appointmentId());
        return appointmentQueryService.getById(result.appointmentId())
                .<ResponseEntity<?>>map(details -> ResponseEntity.status(HttpStatus.CREATED).body(details))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.CREATED).body(result));
    }

    @GetMapping("/appointments/{id}")
    public ResponseEntity<AppointmentDetails> get(@PathVariable("id") Long id) {
        return appointmentQueryService.getById(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/appointments/{id}/cancel")
    public ResponseEntity<?> cancel(@PathVariable("id") Long id,
                                    @RequestBody(required = false) CancelRequest request) {
        BookingResult result = bookingService.cancel(id, request != null ? request.getReason() : null);
        if (!result.success()) {
            return errorResponse(result);
        }
        return ResponseEntity.ok(result);
    }

    private static ResponseEntity<Map<String, String>> errorResponse(BookingResult result) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", result.error().name());
        body.put("message", result.message());
        return ResponseEntity.status(httpStatusFor(result.error())).body(body);
    }

    private static HttpStatus httpStatusFor(BookingError error) {
        switch (error) {
            case VALIDATION_ERROR:
                return HttpStatus.BAD_REQUEST;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case SLOT_UNAVAILABLE:
            case ALREADY_CANCELLED:
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.SERVICE_UNAVAILABLE;
        }
    }
}
