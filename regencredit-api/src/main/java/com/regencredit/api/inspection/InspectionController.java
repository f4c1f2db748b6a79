package com.regencredit.api.inspection;

import com.regencredit.api.ApiHeaders;
import com.regencredit.core.inspection.EraImpact;
import com.regencredit.core.inspection.InspectionSnapshot;
import com.regencredit.core.inspection.InspectionStatus;
import com.regencredit.core.inspection.InspectorStatus;
import com.regencredit.core.inspection.RegeneratorStatus;
import com.regencredit.core.kernel.RegenerationProtocol;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Inspection REST API.
 *
 * Regenerators request, inspectors accept and realize. Anyone may expire an
 * inspection whose acceptance deadline has passed.
 */
@RestController
@RequestMapping("/api/v1/inspections")
public class InspectionController {

    private final RegenerationProtocol protocol;

    public InspectionController(RegenerationProtocol protocol) {
        this.protocol = protocol;
    }

    /**
     * POST /api/v1/inspections
     */
    @PostMapping
    public ResponseEntity<InspectionSnapshot> requestInspection(
            @RequestHeader(ApiHeaders.ACCOUNT) String regenerator) {
        return ResponseEntity.status(HttpStatus.CREATED).body(protocol.requestInspection(regenerator));
    }

    /**
     * POST /api/v1/inspections/{id}/accept
     */
    @PostMapping("/{id}/accept")
    public ResponseEntity<InspectionSnapshot> acceptInspection(
            @RequestHeader(ApiHeaders.ACCOUNT) String inspector,
            @PathVariable long id) {
        return ResponseEntity.ok(protocol.acceptInspection(inspector, id));
    }

    /**
     * Submit the measured results of an accepted inspection.
     * POST /api/v1/inspections/{id}/realize
     */
    @PostMapping("/{id}/realize")
    public ResponseEntity<InspectionSnapshot> realizeInspection(
            @RequestHeader(ApiHeaders.ACCOUNT) String inspector,
            @PathVariable long id,
            @Valid @RequestBody RealizeRequest request) {
        return ResponseEntity.ok(protocol.realizeInspection(inspector, id, request.treesResult(),
                request.biodiversityResult(), request.evidenceHash(), request.justificationHash()));
    }

    /**
     * POST /api/v1/inspections/{id}/expire
     */
    @PostMapping("/{id}/expire")
    public ResponseEntity<InspectionSnapshot> expireInspection(@PathVariable long id) {
        return ResponseEntity.ok(protocol.expireInspection(id));
    }

    /**
     * GET /api/v1/inspections/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<InspectionSnapshot> getInspection(@PathVariable long id) {
        return ResponseEntity.of(protocol.inspection(id));
    }

    /**
     * GET /api/v1/inspections?status=OPEN
     */
    @GetMapping
    public ResponseEntity<List<InspectionSnapshot>> listInspections(@RequestParam InspectionStatus status) {
        return ResponseEntity.ok(protocol.inspections(status));
    }

    /**
     * Impact certified in one era, or in total when no era is given.
     * GET /api/v1/inspections/impact
     */
    @GetMapping("/impact")
    public ResponseEntity<EraImpact> getImpact(@RequestParam(required = false) Integer era) {
        return ResponseEntity.ok(era == null ? protocol.totalImpact() : protocol.eraImpact(era));
    }

    /**
     * GET /api/v1/inspections/regenerators/{address}
     */
    @GetMapping("/regenerators/{address}")
    public ResponseEntity<RegeneratorStatus> getRegenerator(@PathVariable String address) {
        return ResponseEntity.of(protocol.regenerator(address));
    }

    /**
     * GET /api/v1/inspections/inspectors/{address}
     */
    @GetMapping("/inspectors/{address}")
    public ResponseEntity<InspectorStatus> getInspector(@PathVariable String address) {
        return ResponseEntity.of(protocol.inspector(address));
    }

    // DTOs
    public record RealizeRequest(
        @PositiveOrZero long treesResult,
        @PositiveOrZero long biodiversityResult,
        @NotBlank String evidenceHash,
        @NotBlank String justificationHash
    ) {}
}
