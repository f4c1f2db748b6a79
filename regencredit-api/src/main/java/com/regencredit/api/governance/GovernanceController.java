package com.regencredit.api.governance;

import com.regencredit.api.ApiHeaders;
import com.regencredit.core.governance.DelationSnapshot;
import com.regencredit.core.governance.ResourceSnapshot;
import com.regencredit.core.governance.ResourceType;
import com.regencredit.core.governance.UserChallenge;
import com.regencredit.core.governance.VoteOutcome;
import com.regencredit.core.kernel.RegenerationProtocol;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Governance REST API: resource publication, validation votes and delations.
 */
@RestController
@RequestMapping("/api/v1/governance")
public class GovernanceController {

    private final RegenerationProtocol protocol;

    public GovernanceController(RegenerationProtocol protocol) {
        this.protocol = protocol;
    }

    // ==================== Resources ====================

    /**
     * POST /api/v1/governance/resources
     */
    @PostMapping("/resources")
    public ResponseEntity<ResourceSnapshot> publishResource(
            @RequestHeader(ApiHeaders.ACCOUNT) String creator,
            @Valid @RequestBody ResourceRequest request) {
        ResourceSnapshot resource = protocol.publishResource(creator, request.type(), request.title(),
                request.description(), request.documentHash());
        return ResponseEntity.status(HttpStatus.CREATED).body(resource);
    }

    /**
     * GET /api/v1/governance/resources/{id}
     */
    @GetMapping("/resources/{id}")
    public ResponseEntity<ResourceSnapshot> getResource(@PathVariable long id) {
        return ResponseEntity.of(protocol.resource(id));
    }

    /**
     * GET /api/v1/governance/resources?type=REPORT
     */
    @GetMapping("/resources")
    public ResponseEntity<List<ResourceSnapshot>> listResources(@RequestParam ResourceType type) {
        return ResponseEntity.ok(protocol.resources(type));
    }

    /**
     * Vote to invalidate a resource or an inspection.
     * POST /api/v1/governance/resources/{type}/{id}/votes
     */
    @PostMapping("/resources/{type}/{id}/votes")
    public ResponseEntity<VoteOutcome> voteResource(
            @RequestHeader(ApiHeaders.ACCOUNT) String voter,
            @PathVariable ResourceType type,
            @PathVariable long id,
            @Valid @RequestBody VoteRequest request) {
        return ResponseEntity.ok(protocol.voteResource(voter, type, id, request.justification()));
    }

    /**
     * GET /api/v1/governance/penalties/{creator}?type=REPORT
     */
    @GetMapping("/penalties/{creator}")
    public ResponseEntity<Integer> getPenalties(@PathVariable String creator, @RequestParam ResourceType type) {
        return ResponseEntity.ok(protocol.penaltiesOf(creator, type));
    }

    // ==================== Users ====================

    /**
     * Vote to deny a user.
     * POST /api/v1/governance/users/{target}/votes
     */
    @PostMapping("/users/{target}/votes")
    public ResponseEntity<VoteOutcome> voteUser(
            @RequestHeader(ApiHeaders.ACCOUNT) String voter,
            @PathVariable String target,
            @Valid @RequestBody VoteRequest request) {
        return ResponseEntity.ok(protocol.voteUser(voter, target, request.justification()));
    }

    /**
     * GET /api/v1/governance/users/{target}/challenges/{era}
     */
    @GetMapping("/users/{target}/challenges/{era}")
    public ResponseEntity<UserChallenge> getChallenge(@PathVariable String target, @PathVariable int era) {
        return ResponseEntity.of(protocol.challenge(target, era));
    }

    // ==================== Voters ====================

    /**
     * Convert the caller's accumulated vote points into validator levels.
     * POST /api/v1/governance/point-conversions
     */
    @PostMapping("/point-conversions")
    public ResponseEntity<ConversionResponse> convertPoints(@RequestHeader(ApiHeaders.ACCOUNT) String voter) {
        long levels = protocol.convertPoints(voter);
        return ResponseEntity.ok(new ConversionResponse(voter, levels, protocol.pointsOf(voter)));
    }

    /**
     * GET /api/v1/governance/voters/{address}
     */
    @GetMapping("/voters/{address}")
    public ResponseEntity<VoterResponse> getVoter(@PathVariable String address) {
        return ResponseEntity.ok(new VoterResponse(address, protocol.canVote(address), protocol.pointsOf(address)));
    }

    /**
     * Votes currently needed to invalidate.
     * GET /api/v1/governance/threshold
     */
    @GetMapping("/threshold")
    public ResponseEntity<Long> getThreshold() {
        return ResponseEntity.ok(protocol.votesToInvalidate());
    }

    // ==================== Delations ====================

    /**
     * POST /api/v1/governance/delations
     */
    @PostMapping("/delations")
    public ResponseEntity<DelationSnapshot> delate(
            @RequestHeader(ApiHeaders.ACCOUNT) String informer,
            @Valid @RequestBody DelationRequest request) {
        DelationSnapshot delation = protocol.delate(informer, request.reported(), request.title(),
                request.testimony());
        return ResponseEntity.status(HttpStatus.CREATED).body(delation);
    }

    /**
     * POST /api/v1/governance/delations/{id}/thumbs-up
     */
    @PostMapping("/delations/{id}/thumbs-up")
    public ResponseEntity<DelationSnapshot> thumbsUp(
            @RequestHeader(ApiHeaders.ACCOUNT) String voter, @PathVariable long id) {
        return ResponseEntity.ok(protocol.thumbsUp(voter, id));
    }

    /**
     * POST /api/v1/governance/delations/{id}/thumbs-down
     */
    @PostMapping("/delations/{id}/thumbs-down")
    public ResponseEntity<DelationSnapshot> thumbsDown(
            @RequestHeader(ApiHeaders.ACCOUNT) String voter, @PathVariable long id) {
        return ResponseEntity.ok(protocol.thumbsDown(voter, id));
    }

    /**
     * GET /api/v1/governance/delations/{id}
     */
    @GetMapping("/delations/{id}")
    public ResponseEntity<DelationSnapshot> getDelation(@PathVariable long id) {
        return ResponseEntity.of(protocol.delation(id));
    }

    /**
     * GET /api/v1/governance/delations?reported=0x...
     */
    @GetMapping("/delations")
    public ResponseEntity<List<DelationSnapshot>> listDelations(@RequestParam String reported) {
        return ResponseEntity.ok(protocol.delationsAgainst(reported));
    }

    // DTOs
    public record ResourceRequest(
        @NotNull ResourceType type,
        @NotBlank String title,
        @NotBlank String description,
        @NotBlank String documentHash
    ) {}

    public record VoteRequest(@NotBlank String justification) {}

    public record DelationRequest(
        @NotBlank String reported,
        @NotBlank String title,
        @NotBlank String testimony
    ) {}

    public record ConversionResponse(String voter, long levelsGranted, long remainingPoints) {}

    public record VoterResponse(String address, boolean canVote, long points) {}
}
