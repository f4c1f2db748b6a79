package com.regencredit.api.community;

import com.regencredit.api.ApiHeaders;
import com.regencredit.core.community.AccountSnapshot;
import com.regencredit.core.community.Invitation;
import com.regencredit.core.community.UserType;
import com.regencredit.core.inspection.RegeneratorStatus;
import com.regencredit.core.kernel.RegenerationProtocol;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

/**
 * Community REST API: invitations, registration, supporter offsets.
 */
@RestController
@RequestMapping("/api/v1/community")
public class CommunityController {

    private final RegenerationProtocol protocol;

    public CommunityController(RegenerationProtocol protocol) {
        this.protocol = protocol;
    }

    /**
     * Invite an address as a given user type.
     * POST /api/v1/community/invitations
     */
    @PostMapping("/invitations")
    public ResponseEntity<InvitationResponse> invite(
            @RequestHeader(ApiHeaders.ACCOUNT) String inviter,
            @Valid @RequestBody InvitationRequest request) {
        Invitation invitation = protocol.invite(inviter, request.invitee(), request.userType());
        return ResponseEntity.status(HttpStatus.CREATED).body(InvitationResponse.from(invitation));
    }

    /**
     * Register the caller as a non-regenerator user.
     * POST /api/v1/community/users
     */
    @PostMapping("/users")
    public ResponseEntity<AccountSnapshot> registerUser(
            @RequestHeader(ApiHeaders.ACCOUNT) String address,
            @Valid @RequestBody RegistrationRequest request) {
        AccountSnapshot account = protocol.registerUser(address, request.userType(), request.name(),
                request.proofPhotoHash());
        return ResponseEntity.status(HttpStatus.CREATED).body(account);
    }

    /**
     * Register the caller as a regenerator with its area.
     * POST /api/v1/community/regenerators
     */
    @PostMapping("/regenerators")
    public ResponseEntity<RegeneratorStatus> registerRegenerator(
            @RequestHeader(ApiHeaders.ACCOUNT) String address,
            @Valid @RequestBody RegeneratorRequest request) {
        RegeneratorStatus status = protocol.registerRegenerator(address, request.name(),
                request.proofPhotoHash(), request.area());
        return ResponseEntity.status(HttpStatus.CREATED).body(status);
    }

    /**
     * GET /api/v1/community/accounts/{address}
     */
    @GetMapping("/accounts/{address}")
    public ResponseEntity<AccountSnapshot> getAccount(@PathVariable String address) {
        return ResponseEntity.of(protocol.account(address));
    }

    /**
     * Whether the account may invite right now.
     * GET /api/v1/community/accounts/{address}/can-invite
     */
    @GetMapping("/accounts/{address}/can-invite")
    public ResponseEntity<Boolean> canInvite(@PathVariable String address) {
        return ResponseEntity.ok(protocol.canInvite(address));
    }

    /**
     * Registered count and current cap of a user type.
     * GET /api/v1/community/population/{type}
     */
    @GetMapping("/population/{type}")
    public ResponseEntity<PopulationResponse> getPopulation(@PathVariable UserType type) {
        return ResponseEntity.ok(new PopulationResponse(type, protocol.countOf(type), protocol.populationCap(type)));
    }

    /**
     * Burn supporter tokens as a certified offset.
     * POST /api/v1/community/offsets
     */
    @PostMapping("/offsets")
    public ResponseEntity<OffsetResponse> offset(
            @RequestHeader(ApiHeaders.ACCOUNT) String supporter,
            @Valid @RequestBody OffsetRequest request) {
        BigInteger certified = protocol.offset(supporter, request.amount());
        return ResponseEntity.ok(new OffsetResponse(supporter, request.amount(), certified));
    }

    /**
     * GET /api/v1/community/offsets/{address}
     */
    @GetMapping("/offsets/{address}")
    public ResponseEntity<OffsetResponse> getCertified(@PathVariable String address) {
        return ResponseEntity.ok(new OffsetResponse(address, BigInteger.ZERO, protocol.certifiedOf(address)));
    }

    // DTOs
    public record InvitationRequest(
        @NotBlank String invitee,
        @NotNull UserType userType
    ) {}

    public record RegistrationRequest(
        @NotNull UserType userType,
        @NotBlank String name,
        String proofPhotoHash
    ) {}

    public record RegeneratorRequest(
        @NotBlank String name,
        @NotBlank String proofPhotoHash,
        @Positive long area
    ) {}

    public record OffsetRequest(
        @NotNull @Positive BigInteger amount
    ) {}

    public record InvitationResponse(
        String invited,
        String inviter,
        UserType userType,
        long createdAtBlock,
        String status
    ) {
        static InvitationResponse from(Invitation invitation) {
            return new InvitationResponse(invitation.invited(), invitation.inviter(), invitation.userType(),
                    invitation.createdAtBlock(), invitation.status().name());
        }
    }

    public record PopulationResponse(UserType type, long registered, long cap) {}

    public record OffsetResponse(String supporter, BigInteger offset, BigInteger totalCertified) {}
}
