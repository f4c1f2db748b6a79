package com.regencredit.api.integration;

import com.regencredit.api.ApiHeaders;
import com.regencredit.api.RegenCreditApiApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of the REST layer over an in-memory ledger and a manual clock.
 * The application context is shared, so every test works with its own addresses.
 */
@SpringBootTest(
    classes = RegenCreditApiApplication.class,
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class ApiIntegrationTest {

    private static final String ACTIVIST = "0xfounder-activist";
    private static final String DEVELOPER = "0xfounder-dev1";
    private static final String RESEARCHER = "0xfounder-res1";

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    private String baseUrl;

    @BeforeEach
    void setUp() {
        baseUrl = "http://localhost:" + port + "/api/v1";
    }

    // ==================== Community ====================

    @Test
    void invitedRegenerator_shouldRegisterAndBeVisible() {
        ResponseEntity<Map> invitation = post("/community/invitations", ACTIVIST,
            Map.of("invitee", "0xreg-visible", "userType", "REGENERATOR"));
        assertThat(invitation.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(invitation.getBody().get("status")).isEqualTo("LIVE");
        assertThat(invitation.getBody().get("inviter")).isEqualTo(ACTIVIST);

        ResponseEntity<Map> registered = post("/community/regenerators", "0xreg-visible",
            Map.of("name", "Visible farm", "proofPhotoHash", "QmPhoto", "area", 10_000));
        assertThat(registered.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(registered.getBody().get("area")).isEqualTo(10_000);

        ResponseEntity<Map> account = get("/community/accounts/0xreg-visible");
        assertThat(account.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(account.getBody().get("type")).isEqualTo("REGENERATOR");
        assertThat(account.getBody().get("inviter")).isEqualTo(ACTIVIST);
    }

    @Test
    void registrationWithoutInvitation_shouldConflict() {
        ResponseEntity<Map> response = post("/community/regenerators", "0xreg-uninvited",
            Map.of("name", "Uninvited", "proofPhotoHash", "QmPhoto", "area", 10_000));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().get("code")).isEqualTo("INVITATION_REQUIRED");
    }

    @Test
    void unknownAccount_shouldReturnNotFound() {
        ResponseEntity<Map> response = get("/community/accounts/0xnobody");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void populationOfOpenType_shouldReportRegistrations() {
        post("/community/users", "0xsupporter-count", Map.of("userType", "SUPPORTER", "name", "Counted"));

        ResponseEntity<Map> response = get("/community/population/SUPPORTER");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(((Number) response.getBody().get("registered")).longValue()).isGreaterThanOrEqualTo(1);
    }

    @Test
    void supporterWithoutTokens_shouldFailOnTheLedger() {
        post("/community/users", "0xsupporter-broke", Map.of("userType", "SUPPORTER", "name", "Broke"));

        ResponseEntity<Map> response = post("/community/offsets", "0xsupporter-broke", Map.of("amount", 1_000));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().get("code")).isEqualTo("LEDGER_FAILURE");
    }

    // ==================== Inspections ====================

    @Test
    void inspection_shouldRunFromRequestToRealization() {
        enroll("0xreg-flow", "0xinsp-flow");

        ResponseEntity<Map> requested = post("/inspections", "0xreg-flow", null);
        assertThat(requested.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(requested.getBody().get("status")).isEqualTo("OPEN");
        long id = ((Number) requested.getBody().get("id")).longValue();
        long requestedAt = ((Number) requested.getBody().get("createdAt")).longValue();

        ResponseEntity<Map> accepted = post("/inspections/" + id + "/accept", "0xinsp-flow", null);
        assertThat(accepted.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(accepted.getBody().get("inspector")).isEqualTo("0xinsp-flow");

        ResponseEntity<Map> realized = post("/inspections/" + id + "/realize", "0xinsp-flow",
            Map.of("treesResult", 1_000, "biodiversityResult", 10,
                "evidenceHash", "QmEvidence", "justificationHash", "QmReport"));
        assertThat(realized.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(realized.getBody().get("status")).isEqualTo("INSPECTED");

        ResponseEntity<Map> again = post("/inspections", "0xreg-flow", null);
        assertThat(again.getStatusCode().value()).isEqualTo(425);
        assertThat(again.getBody().get("code")).isEqualTo("REQUEST_COOLDOWN");
        assertThat(((Number) again.getBody().get("availableAtBlock")).longValue()).isEqualTo(requestedAt + 6_000);

        ResponseEntity<Map> regenerator = get("/inspections/regenerators/0xreg-flow");
        assertThat(regenerator.getBody().get("totalInspections")).isEqualTo(1);
    }

    @Test
    void unknownInspection_shouldReturnNotFound() {
        assertThat(get("/inspections/99999").getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);

        enroll("0xreg-unknown", "0xinsp-unknown");
        ResponseEntity<Map> response = post("/inspections/99999/accept", "0xinsp-unknown", null);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().get("code")).isEqualTo("INSPECTION_NOT_FOUND");
    }

    @Test
    void negativeResult_shouldBeRejectedByValidation() {
        ResponseEntity<Map> response = post("/inspections/1/realize", "0xinsp-negative",
            Map.of("treesResult", -1, "biodiversityResult", 0,
                "evidenceHash", "QmEvidence", "justificationHash", "QmReport"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().get("code")).isEqualTo("INVALID_REQUEST");
    }

    @Test
    void missingAccountHeader_shouldBeBadRequest() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<Map> response = restTemplate.exchange(baseUrl + "/inspections", HttpMethod.POST,
            new HttpEntity<>(headers), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    // ==================== Pools ====================

    @Test
    void withdrawalDuringRunningEra_shouldHaveNothingToClaim() {
        enroll("0xreg-withdraw", "0xinsp-withdraw");

        ResponseEntity<Map> response = post("/pools/REGENERATOR/withdrawals", "0xreg-withdraw", null);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().get("status")).isEqualTo("NOTHING_TO_CLAIM");
    }

    @Test
    void poolStatusAndOverview_shouldBeReadable() {
        ResponseEntity<Map> status = get("/pools/INSPECTOR");
        assertThat(status.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(status.getBody().get("pool")).isEqualTo("INSPECTOR");

        ResponseEntity<Map> overview = get("/pools/overview");
        assertThat(overview.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(overview.getBody()).containsKeys("blockNumber", "era", "totalSupply");
        assertThat(overview.getBody().get("safeguardActive")).isEqualTo(false);
    }

    @Test
    void unknownPool_shouldBeBadRequest() {
        assertThat(get("/pools/MINERS").getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    // ==================== Governance ====================

    @Test
    void publishedReport_shouldCollectVotesAndEnforceCooldown() {
        ResponseEntity<Map> published = post("/governance/resources", DEVELOPER,
            Map.of("type", "REPORT", "title", "Sensor firmware", "description", "Release notes",
                "documentHash", "QmReportDoc"));
        assertThat(published.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        long id = ((Number) published.getBody().get("id")).longValue();
        long createdAt = ((Number) published.getBody().get("createdAt")).longValue();

        ResponseEntity<Map> second = post("/governance/resources", DEVELOPER,
            Map.of("type", "REPORT", "title", "Second", "description", "Too soon",
                "documentHash", "QmReportDoc2"));
        assertThat(second.getStatusCode().value()).isEqualTo(425);
        assertThat(((Number) second.getBody().get("availableAtBlock")).longValue()).isEqualTo(createdAt + 1_000);

        ResponseEntity<Map> vote = post("/governance/resources/REPORT/" + id + "/votes", RESEARCHER,
            Map.of("justification", "Document does not match the hash"));
        assertThat(vote.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(vote.getBody().get("votes")).isEqualTo(1);
        assertThat(vote.getBody().get("invalidated")).isEqualTo(false);

        ResponseEntity<Map> selfVote = post("/governance/resources/REPORT/" + id + "/votes", DEVELOPER,
            Map.of("justification", "Voting on my own"));
        assertThat(selfVote.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);

        ResponseEntity<List> reports = restTemplate.getForEntity(baseUrl + "/governance/resources?type=REPORT",
            List.class);
        assertThat(reports.getBody()).isNotEmpty();
    }

    @Test
    void nonVoter_shouldNotBeAllowedToVote() {
        post("/community/users", "0xsupporter-voter", Map.of("userType", "SUPPORTER", "name", "Supporter"));

        ResponseEntity<Map> response = post("/governance/users/0xfounder-dev2/votes", "0xsupporter-voter",
            Map.of("justification", "No reason"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().get("code")).isEqualTo("NOT_ALLOWED_TO_VOTE");
    }

    @Test
    void threshold_shouldNeverDropBelowMinimum() {
        ResponseEntity<Long> response = restTemplate.getForEntity(baseUrl + "/governance/threshold", Long.class);

        assertThat(response.getBody()).isGreaterThanOrEqualTo(2L);
    }

    // ==================== Helpers ====================

    private void enroll(String regenerator, String inspector) {
        post("/community/invitations", ACTIVIST, Map.of("invitee", regenerator, "userType", "REGENERATOR"));
        post("/community/regenerators", regenerator,
            Map.of("name", "Farm " + regenerator, "proofPhotoHash", "QmPhoto", "area", 10_000));
        post("/community/invitations", ACTIVIST, Map.of("invitee", inspector, "userType", "INSPECTOR"));
        post("/community/users", inspector,
            Map.of("userType", "INSPECTOR", "name", "Inspector " + inspector, "proofPhotoHash", "QmPhoto"));
    }

    private ResponseEntity<Map> post(String path, String account, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(ApiHeaders.ACCOUNT, account);
        return restTemplate.exchange(baseUrl + path, HttpMethod.POST, new HttpEntity<>(body, headers), Map.class);
    }

    private ResponseEntity<Map> get(String path) {
        return restTemplate.getForEntity(baseUrl + path, Map.class);
    }
}
