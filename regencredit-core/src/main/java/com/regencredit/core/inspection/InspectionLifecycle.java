package com.regencredit.core.inspection;

import com.regencredit.core.community.CommunityRegistry;
import com.regencredit.core.community.UserType;
import com.regencredit.core.config.ProtocolConfig.InspectionSettings;
import com.regencredit.core.config.TextLimits;
import com.regencredit.core.error.PreconditionViolationException;
import com.regencredit.core.error.ReasonCode;
import com.regencredit.core.error.TemporalGateException;
import com.regencredit.core.event.EventBus;
import com.regencredit.core.event.ProtocolEvents.InspectionExpired;
import com.regencredit.core.event.ProtocolEvents.InspectionInvalidated;
import com.regencredit.core.event.ProtocolEvents.InspectionRealized;
import com.regencredit.core.event.ProtocolEvents.UserDenied;
import com.regencredit.core.time.EraClock;
import com.regencredit.core.time.SafeguardWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Inspection state machine: {@code OPEN -> ACCEPTED -> INSPECTED}, with
 * {@code INVALIDATED} reachable from ACCEPTED or INSPECTED through governance.
 * Denying a regenerator closes its open and accepted inspections; denying an inspector
 * returns its accepted inspection to OPEN.
 *
 * <p>Deadlines are evaluated lazily: an overdue acceptance is expired by the next call
 * that touches it, or explicitly through {@link #expireInspection}. Level rules react to
 * the published events in subscription order.
 */
public class InspectionLifecycle {

    private static final Logger log = LoggerFactory.getLogger(InspectionLifecycle.class);

    private final InspectionSettings settings;
    private final ScoringTable scoringTable;
    private final EraClock clock;
    private final SafeguardWindow safeguard;
    private final CommunityRegistry registry;
    private final RegeneratorRules regenerators;
    private final InspectorRules inspectors;
    private final EventBus eventBus;

    private final Map<Long, Inspection> inspections = new LinkedHashMap<>();
    private final Map<Integer, EraImpact> impactByEra = new HashMap<>();
    private long nextId = 1;

    public InspectionLifecycle(InspectionSettings settings, ScoringTable scoringTable, EraClock clock,
                               SafeguardWindow safeguard, CommunityRegistry registry,
                               RegeneratorRules regenerators, InspectorRules inspectors, EventBus eventBus) {
        this.settings = Objects.requireNonNull(settings, "Inspection settings cannot be null");
        this.scoringTable = Objects.requireNonNull(scoringTable, "Scoring table cannot be null");
        this.clock = Objects.requireNonNull(clock, "Era clock cannot be null");
        this.safeguard = Objects.requireNonNull(safeguard, "Safeguard window cannot be null");
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        this.regenerators = Objects.requireNonNull(regenerators, "Regenerator rules cannot be null");
        this.inspectors = Objects.requireNonNull(inspectors, "Inspector rules cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
        eventBus.subscribe(UserDenied.class, this::onUserDenied);
    }

    // ==================== Request ====================

    public InspectionSnapshot requestInspection(String regenerator, long blockNumber) {
        regenerators.requireCanRequest(regenerator, blockNumber);

        Inspection inspection = new Inspection(nextId++, regenerator, blockNumber);
        inspections.put(inspection.id(), inspection);
        regenerators.markPending(regenerator, blockNumber);

        log.info("Inspection #{} requested by {}", inspection.id(), regenerator);
        return inspection.snapshot();
    }

    // ==================== Accept ====================

    /**
     * Accepts an open inspection, or takes over one whose acceptance passed its deadline.
     * An overdue inspection the caller itself holds is expired first.
     */
    public InspectionSnapshot acceptInspection(String inspector, long inspectionId, long blockNumber) {
        Inspection inspection = require(inspectionId);
        boolean takeOver = inspection.isOverdue(blockNumber, settings.acceptanceDeadline());
        if (inspection.status() != InspectionStatus.OPEN && !takeOver) {
            throw new PreconditionViolationException(ReasonCode.INVALID_INSPECTION_STATE,
                    "Inspection #" + inspectionId + " is " + inspection.status());
        }
        registry.requireActive(inspection.regenerator());
        safeguard.requireOpen(blockNumber, "Accepting an inspection");

        OptionalLong active = inspectors.activeInspectionOf(inspector);
        Inspection overdueOwn = null;
        if (active.isPresent() && active.getAsLong() != inspectionId) {
            Inspection current = inspections.get(active.getAsLong());
            if (current != null && current.isOverdue(blockNumber, settings.acceptanceDeadline())) {
                overdueOwn = current;
            }
        }
        boolean ownTakeOver = takeOver && active.isPresent() && active.getAsLong() == inspectionId;
        inspectors.requireCanAccept(inspector, inspection.regenerator(), blockNumber,
                overdueOwn != null || ownTakeOver);
        if (overdueOwn != null && inspectors.giveUpsOf(inspector) + 1 >= settings.maxGiveUps()) {
            throw new PreconditionViolationException(ReasonCode.INSPECTOR_BUSY,
                    inspector + " must expire inspection #" + overdueOwn.id() + " first");
        }

        if (overdueOwn != null) {
            expire(overdueOwn, blockNumber);
        }
        if (takeOver) {
            expire(inspection, blockNumber);
        }
        inspection.accept(inspector, blockNumber, clock.currentEra(blockNumber));
        inspectors.markAccepted(inspector, inspectionId, blockNumber);

        log.info("Inspection #{} accepted by {}", inspectionId, inspector);
        return inspection.snapshot();
    }

    // ==================== Realize ====================

    /**
     * Submits the inspection results. Results above the configured maxima are capped.
     */
    public InspectionSnapshot realizeInspection(String inspector, long inspectionId, long treesResult,
                                                long biodiversityResult, String evidenceHash,
                                                String justificationHash, long blockNumber) {
        Inspection inspection = require(inspectionId);
        registry.requireActive(inspector, UserType.INSPECTOR);
        registry.requireActive(inspection.regenerator());
        if (inspection.status() != InspectionStatus.ACCEPTED) {
            throw new PreconditionViolationException(ReasonCode.INVALID_INSPECTION_STATE,
                    "Inspection #" + inspectionId + " is " + inspection.status());
        }
        if (!inspector.equals(inspection.inspector())) {
            throw new PreconditionViolationException(ReasonCode.NOT_ASSIGNED_INSPECTOR,
                    inspector + " did not accept inspection #" + inspectionId);
        }
        if (inspection.isOverdue(blockNumber, settings.acceptanceDeadline())) {
            throw new PreconditionViolationException(ReasonCode.INSPECTION_EXPIRED,
                    "Inspection #" + inspectionId + " passed its deadline");
        }
        if (treesResult < 0 || biodiversityResult < 0) {
            throw new PreconditionViolationException(ReasonCode.RESULT_OUT_OF_BOUNDS,
                    "Inspection results cannot be negative");
        }
        TextLimits.require("evidenceHash", evidenceHash, TextLimits.HASH);
        TextLimits.require("justificationHash", justificationHash, TextLimits.HASH);

        long trees = Math.min(treesResult, settings.maxTreesResult());
        long biodiversity = Math.min(biodiversityResult, settings.maxBiodiversityResult());
        long score = scoringTable.score(trees, biodiversity);
        int era = clock.currentEra(blockNumber);

        inspection.realize(trees, biodiversity, score, evidenceHash, justificationHash, blockNumber, era);
        impactByEra.put(era, eraImpact(era).plus(trees, biodiversity));

        log.info("Inspection #{} realized by {}: trees={}, biodiversity={}, score={}",
                inspectionId, inspector, trees, biodiversity, score);
        eventBus.publish(new InspectionRealized(inspectionId, inspection.regenerator(), inspector,
                trees, biodiversity, score, era, blockNumber));
        return inspection.snapshot();
    }

    // ==================== Expiry ====================

    /**
     * Returns an overdue acceptance to OPEN and charges the inspector a give-up.
     *
     * @throws TemporalGateException while the deadline has not passed
     */
    public InspectionSnapshot expireInspection(long inspectionId, long blockNumber) {
        Inspection inspection = require(inspectionId);
        if (inspection.status() != InspectionStatus.ACCEPTED) {
            throw new PreconditionViolationException(ReasonCode.INVALID_INSPECTION_STATE,
                    "Inspection #" + inspectionId + " is " + inspection.status());
        }
        if (!inspection.isOverdue(blockNumber, settings.acceptanceDeadline())) {
            throw new TemporalGateException(ReasonCode.INSPECTION_NOT_EXPIRED,
                    "Inspection #" + inspectionId + " is within its deadline",
                    inspection.acceptedAt() + settings.acceptanceDeadline() + 1);
        }
        expire(inspection, blockNumber);
        return inspection.snapshot();
    }

    private void expire(Inspection inspection, long blockNumber) {
        String inspector = inspection.inspector();
        inspection.reopen();
        int giveUps = inspectors.recordGiveUp(inspector, inspection.id(), blockNumber);
        log.info("Inspection #{} expired, {} gave up", inspection.id(), inspector);
        eventBus.publish(new InspectionExpired(inspection.id(), inspector, giveUps, blockNumber));
    }

    // ==================== Invalidation ====================

    /**
     * Invalidates an accepted or inspected inspection after a successful challenge.
     * Level rules claw back what the inspection posted.
     */
    public InspectionSnapshot invalidateInspection(long inspectionId, long blockNumber) {
        Inspection inspection = require(inspectionId);
        InspectionStatus previous = inspection.status();
        if (previous != InspectionStatus.ACCEPTED && previous != InspectionStatus.INSPECTED) {
            throw new PreconditionViolationException(ReasonCode.INVALID_INSPECTION_STATE,
                    "Inspection #" + inspectionId + " is " + previous);
        }
        inspection.invalidate(blockNumber);
        if (previous == InspectionStatus.INSPECTED) {
            impactByEra.computeIfPresent(inspection.inspectedAtEra(),
                    (k, impact) -> impact.minus(inspection.treesResult(), inspection.biodiversityResult()));
        }

        log.info("Inspection #{} invalidated (was {})", inspectionId, previous);
        eventBus.publish(new InspectionInvalidated(inspectionId, inspection.regenerator(), inspection.inspector(),
                previous, inspection.regenerationScore(), inspection.reviewEra(), blockNumber));
        return inspection.snapshot();
    }

    // ==================== Denial ====================

    private void onUserDenied(UserDenied event) {
        for (Inspection inspection : List.copyOf(inspections.values())) {
            InspectionStatus status = inspection.status();
            if (event.account().equals(inspection.regenerator())
                    && (status == InspectionStatus.OPEN || status == InspectionStatus.ACCEPTED)) {
                inspection.invalidate(event.blockNumber());
                log.info("Inspection #{} closed, regenerator {} was denied", inspection.id(), event.account());
                eventBus.publish(new InspectionInvalidated(inspection.id(), inspection.regenerator(),
                        inspection.inspector(), status, 0, inspection.reviewEra(), event.blockNumber()));
            } else if (status == InspectionStatus.ACCEPTED && event.account().equals(inspection.inspector())) {
                inspection.reopen();
                log.info("Inspection #{} reopened, inspector {} was denied", inspection.id(), event.account());
            }
        }
    }

    // ==================== Queries ====================

    public Optional<Inspection> find(long inspectionId) {
        return Optional.ofNullable(inspections.get(inspectionId));
    }

    public Optional<InspectionSnapshot> inspection(long inspectionId) {
        return find(inspectionId).map(Inspection::snapshot);
    }

    public List<InspectionSnapshot> inspections(InspectionStatus status) {
        return inspections.values().stream()
                .filter(inspection -> status == null || inspection.status() == status)
                .map(Inspection::snapshot)
                .toList();
    }

    public EraImpact eraImpact(int era) {
        return impactByEra.getOrDefault(era, EraImpact.empty(era));
    }

    public EraImpact totalImpact() {
        long trees = 0;
        long biodiversity = 0;
        long realized = 0;
        for (EraImpact impact : impactByEra.values()) {
            trees += impact.trees();
            biodiversity += impact.biodiversity();
            realized += impact.realizedInspections();
        }
        return new EraImpact(0, trees, biodiversity, realized);
    }

    private Inspection require(long inspectionId) {
        Inspection inspection = inspections.get(inspectionId);
        if (inspection == null) {
            throw new PreconditionViolationException(ReasonCode.INSPECTION_NOT_FOUND,
                    "Inspection #" + inspectionId + " does not exist");
        }
        return inspection;
    }
}
