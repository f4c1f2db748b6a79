package com.regencredit.core.inspection;

import com.regencredit.core.community.CommunityRegistry;
import com.regencredit.core.community.UserType;
import com.regencredit.core.config.ProtocolConfig.InspectionSettings;
import com.regencredit.core.error.ConsistencyViolationException;
import com.regencredit.core.error.PreconditionViolationException;
import com.regencredit.core.error.ReasonCode;
import com.regencredit.core.error.TemporalGateException;
import com.regencredit.core.event.EventBus;
import com.regencredit.core.event.ProtocolEvents.InspectionInvalidated;
import com.regencredit.core.event.ProtocolEvents.InspectionRealized;
import com.regencredit.core.pool.ParticipantRules;
import com.regencredit.core.pool.PoolPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Regenerator participation: registration with an area, inspection request gates and
 * the regenerator pool level rule.
 *
 * <p>Scores accumulate off-pool until the regenerator reaches the pool-entry inspection
 * count. The entering inspection posts the whole accumulated score, every later one
 * posts its own. An invalidation that drops the count below the entry count takes the
 * regenerator back off the pool, and its unpaid levels return to the accumulated score.
 */
public class RegeneratorRules {

    private static final Logger log = LoggerFactory.getLogger(RegeneratorRules.class);

    private final InspectionSettings settings;
    private final CommunityRegistry registry;
    private final ParticipantRules rules;
    private final Map<String, RegeneratorProfile> profiles = new HashMap<>();

    public RegeneratorRules(InspectionSettings settings, CommunityRegistry registry, ParticipantRules rules,
                            EventBus eventBus) {
        this.settings = Objects.requireNonNull(settings, "Inspection settings cannot be null");
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        this.rules = Objects.requireNonNull(rules, "Regenerator rules cannot be null");
        eventBus.subscribe(InspectionRealized.class, this::onInspectionRealized);
        eventBus.subscribe(InspectionInvalidated.class, this::onInspectionInvalidated);
    }

    // ==================== Registration ====================

    public RegeneratorStatus register(String address, String name, String proofPhotoHash, long area,
                                      long blockNumber) {
        if (area < settings.minArea() || area > settings.maxArea()) {
            throw new PreconditionViolationException(ReasonCode.AREA_OUT_OF_BOUNDS,
                    "Area " + area + " outside " + settings.minArea() + ".." + settings.maxArea());
        }
        registry.addUser(address, UserType.REGENERATOR, name, proofPhotoHash, blockNumber);
        RegeneratorProfile profile = new RegeneratorProfile(address, area);
        profiles.put(address, profile);
        return snapshot(profile, blockNumber);
    }

    // ==================== Inspection requests ====================

    void requireCanRequest(String address, long blockNumber) {
        registry.requireActive(address, UserType.REGENERATOR);
        RegeneratorProfile profile = require(address);
        if (profile.pendingInspection) {
            throw new PreconditionViolationException(ReasonCode.PENDING_INSPECTION,
                    address + " already has a pending inspection");
        }
        if (profile.totalInspections >= settings.maxInspections()) {
            throw new PreconditionViolationException(ReasonCode.INSPECTION_LIMIT_REACHED,
                    address + " reached " + settings.maxInspections() + " inspections");
        }
        if (profile.lastRequestAt != null && blockNumber < profile.lastRequestAt + settings.requestCooldown()) {
            throw new TemporalGateException(ReasonCode.REQUEST_COOLDOWN,
                    address + " requested an inspection recently", profile.lastRequestAt + settings.requestCooldown());
        }
    }

    void markPending(String address, long blockNumber) {
        RegeneratorProfile profile = require(address);
        profile.pendingInspection = true;
        profile.lastRequestAt = blockNumber;
    }

    void clearPending(String address) {
        RegeneratorProfile profile = profiles.get(address);
        if (profile != null) {
            profile.pendingInspection = false;
        }
    }

    // ==================== Level rule ====================

    private void onInspectionRealized(InspectionRealized event) {
        RegeneratorProfile profile = require(event.regenerator());
        profile.pendingInspection = false;
        profile.totalInspections++;
        profile.regenerationScore += event.regenerationScore();

        if (profile.onContractPool) {
            postScore(profile, event.inspectionId(), event.regenerationScore(), event.era(), event.blockNumber());
            return;
        }
        profile.unpostedScores.put(event.inspectionId(), event.regenerationScore());
        if (profile.totalInspections >= settings.minInspectionsForPool()) {
            enterPool(profile, event.inspectionId(), event.era(), event.blockNumber());
        }
    }

    private void enterPool(RegeneratorProfile profile, long inspectionId, int era, long blockNumber) {
        long accumulated = profile.unpostedScores.values().stream().mapToLong(Long::longValue).sum();
        if (accumulated > 0) {
            rules.grantLevelAt(eventId(inspectionId), profile.address(), accumulated, era, blockNumber);
        }
        profile.unpostedScores.forEach((id, score) -> profile.postedLevels.put(id, new PostedLevel(era, score)));
        profile.unpostedScores.clear();
        profile.onContractPool = true;
        profile.poolEntryEra = era;
        log.info("Regenerator {} entered the pool in era {} with {} levels", profile.address(), era, accumulated);
    }

    private void postScore(RegeneratorProfile profile, long inspectionId, long score, int era, long blockNumber) {
        if (score > 0) {
            rules.grantLevelAt(eventId(inspectionId), profile.address(), score, era, blockNumber);
        }
        profile.postedLevels.put(inspectionId, new PostedLevel(era, score));
    }

    // ==================== Invalidation hooks ====================

    private void onInspectionInvalidated(InspectionInvalidated event) {
        RegeneratorProfile profile = require(event.regenerator());
        profile.pendingInspection = false;
        if (event.previousStatus() == InspectionStatus.INSPECTED) {
            decrementInspections(event.regenerator(), event.regenerationScore());
            removeInspectionLevels(event.regenerator(), event.inspectionId(), event.blockNumber());
            if (profile.onContractPool && profile.totalInspections < settings.minInspectionsForPool()) {
                leavePool(profile, event.blockNumber());
            }
        }
    }

    private void leavePool(RegeneratorProfile profile, long blockNumber) {
        String address = profile.address();
        boolean denied = registry.isDenied(address);
        long returned = 0;
        Iterator<Map.Entry<Long, PostedLevel>> posted = profile.postedLevels.entrySet().iterator();
        while (posted.hasNext()) {
            Map.Entry<Long, PostedLevel> entry = posted.next();
            PostedLevel level = entry.getValue();
            // Paid eras are final.
            if (rules.pool().hasWithdrawn(address, level.era())) {
                continue;
            }
            if (level.amount() > 0 && !denied) {
                rules.removeLevel(address, level.era(), level.amount(), blockNumber);
            }
            profile.unpostedScores.put(entry.getKey(), level.amount());
            returned += level.amount();
            posted.remove();
        }
        profile.onContractPool = false;
        profile.poolEntryEra = 0;
        log.info("Regenerator {} left the pool below {} inspections, {} levels back to its accumulated score",
                address, settings.minInspectionsForPool(), returned);
    }

    /**
     * Takes an invalidated inspection out of the regenerator's count and score.
     */
    public void decrementInspections(String address, long score) {
        RegeneratorProfile profile = require(address);
        if (profile.totalInspections <= 0 || profile.regenerationScore < score) {
            throw new ConsistencyViolationException(ReasonCode.COUNTER_UNDERFLOW,
                    "Inspection count of " + address + " would underflow");
        }
        profile.totalInspections--;
        profile.regenerationScore -= score;
    }

    /**
     * Claws back the levels an invalidated inspection posted. Scores still accumulating
     * off-pool are simply dropped.
     */
    public void removeInspectionLevels(String address, long inspectionId, long blockNumber) {
        RegeneratorProfile profile = require(address);
        if (profile.unpostedScores.remove(inspectionId) != null) {
            return;
        }
        PostedLevel posted = profile.postedLevels.remove(inspectionId);
        if (posted == null || posted.amount() == 0 || registry.isDenied(address)) {
            return;
        }
        rules.removeLevel(address, posted.era(), posted.amount(), blockNumber);
        log.info("Removed {} levels of {} for invalidated inspection {}", posted.amount(), address, inspectionId);
    }

    // ==================== Queries ====================

    public Optional<RegeneratorStatus> status(String address, long blockNumber) {
        RegeneratorProfile profile = profiles.get(address);
        return profile == null ? Optional.empty() : Optional.of(snapshot(profile, blockNumber));
    }

    public int totalInspections(String address) {
        RegeneratorProfile profile = profiles.get(address);
        return profile == null ? 0 : profile.totalInspections;
    }

    public ParticipantRules rules() {
        return rules;
    }

    private RegeneratorStatus snapshot(RegeneratorProfile profile, long blockNumber) {
        PoolPosition position = rules.pool().position(profile.address(), blockNumber);
        return profile.snapshot(position.era(), position.totalLevels());
    }

    private RegeneratorProfile require(String address) {
        RegeneratorProfile profile = profiles.get(address);
        if (profile == null) {
            throw new PreconditionViolationException(ReasonCode.NOT_REGISTERED, address + " is not a regenerator");
        }
        return profile;
    }

    private static String eventId(long inspectionId) {
        return "inspection:" + inspectionId + ":regenerator";
    }
}
