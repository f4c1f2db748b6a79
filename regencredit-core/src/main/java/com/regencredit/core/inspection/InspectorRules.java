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
import com.regencredit.core.event.ProtocolEvents.UserRegistered;
import com.regencredit.core.pool.ParticipantRules;
import com.regencredit.core.pool.PoolPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Inspector participation: one active inspection at a time, a delay between
 * acceptances, one realized inspection per regenerator for life and the give-up penalty.
 *
 * <p>Each realized inspection is worth one inspector level.
 */
public class InspectorRules {

    private static final Logger log = LoggerFactory.getLogger(InspectorRules.class);

    private final InspectionSettings settings;
    private final CommunityRegistry registry;
    private final ParticipantRules rules;
    private final Map<String, InspectorProfile> profiles = new HashMap<>();

    public InspectorRules(InspectionSettings settings, CommunityRegistry registry, ParticipantRules rules,
                          EventBus eventBus) {
        this.settings = Objects.requireNonNull(settings, "Inspection settings cannot be null");
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        this.rules = Objects.requireNonNull(rules, "Inspector rules cannot be null");
        eventBus.subscribe(UserRegistered.class, this::onUserRegistered);
        eventBus.subscribe(InspectionRealized.class, this::onInspectionRealized);
        eventBus.subscribe(InspectionInvalidated.class, this::onInspectionInvalidated);
    }

    private void onUserRegistered(UserRegistered event) {
        if (event.type() == UserType.INSPECTOR) {
            profiles.put(event.account(), new InspectorProfile(event.account()));
        }
    }

    // ==================== Acceptance ====================

    /**
     * Checks every acceptance gate.
     *
     * @param activeIsOverdue whether the inspector's active inspection, if any, passed its deadline
     */
    void requireCanAccept(String address, String regenerator, long blockNumber, boolean activeIsOverdue) {
        registry.requireActive(address, UserType.INSPECTOR);
        InspectorProfile profile = require(address);
        if (profile.activeInspection != null && !activeIsOverdue) {
            throw new PreconditionViolationException(ReasonCode.INSPECTOR_BUSY,
                    address + " is already inspecting #" + profile.activeInspection);
        }
        if (profile.lastAcceptedAt != null && blockNumber < profile.lastAcceptedAt + settings.interInspectionDelay()) {
            throw new TemporalGateException(ReasonCode.INSPECTOR_COOLDOWN,
                    address + " accepted an inspection recently",
                    profile.lastAcceptedAt + settings.interInspectionDelay());
        }
        if (profile.inspectedRegenerators.contains(regenerator)) {
            throw new PreconditionViolationException(ReasonCode.ALREADY_INSPECTED_REGENERATOR,
                    address + " already inspected " + regenerator);
        }
    }

    void markAccepted(String address, long inspectionId, long blockNumber) {
        InspectorProfile profile = require(address);
        profile.activeInspection = inspectionId;
        profile.lastAcceptedAt = blockNumber;
    }

    OptionalLong activeInspectionOf(String address) {
        InspectorProfile profile = profiles.get(address);
        return profile == null || profile.activeInspection == null
                ? OptionalLong.empty()
                : OptionalLong.of(profile.activeInspection);
    }

    // ==================== Give-ups ====================

    /**
     * Records an expired acceptance. Reaching the give-up limit denies the inspector.
     *
     * @return the inspector's give-up count after this one
     */
    int recordGiveUp(String address, long inspectionId, long blockNumber) {
        InspectorProfile profile = require(address);
        if (profile.activeInspection != null && profile.activeInspection == inspectionId) {
            profile.activeInspection = null;
        }
        profile.giveUps++;
        profile.penalties++;
        log.info("Inspector {} gave up inspection #{} ({} give-ups)", address, inspectionId, profile.giveUps);
        if (profile.giveUps >= settings.maxGiveUps() && !registry.isDenied(address)) {
            registry.setToDenied(address, blockNumber);
        }
        return profile.giveUps;
    }

    int giveUpsOf(String address) {
        InspectorProfile profile = profiles.get(address);
        return profile == null ? 0 : profile.giveUps;
    }

    // ==================== Level rule ====================

    private void onInspectionRealized(InspectionRealized event) {
        InspectorProfile profile = require(event.inspector());
        profile.activeInspection = null;
        profile.totalInspections++;
        profile.lastRealizedAt = event.blockNumber();
        profile.inspectedRegenerators.add(event.regenerator());
        rules.grantLevelAt(eventId(event.inspectionId()), event.inspector(), 1, event.era(), event.blockNumber());
        profile.postedLevels.put(event.inspectionId(), new PostedLevel(event.era(), 1));
    }

    private void onInspectionInvalidated(InspectionInvalidated event) {
        InspectorProfile profile = profiles.get(event.inspector());
        if (profile == null) {
            return;
        }
        if (profile.activeInspection != null && profile.activeInspection == event.inspectionId()) {
            profile.activeInspection = null;
        }
        if (event.previousStatus() == InspectionStatus.INSPECTED) {
            if (profile.totalInspections <= 0) {
                throw new ConsistencyViolationException(ReasonCode.COUNTER_UNDERFLOW,
                        "Inspection count of " + event.inspector() + " would underflow");
            }
            profile.totalInspections--;
            PostedLevel posted = profile.postedLevels.remove(event.inspectionId());
            if (posted != null && !registry.isDenied(event.inspector())) {
                rules.removeLevel(event.inspector(), posted.era(), posted.amount(), event.blockNumber());
            }
        }
    }

    // ==================== Queries ====================

    public Optional<InspectorStatus> status(String address, long blockNumber) {
        InspectorProfile profile = profiles.get(address);
        if (profile == null) {
            return Optional.empty();
        }
        PoolPosition position = rules.pool().position(address, blockNumber);
        return Optional.of(profile.snapshot(position.era(), position.totalLevels()));
    }

    public int totalInspections(String address) {
        InspectorProfile profile = profiles.get(address);
        return profile == null ? 0 : profile.totalInspections;
    }

    public ParticipantRules rules() {
        return rules;
    }

    private InspectorProfile require(String address) {
        InspectorProfile profile = profiles.get(address);
        if (profile == null) {
            throw new PreconditionViolationException(ReasonCode.NOT_REGISTERED, address + " is not an inspector");
        }
        return profile;
    }

    private static String eventId(long inspectionId) {
        return "inspection:" + inspectionId + ":inspector";
    }
}
