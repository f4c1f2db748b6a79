package com.regencredit.core.inspection;

import com.regencredit.core.community.Account;
import com.regencredit.core.community.CommunityRegistry;
import com.regencredit.core.community.UserType;
import com.regencredit.core.event.EventBus;
import com.regencredit.core.event.ProtocolEvents.InspectionRealized;
import com.regencredit.core.pool.ParticipantRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Rewards activists for bringing in regenerators and inspectors that actually work:
 * one activist level when an invitee reaches the pool-entry inspection count.
 *
 * <p>Must subscribe after {@link RegeneratorRules} and {@link InspectorRules} so the
 * counts it reads already include the realized inspection.
 */
public class ActivistRules {

    private static final Logger log = LoggerFactory.getLogger(ActivistRules.class);

    private final CommunityRegistry registry;
    private final RegeneratorRules regenerators;
    private final InspectorRules inspectors;
    private final ParticipantRules rules;
    private final int minInspectionsForPool;

    public ActivistRules(CommunityRegistry registry, RegeneratorRules regenerators, InspectorRules inspectors,
                         ParticipantRules rules, int minInspectionsForPool, EventBus eventBus) {
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        this.regenerators = Objects.requireNonNull(regenerators, "Regenerator rules cannot be null");
        this.inspectors = Objects.requireNonNull(inspectors, "Inspector rules cannot be null");
        this.rules = Objects.requireNonNull(rules, "Activist rules cannot be null");
        this.minInspectionsForPool = minInspectionsForPool;
        eventBus.subscribe(InspectionRealized.class, this::onInspectionRealized);
    }

    private void onInspectionRealized(InspectionRealized event) {
        rewardInviter(event.regenerator(), regenerators.totalInspections(event.regenerator()), event);
        rewardInviter(event.inspector(), inspectors.totalInspections(event.inspector()), event);
    }

    private void rewardInviter(String invitee, int totalInspections, InspectionRealized event) {
        if (totalInspections != minInspectionsForPool) {
            return;
        }
        Optional<String> inviter = registry.getAccount(invitee).flatMap(Account::inviter);
        if (inviter.isEmpty() || registry.typeOf(inviter.get()) != UserType.ACTIVIST
                || registry.isDenied(inviter.get())) {
            return;
        }
        if (rules.grantLevelAt("activist:" + invitee, inviter.get(), 1, event.era(), event.blockNumber())) {
            log.debug("Activist {} earned a level for {}", inviter.get(), invitee);
        }
    }

    public ParticipantRules rules() {
        return rules;
    }
}
