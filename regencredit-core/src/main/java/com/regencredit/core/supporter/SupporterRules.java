package com.regencredit.core.supporter;

import com.regencredit.core.community.CommunityRegistry;
import com.regencredit.core.community.UserType;
import com.regencredit.core.error.PreconditionViolationException;
import com.regencredit.core.error.ReasonCode;
import com.regencredit.core.event.EventBus;
import com.regencredit.core.event.ProtocolEvents.TokensOffset;
import com.regencredit.core.ledger.TokenLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Supporters join without invitation and certify regeneration by burning tokens.
 */
public class SupporterRules {

    private static final Logger log = LoggerFactory.getLogger(SupporterRules.class);

    private final CommunityRegistry registry;
    private final TokenLedger ledger;
    private final EventBus eventBus;
    private final Map<String, BigInteger> certified = new HashMap<>();

    public SupporterRules(CommunityRegistry registry, TokenLedger ledger, EventBus eventBus) {
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        this.ledger = Objects.requireNonNull(ledger, "Ledger cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
    }

    /**
     * Burns {@code amount} from the supporter's balance.
     *
     * @return the supporter's certified total after the burn
     */
    public BigInteger offset(String supporter, BigInteger amount, long blockNumber) {
        registry.requireActive(supporter, UserType.SUPPORTER);
        if (amount == null || amount.signum() <= 0) {
            throw new PreconditionViolationException(ReasonCode.INVALID_AMOUNT, "Offset amount must be positive");
        }
        ledger.burnFrom(supporter, amount);
        BigInteger total = certified.merge(supporter, amount, BigInteger::add);

        log.info("{} offset {} (certified total {})", supporter, amount, total);
        eventBus.publish(new TokensOffset(supporter, amount, total, blockNumber));
        return total;
    }

    public BigInteger certifiedOf(String supporter) {
        return certified.getOrDefault(supporter, BigInteger.ZERO);
    }
}
