package com.regencredit.api.pool;

import com.regencredit.api.ApiHeaders;
import com.regencredit.core.kernel.ProtocolOverview;
import com.regencredit.core.kernel.RegenerationProtocol;
import com.regencredit.core.pool.EraAggregate;
import com.regencredit.core.pool.PoolPosition;
import com.regencredit.core.pool.PoolStatus;
import com.regencredit.core.pool.PoolType;
import com.regencredit.core.pool.WithdrawalResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Reward pool REST API.
 */
@RestController
@RequestMapping("/api/v1/pools")
public class PoolController {

    private final RegenerationProtocol protocol;

    public PoolController(RegenerationProtocol protocol) {
        this.protocol = protocol;
    }

    /**
     * Withdraw the caller's share of its next era, or of an explicit era.
     * POST /api/v1/pools/{pool}/withdrawals
     */
    @PostMapping("/{pool}/withdrawals")
    public ResponseEntity<WithdrawalResult> withdraw(
            @RequestHeader(ApiHeaders.ACCOUNT) String account,
            @PathVariable PoolType pool,
            @RequestParam(required = false) Integer era) {
        WithdrawalResult result = era == null
                ? protocol.withdraw(pool, account)
                : protocol.withdraw(pool, account, era);
        return ResponseEntity.ok(result);
    }

    /**
     * GET /api/v1/pools/{pool}
     */
    @GetMapping("/{pool}")
    public ResponseEntity<PoolStatus> getStatus(@PathVariable PoolType pool) {
        return ResponseEntity.ok(protocol.poolStatus(pool));
    }

    /**
     * GET /api/v1/pools/{pool}/positions/{account}
     */
    @GetMapping("/{pool}/positions/{account}")
    public ResponseEntity<PoolPosition> getPosition(@PathVariable PoolType pool, @PathVariable String account) {
        return ResponseEntity.ok(protocol.position(pool, account));
    }

    /**
     * GET /api/v1/pools/{pool}/eras/{era}
     */
    @GetMapping("/{pool}/eras/{era}")
    public ResponseEntity<EraAggregate> getEra(@PathVariable PoolType pool, @PathVariable int era) {
        return ResponseEntity.ok(protocol.eraAggregate(pool, era));
    }

    /**
     * Clock, population and supply summary.
     * GET /api/v1/pools/overview
     */
    @GetMapping("/overview")
    public ResponseEntity<ProtocolOverview> getOverview() {
        return ResponseEntity.ok(protocol.overview());
    }
}
