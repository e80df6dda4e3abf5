package com.careerhub.matchservice.games.careermatch.infrastructure.client.xp;

import com.careerhub.matchservice.games.careermatch.infrastructure.client.xp.dto.CareerMatchResultRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * XP 账本熔断兜底：记录日志，不抛异常。
 */
@Component
@Slf4j
public class XpLedgerClientFallback implements XpLedgerClient {
    @Override
    public void postResults(CareerMatchResultRequest request) {
        log.warn("xp-ledger fallback: skip posting results, session={}", request.getSessionId());
    }
}
