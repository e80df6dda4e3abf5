package com.careerhub.matchservice.games.careermatch.infrastructure.client.xp;

import com.careerhub.matchservice.games.careermatch.infrastructure.client.xp.dto.CareerMatchResultRequest;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * 调用平台 XP 账本的内部接口（对局结算后推送排名与 XP）。
 */
@FeignClient(name = "xp-ledger", url = "${career-match.xp-ledger.url:http://localhost:8090}",
        path = "/api/internal/xp", fallback = XpLedgerClientFallback.class)
public interface XpLedgerClient {

    @PostMapping("/career-match-results")
    @CircuitBreaker(name = "xpLedgerClient")
    void postResults(@RequestBody CareerMatchResultRequest request);
}
