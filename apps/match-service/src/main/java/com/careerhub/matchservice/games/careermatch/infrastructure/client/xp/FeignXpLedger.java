package com.careerhub.matchservice.games.careermatch.infrastructure.client.xp;

import com.careerhub.matchservice.games.careermatch.domain.dto.CareerMatchResult;
import com.careerhub.matchservice.games.careermatch.domain.port.XpLedger;
import com.careerhub.matchservice.games.careermatch.infrastructure.client.xp.dto.CareerMatchResultRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * XpLedger 端口的 Feign 实现。
 */
@Component
@RequiredArgsConstructor
public class FeignXpLedger implements XpLedger {

    private final XpLedgerClient client;

    @Override
    public void postResults(CareerMatchResult result) {
        List<CareerMatchResultRequest.Standing> standings = result.standings().stream()
                .map(w -> new CareerMatchResultRequest.Standing(w.getParticipantId(), w.getUserId(),
                        w.getDisplayName(), w.getRank(), w.getPairsMatched(), w.getArcadeXp(), w.getTotalXp()))
                .toList();
        client.postResults(new CareerMatchResultRequest(result.sessionId(), result.roomId(), result.gameNumber(),
                result.durationSeconds(), result.completedAt(), standings));
    }
}
