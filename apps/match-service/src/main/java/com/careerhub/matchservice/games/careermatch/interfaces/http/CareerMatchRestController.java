package com.careerhub.matchservice.games.careermatch.interfaces.http;

import com.careerhub.web.common.ApiResponse;
import com.careerhub.matchservice.games.careermatch.domain.dto.FlipResult;
import com.careerhub.matchservice.games.careermatch.domain.dto.GameStateView;
import com.careerhub.matchservice.games.careermatch.domain.dto.JoinResult;
import com.careerhub.matchservice.games.careermatch.domain.model.GameSession;
import com.careerhub.matchservice.games.careermatch.domain.model.Participant;
import com.careerhub.matchservice.games.careermatch.interfaces.http.dto.ConnectionReport;
import com.careerhub.matchservice.games.careermatch.interfaces.http.dto.FlipCardRequest;
import com.careerhub.matchservice.games.careermatch.interfaces.http.dto.JoinGameRequest;
import com.careerhub.matchservice.games.careermatch.service.CareerMatchService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * 职业翻牌 REST 接口。
 * 翻牌接口异步返回：第二翻在揭示结束后才响应，期间不占用请求线程。
 */
@RestController
@RequestMapping("/api/career-match")
@RequiredArgsConstructor
public class CareerMatchRestController {

    private final CareerMatchService matchService;

    /**
     * 加入游戏
     */
    @PostMapping("/join")
    public ResponseEntity<ApiResponse<JoinResult>> join(@RequestBody JoinGameRequest req) {
        JoinResult r = matchService.joinGame(req.getUserId(), req.getDisplayName(), req.getDifficulty());
        return ResponseEntity.ok(ApiResponse.success(r));
    }

    /**
     * 翻牌
     */
    @PostMapping("/sessions/{sessionId}/flip")
    public CompletableFuture<ResponseEntity<ApiResponse<FlipResult>>> flip(@PathVariable String sessionId,
                                                                          @RequestBody FlipCardRequest req) {
        if (req.getPosition() == null) {
            throw new IllegalArgumentException("position 不能为空");
        }
        return matchService.flipCard(sessionId, req.getPosition(), req.getActorId())
                .thenApply(r -> ResponseEntity.ok(ApiResponse.success(r)));
    }

    /**
     * 对局全量状态（客户端冲突后据此重绘）
     */
    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<ApiResponse<GameStateView>> state(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(matchService.getGameState(sessionId)));
    }

    /**
     * 管理触发开局
     */
    @PostMapping("/sessions/{sessionId}/start")
    public ResponseEntity<ApiResponse<GameSession>> start(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(matchService.startGameSession(sessionId)));
    }

    /**
     * 上报连接状态
     */
    @PostMapping("/sessions/{sessionId}/connection")
    public ResponseEntity<ApiResponse<Participant>> connection(@PathVariable String sessionId,
                                                              @RequestBody ConnectionReport req) {
        if (req.getStatus() == null) {
            throw new IllegalArgumentException("status 不能为空");
        }
        return ResponseEntity.ok(ApiResponse.success(
                matchService.reportConnection(sessionId, req.getUserId(), req.getStatus())));
    }
}
