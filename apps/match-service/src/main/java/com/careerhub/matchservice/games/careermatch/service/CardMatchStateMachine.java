package com.careerhub.matchservice.games.careermatch.service;

import com.careerhub.matchservice.games.careermatch.config.CareerMatchProperties;
import com.careerhub.matchservice.games.careermatch.domain.constants.GameMessages;
import com.careerhub.matchservice.games.careermatch.domain.dto.FlipResult;
import com.careerhub.matchservice.games.careermatch.domain.dto.MatchAward;
import com.careerhub.matchservice.games.careermatch.domain.enums.MatchState;
import com.careerhub.matchservice.games.careermatch.domain.enums.SessionStatus;
import com.careerhub.matchservice.games.careermatch.domain.event.TurnStartedEvent;
import com.careerhub.matchservice.games.careermatch.domain.exception.CareerMatchException;
import com.careerhub.matchservice.games.careermatch.domain.exception.ErrorCode;
import com.careerhub.matchservice.games.careermatch.domain.model.Card;
import com.careerhub.matchservice.games.careermatch.domain.model.GameSession;
import com.careerhub.matchservice.games.careermatch.domain.model.Move;
import com.careerhub.matchservice.games.careermatch.domain.model.Participant;
import com.careerhub.matchservice.games.careermatch.domain.port.GameEventPublisher;
import com.careerhub.matchservice.games.careermatch.domain.port.GameEventPublisher.MatchEventType;
import com.careerhub.matchservice.games.careermatch.domain.repository.CardStore;
import com.careerhub.matchservice.games.careermatch.domain.repository.MoveStore;
import com.careerhub.matchservice.games.careermatch.domain.repository.ParticipantStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 翻牌状态机。
 * <pre>
 *   null --翻开--> M1 --配对--> M2 --> M3 (matched，永久)
 *                  M1 --未配对--> null
 * </pre>
 * 一个回合恰好两翻：
 * <ol>
 *   <li>第一翻：M1，记录 firstCardFlipped，立即返回（isMatch = null）；</li>
 *   <li>第二翻：M1，记录 secondCardFlipped，揭示等待后比较 pairId：
 *       配对则 M2→M3 并保留回合；未配对则再停留一段时间后复位，换人。</li>
 * </ol>
 * 揭示等待由 matchScheduler 的定时续作完成，不阻塞请求线程；
 * 等待期间对局锁一直持有，其它针对该对局的请求得到 TURN_CONFLICT。
 */
@Slf4j
@Service
public class CardMatchStateMachine {

    private final SessionManager sessionManager;
    private final TurnEngine turnEngine;
    private final ScoringService scoring;
    private final GameCompletionService completion;
    private final CardStore cards;
    private final ParticipantStore participants;
    private final MoveStore moves;
    private final MatchLocks locks;
    private final GameEventPublisher publisher;
    private final ApplicationEventPublisher domainEvents;
    private final CareerMatchProperties props;
    private final ScheduledExecutorService matchScheduler;
    private final Clock clock;

    public CardMatchStateMachine(SessionManager sessionManager,
                                 TurnEngine turnEngine,
                                 ScoringService scoring,
                                 GameCompletionService completion,
                                 CardStore cards,
                                 ParticipantStore participants,
                                 MoveStore moves,
                                 MatchLocks locks,
                                 GameEventPublisher publisher,
                                 ApplicationEventPublisher domainEvents,
                                 CareerMatchProperties props,
                                 @Qualifier("matchScheduler") ScheduledExecutorService matchScheduler,
                                 Clock clock) {
        this.sessionManager = sessionManager;
        this.turnEngine = turnEngine;
        this.scoring = scoring;
        this.completion = completion;
        this.cards = cards;
        this.participants = participants;
        this.moves = moves;
        this.locks = locks;
        this.publisher = publisher;
        this.domainEvents = domainEvents;
        this.props = props;
        this.matchScheduler = matchScheduler;
        this.clock = clock;
    }

    /**
     * 翻一张牌。
     * 校验失败同步抛出 CareerMatchException；第二翻的结果在揭示结束后才完成。
     *
     * @param actorId 参与者ID，或真人的 userId
     */
    public CompletableFuture<FlipResult> flip(String sessionId, int position, String actorId) {
        String token = locks.lockSession(sessionId);
        boolean deferred = false;
        try {
            GameSession session = sessionManager.requireSession(sessionId);
            if (session.getStatus() != SessionStatus.ACTIVE) {
                throw CareerMatchException.of(ErrorCode.SESSION_NOT_ACTIVE, GameMessages.SESSION_NOT_ACTIVE);
            }
            Participant actor = turnEngine.requireTurnHolder(session, actorId);
            Card card = requireCard(sessionId, position);
            if (card.isMatched()) {
                throw CareerMatchException.of(ErrorCode.CARD_ALREADY_MATCHED, GameMessages.CARD_ALREADY_MATCHED);
            }
            if (card.getMatchState() != null) {
                throw CareerMatchException.of(ErrorCode.CARD_ALREADY_REVEALED, GameMessages.CARD_ALREADY_REVEALED);
            }

            // firstCardFlipped 是区分第一翻 / 第二翻的唯一依据
            if (session.getFirstCardFlipped() == null) {
                return CompletableFuture.completedFuture(firstFlip(session, actor, card));
            }

            int firstPos = session.getFirstCardFlipped();
            card.setMatchState(MatchState.M1);
            cards.save(card);
            session.setSecondCardFlipped(position);
            sessionManager.persist(session);
            publishCards(session, card);

            CompletableFuture<FlipResult> result = new CompletableFuture<>();
            later(props.getReveal().getHoldMs(), sessionId, token, result,
                    () -> resolve(sessionId, firstPos, position, actor.getId(), token, result));
            deferred = true;
            return result;
        } finally {
            if (!deferred) {
                locks.unlockSession(sessionId, token);
            }
        }
    }

    /**
     * 回合超时（仅在强制计时模式下调用）：复位已翻开的第一张牌，连击清零，换人。
     *
     * @param expectedTurnNumber 计时器启动时的回合号；不一致说明计时器已过期
     * @return 新的回合持有者；计时器过期时返回 null
     */
    public Participant expireTurn(String sessionId, int expectedTurnNumber) {
        String token = locks.lockSession(sessionId);
        try {
            GameSession session = sessionManager.requireSession(sessionId);
            if (session.getStatus() != SessionStatus.ACTIVE
                    || session.getCurrentTurnNumber() != expectedTurnNumber
                    || session.getCurrentTurnPlayerId() == null) {
                return null;
            }
            Participant holder = participants.find(sessionId, session.getCurrentTurnPlayerId()).orElse(null);
            if (session.getFirstCardFlipped() != null) {
                Card first = requireCard(sessionId, session.getFirstCardFlipped());
                if (!first.isMatched()) {
                    first.setMatchState(null);
                    cards.save(first);
                    publishCards(session, first);
                }
            }
            if (holder != null) {
                scoring.breakStreak(holder);
                participants.save(holder);
            }
            Participant next = turnEngine.advanceTurn(session);
            sessionManager.persist(session);
            log.info("回合超时换人: session={}, turn={}, next={}", sessionId, expectedTurnNumber, next.getDisplayName());
            announceTurn(session, next);
            return next;
        } finally {
            locks.unlockSession(sessionId, token);
        }
    }

    private FlipResult firstFlip(GameSession session, Participant actor, Card card) {
        long now = clock.millis();
        card.setMatchState(MatchState.M1);
        cards.save(card);
        session.setFirstCardFlipped(card.getPosition());
        session.setFirstCardFlippedAt(now);
        session.setSecondCardFlipped(null);
        sessionManager.persist(session);

        moves.append(move(session, actor, card, 1, null, 0, actor.getCurrentStreak(), now));
        publishCards(session, card);
        return FlipResult.builder()
                .card(card)
                .firstFlip(true)
                .isMatch(null)
                .nextTurnPlayerId(actor.getId())
                .streak(actor.getCurrentStreak())
                .pairsRemaining(session.getPairsRemaining())
                .build();
    }

    /**
     * 揭示结束：比较两张牌。配对在本步完成；未配对再排一次复位续作。
     */
    private void resolve(String sessionId, int firstPos, int secondPos, String actorId,
                         String token, CompletableFuture<FlipResult> result) {
        GameSession session = sessionManager.requireSession(sessionId);
        Card first = requireCard(sessionId, firstPos);
        Card second = requireCard(sessionId, secondPos);
        Participant actor = participants.find(sessionId, actorId)
                .orElseThrow(() -> new IllegalStateException("turn holder vanished: " + actorId));

        if (first.getPairId().equals(second.getPairId())) {
            finish(sessionId, token, result, () -> commitMatch(session, actor, first, second));
            return;
        }
        publisher.publishToSession(session.getRoomId(), sessionId, MatchEventType.NO_MATCH,
                Map.of("positions", List.of(firstPos, secondPos), "participantId", actorId));
        later(props.getReveal().getMismatchHoldMs(), sessionId, token, result,
                () -> finish(sessionId, token, result, () -> resetMismatch(sessionId, firstPos, secondPos, actorId)));
    }

    private FlipResult commitMatch(GameSession session, Participant actor, Card first, Card second) {
        long now = clock.millis();
        // M1 -> M2：已判定配对，先推一帧中间态
        first.setMatchState(MatchState.M2);
        second.setMatchState(MatchState.M2);
        cards.save(first);
        cards.save(second);
        publishCards(session, first, second);

        // M2 -> M3：提交，永久翻开
        for (Card c : List.of(first, second)) {
            c.setMatchState(MatchState.M3);
            c.setMatched(true);
            c.setMatchedBy(actor.getId());
            c.setMatchedAt(now);
            cards.save(c);
        }

        actor.setPairsMatched(actor.getPairsMatched() + 1);
        MatchAward award = scoring.awardMatch(actor);
        participants.save(actor);

        session.setPairsRemaining(session.getPairsRemaining() - 1);
        turnEngine.clearFlips(session);
        sessionManager.persist(session);

        moves.append(move(session, actor, second, 2, true, award.arcadeXp(), award.streak(), now));
        publishCards(session, first, second);
        publisher.publishToSession(session.getRoomId(), session.getId(), MatchEventType.MATCH_FOUND, Map.of(
                "positions", List.of(first.getPosition(), second.getPosition()),
                "participantId", actor.getId(),
                "xpEarned", award.arcadeXp(),
                "streak", award.streak(),
                "pairsRemaining", session.getPairsRemaining()));

        boolean completed = session.getPairsRemaining() == 0;
        if (completed) {
            completion.completeGame(session);
        }
        return FlipResult.builder()
                .card(second)
                .firstFlip(false)
                .isMatch(true)
                .matchedPair(List.of(first.getPosition(), second.getPosition()))
                .nextTurnPlayerId(completed ? null : actor.getId())
                .xpEarned(award.arcadeXp())
                .streak(award.streak())
                .pairsRemaining(session.getPairsRemaining())
                .gameCompleted(completed)
                .build();
    }

    private FlipResult resetMismatch(String sessionId, int firstPos, int secondPos, String actorId) {
        long now = clock.millis();
        GameSession session = sessionManager.requireSession(sessionId);
        Card first = requireCard(sessionId, firstPos);
        Card second = requireCard(sessionId, secondPos);
        first.setMatchState(null);
        second.setMatchState(null);
        cards.save(first);
        cards.save(second);

        Participant actor = participants.find(sessionId, actorId)
                .orElseThrow(() -> new IllegalStateException("turn holder vanished: " + actorId));
        scoring.breakStreak(actor);
        participants.save(actor);

        moves.append(move(session, actor, second, 2, false, 0, 0, now));
        Participant next = turnEngine.advanceTurn(session);
        sessionManager.persist(session);

        publishCards(session, first, second);
        announceTurn(session, next);
        return FlipResult.builder()
                .card(second)
                .firstFlip(false)
                .isMatch(false)
                .nextTurnPlayerId(next.getId())
                .xpEarned(0)
                .streak(0)
                .pairsRemaining(session.getPairsRemaining())
                .build();
    }

    /**
     * 排一个续作；线程池拒绝时立即失败并释放锁。
     */
    private void later(long delayMs, String sessionId, String token, CompletableFuture<FlipResult> result, Runnable step) {
        Runnable guarded = () -> {
            try {
                step.run();
            } catch (RuntimeException e) {
                log.error("揭示续作失败: session={}", sessionId, e);
                locks.unlockSession(sessionId, token);
                result.completeExceptionally(e);
            }
        };
        try {
            matchScheduler.schedule(guarded, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            locks.unlockSession(sessionId, token);
            result.completeExceptionally(e);
            throw CareerMatchException.of(ErrorCode.TURN_CONFLICT, GameMessages.TURN_CONFLICT);
        }
    }

    /**
     * 续作的最后一步：先释放对局锁，再完成 future，保证调用方拿到结果时已可发起下一翻。
     */
    private void finish(String sessionId, String token, CompletableFuture<FlipResult> result, Supplier<FlipResult> step) {
        FlipResult r;
        try {
            r = step.get();
        } catch (RuntimeException e) {
            log.error("翻牌结算失败: session={}", sessionId, e);
            locks.unlockSession(sessionId, token);
            result.completeExceptionally(e);
            return;
        }
        locks.unlockSession(sessionId, token);
        result.complete(r);
    }

    private void announceTurn(GameSession session, Participant next) {
        publisher.publishToSession(session.getRoomId(), session.getId(), MatchEventType.TURN_CHANGED, Map.of(
                "participantId", next.getId(),
                "turnNumber", session.getCurrentTurnNumber()));
        int limit = sessionManager.requireRoom(session.getRoomId()).getTurnTimeLimitSeconds();
        domainEvents.publishEvent(new TurnStartedEvent(session.getRoomId(), session.getId(), next.getId(),
                session.getCurrentTurnNumber(), next.getTurnStartedAt() == null ? clock.millis() : next.getTurnStartedAt(), limit));
    }

    private void publishCards(GameSession session, Card... changed) {
        publisher.publishToSession(session.getRoomId(), session.getId(), MatchEventType.CARD_UPDATED, List.of(changed));
    }

    private Card requireCard(String sessionId, int position) {
        return cards.find(sessionId, position)
                .orElseThrow(() -> CareerMatchException.of(ErrorCode.CARD_NOT_FOUND, GameMessages.formatCardNotFound(position)));
    }

    private Move move(GameSession session, Participant actor, Card card, int flipNumber,
                      Boolean isMatch, int xp, int streak, long at) {
        return Move.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(session.getId())
                .participantId(actor.getId())
                .turnNumber(session.getCurrentTurnNumber())
                .flipNumber(flipNumber)
                .position(card.getPosition())
                .careerName(card.getCareerName())
                .pairId(card.getPairId())
                .isMatch(isMatch)
                .xpEarned(xp)
                .streakCount(streak)
                .flippedAt(at)
                .build();
    }
}
