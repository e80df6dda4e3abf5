package com.careerhub.matchservice.games.careermatch.service;

import com.careerhub.matchservice.common.random.RandomSource;
import com.careerhub.matchservice.games.careermatch.domain.constants.GameMessages;
import com.careerhub.matchservice.games.careermatch.domain.enums.ParticipantType;
import com.careerhub.matchservice.games.careermatch.domain.enums.RoomStatus;
import com.careerhub.matchservice.games.careermatch.domain.enums.SessionStatus;
import com.careerhub.matchservice.games.careermatch.domain.event.TurnStartedEvent;
import com.careerhub.matchservice.games.careermatch.domain.exception.CareerMatchException;
import com.careerhub.matchservice.games.careermatch.domain.exception.ErrorCode;
import com.careerhub.matchservice.games.careermatch.domain.model.GameSession;
import com.careerhub.matchservice.games.careermatch.domain.model.Participant;
import com.careerhub.matchservice.games.careermatch.domain.model.PerpetualRoom;
import com.careerhub.matchservice.games.careermatch.domain.port.GameEventPublisher;
import com.careerhub.matchservice.games.careermatch.domain.port.GameEventPublisher.MatchEventType;
import com.careerhub.matchservice.games.careermatch.domain.repository.CardStore;
import com.careerhub.matchservice.games.careermatch.domain.repository.RoomStore;
import com.careerhub.matchservice.games.careermatch.domain.repository.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * 对局管理：为房间创建 / 复用唯一的进行中对局、发牌、开局（AI 补位 + 随机先手）。
 * <p>
 * 调用方负责持有房间锁；本类只保证单次调用内的状态一致。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionManager {

    private final RoomStore rooms;
    private final SessionStore sessions;
    private final CardStore cards;
    private final ParticipantRegistry registry;
    private final AiFillService aiFill;
    private final TurnEngine turnEngine;
    private final DeckFactory deckFactory;
    private final RandomSource random;
    private final GameEventPublisher publisher;
    private final ApplicationEventPublisher domainEvents;
    private final Clock clock;

    /**
     * 返回房间当前进行中的对局；没有则新建一局并发牌。
     */
    public GameSession getOrCreateActiveSession(String roomId) {
        PerpetualRoom room = requireRoom(roomId);
        if (room.getCurrentGameId() != null) {
            GameSession current = sessions.find(room.getCurrentGameId()).orElse(null);
            if (current != null && current.getStatus() == SessionStatus.ACTIVE) {
                return current;
            }
        }

        long now = clock.millis();
        GameSession session = new GameSession();
        session.setId(UUID.randomUUID().toString());
        session.setRoomId(roomId);
        session.setGameNumber(room.getCurrentGameNumber() + 1);
        session.setStatus(SessionStatus.ACTIVE);
        session.setTotalPairs(room.getTotalPairs());
        session.setPairsRemaining(room.getTotalPairs());
        session.setCurrentTurnNumber(0);
        session.setCreatedAt(now);
        sessions.save(session);
        cards.saveAll(session.getId(), deckFactory.build(session.getId(), room.getTotalPairs()));

        // 房间指针与新局一起切换
        room.setCurrentGameNumber(session.getGameNumber());
        room.setCurrentGameId(session.getId());
        room.setCurrentPlayerCount(0);
        room.setUpdatedAt(now);
        rooms.save(room);
        log.info("新建对局: room={}, session={}, gameNumber={}", room.getRoomCode(), session.getId(), session.getGameNumber());
        return session;
    }

    /**
     * 开局。已开局的对局原样返回。
     * @throws CareerMatchException EMPTY_ROOM 没有任何参与者（调用方违约）
     */
    public GameSession startGameSession(String sessionId) {
        GameSession session = requireSession(sessionId);
        if (session.getStatus() != SessionStatus.ACTIVE) {
            throw CareerMatchException.of(ErrorCode.SESSION_NOT_ACTIVE, GameMessages.SESSION_NOT_ACTIVE);
        }
        if (session.started()) {
            return session;
        }
        PerpetualRoom room = requireRoom(session.getRoomId());
        List<Participant> roster = registry.listParticipants(sessionId);
        if (roster.isEmpty()) {
            log.error("开局失败，对局没有参与者: session={}", sessionId);
            throw CareerMatchException.of(ErrorCode.EMPTY_ROOM, GameMessages.EMPTY_ROOM);
        }

        int aiNeeded = Math.max(0, room.getMaxPlayersPerGame() - roster.size());
        if (aiNeeded > 0 && room.isAiFillEnabled()) {
            aiFill.fillSeats(session, room, aiNeeded, room.getAiFillPolicy());
            roster = registry.listParticipants(sessionId);
        }

        // 重新发牌：开局前没有翻过牌，重发不影响任何状态
        cards.deleteBySession(sessionId);
        cards.saveAll(sessionId, deckFactory.build(sessionId, session.getTotalPairs()));
        session.setPairsRemaining(session.getTotalPairs());

        Participant first = roster.get(random.nextInt(roster.size()));
        turnEngine.assignFirstTurn(session, roster, first);

        long now = clock.millis();
        session.setStartedAt(now);
        session.setTotalParticipants(roster.size());
        session.setHumanParticipants((int) roster.stream().filter(p -> p.getParticipantType() == ParticipantType.USER).count());
        session.setAiParticipants(session.getTotalParticipants() - session.getHumanParticipants());
        persist(session);

        room.setStatus(RoomStatus.ACTIVE);
        room.setNextGameStartsAt(null);
        room.setLastGameStartedAt(now);
        room.setCurrentPlayerCount(roster.size());
        room.setPeakConcurrentPlayers(Math.max(room.getPeakConcurrentPlayers(), roster.size()));
        room.setUpdatedAt(now);
        rooms.save(room);

        log.info("开局: session={}, players={} (ai={}), first={}",
                sessionId, roster.size(), session.getAiParticipants(), first.getDisplayName());
        publisher.publishToSession(room.getId(), sessionId, MatchEventType.GAME_STARTED, session);
        domainEvents.publishEvent(new TurnStartedEvent(room.getId(), sessionId, first.getId(),
                session.getCurrentTurnNumber(), now, room.getTurnTimeLimitSeconds()));
        return session;
    }

    /**
     * 乐观并发保存，版本不一致即 TURN_CONFLICT。
     */
    public void persist(GameSession session) {
        if (!sessions.compareAndSave(session)) {
            throw CareerMatchException.of(ErrorCode.TURN_CONFLICT, GameMessages.TURN_CONFLICT);
        }
    }

    public GameSession requireSession(String sessionId) {
        return sessions.find(sessionId)
                .orElseThrow(() -> CareerMatchException.of(ErrorCode.SESSION_NOT_FOUND, GameMessages.formatSessionNotFound(sessionId)));
    }

    public PerpetualRoom requireRoom(String roomId) {
        return rooms.find(roomId)
                .orElseThrow(() -> CareerMatchException.of(ErrorCode.ROOM_NOT_FOUND, GameMessages.formatRoomNotFound(roomId)));
    }
}
