package com.careerhub.matchservice.games.careermatch.support;

import com.careerhub.matchservice.games.careermatch.config.CareerMatchProperties;
import com.careerhub.matchservice.games.careermatch.domain.enums.AiFillPolicy;
import com.careerhub.matchservice.games.careermatch.domain.enums.Difficulty;
import com.careerhub.matchservice.games.careermatch.domain.enums.RoomStatus;
import com.careerhub.matchservice.games.careermatch.domain.model.Card;
import com.careerhub.matchservice.games.careermatch.domain.model.GameSession;
import com.careerhub.matchservice.games.careermatch.domain.model.Participant;
import com.careerhub.matchservice.games.careermatch.domain.model.PerpetualRoom;
import com.careerhub.matchservice.games.careermatch.domain.dto.CareerMatchResult;
import com.careerhub.matchservice.games.careermatch.domain.port.XpLedger;
import com.careerhub.matchservice.games.careermatch.infrastructure.persona.ConfiguredAiPersonaPool;
import com.careerhub.matchservice.games.careermatch.service.AiFillService;
import com.careerhub.matchservice.games.careermatch.service.CardMatchStateMachine;
import com.careerhub.matchservice.games.careermatch.service.DeckFactory;
import com.careerhub.matchservice.games.careermatch.service.GameCompletionService;
import com.careerhub.matchservice.games.careermatch.service.MatchLocks;
import com.careerhub.matchservice.games.careermatch.service.ParticipantRegistry;
import com.careerhub.matchservice.games.careermatch.service.RoomAllocator;
import com.careerhub.matchservice.games.careermatch.service.ScoringService;
import com.careerhub.matchservice.games.careermatch.service.SessionManager;
import com.careerhub.matchservice.games.careermatch.service.TurnEngine;
import com.careerhub.matchservice.games.careermatch.service.impl.CareerMatchServiceImpl;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 用内存仓储把整套服务装配起来（不启动 Spring 容器）。
 * 揭示时长默认 0，续作在单线程调度器上执行。
 */
public class CareerMatchFixture implements AutoCloseable {

    public static final Instant START = Instant.parse("2026-03-01T08:00:00Z");

    public final CareerMatchProperties props = new CareerMatchProperties();
    public final MutableClock clock = new MutableClock(START);
    public final SeededRandomSource random;

    public final InMemoryRoomStore rooms = new InMemoryRoomStore();
    public final InMemorySessionStore sessions = new InMemorySessionStore();
    public final InMemoryParticipantStore participants = new InMemoryParticipantStore();
    public final InMemoryCardStore cards = new InMemoryCardStore();
    public final InMemoryMoveStore moves = new InMemoryMoveStore();
    public final InMemoryGameLock gameLock = new InMemoryGameLock();

    public final RecordingEventPublisher publisher = new RecordingEventPublisher();
    /** Spring 领域事件（SessionOpenedEvent / TurnStartedEvent / SessionClosedEvent） */
    public final List<Object> domainEvents = new CopyOnWriteArrayList<>();
    public final List<CareerMatchResult> postedResults = new CopyOnWriteArrayList<>();

    public final ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1);

    public final ScoringService scoring;
    public final ParticipantRegistry registry;
    public final AiFillService aiFill;
    public final DeckFactory deckFactory;
    public final TurnEngine turnEngine;
    public final SessionManager sessionManager;
    public final RoomAllocator allocator;
    public final GameCompletionService completion;
    public final MatchLocks locks;
    public final CardMatchStateMachine stateMachine;
    public final CareerMatchServiceImpl service;

    public CareerMatchFixture() {
        this(42L, null);
    }

    /**
     * @param xpLedger 为 null 时记录到 postedResults；账本推送在调用线程上同步执行
     */
    public CareerMatchFixture(long seed, XpLedger xpLedger) {
        this(seed, xpLedger, Runnable::run);
    }

    public CareerMatchFixture(long seed, XpLedger xpLedger, Executor xpLedgerExecutor) {
        props.getReveal().setHoldMs(0);
        props.getReveal().setMismatchHoldMs(0);
        random = new SeededRandomSource(seed);
        XpLedger ledger = xpLedger != null ? xpLedger : postedResults::add;
        ApplicationEventPublisher events = domainEvents::add;

        scoring = new ScoringService(props);
        registry = new ParticipantRegistry(participants, rooms, clock);
        aiFill = new AiFillService(new ConfiguredAiPersonaPool(props, random), registry, random);
        deckFactory = new DeckFactory(random);
        turnEngine = new TurnEngine(participants, registry, clock);
        sessionManager = new SessionManager(rooms, sessions, cards, registry, aiFill, turnEngine,
                deckFactory, random, publisher, events, clock);
        allocator = new RoomAllocator(rooms);
        locks = new MatchLocks(gameLock, props);
        completion = new GameCompletionService(sessionManager, rooms, sessions, registry, turnEngine,
                locks, ledger, xpLedgerExecutor, publisher, events, clock);
        stateMachine = new CardMatchStateMachine(sessionManager, turnEngine, scoring, completion, cards,
                participants, moves, locks, publisher, events, props, scheduler, clock);
        service = new CareerMatchServiceImpl(allocator, sessionManager, registry, stateMachine, cards,
                locks, publisher, events, props, clock);
    }

    public PerpetualRoom room(String code, Difficulty difficulty, int maxPlayers, int totalPairs) {
        PerpetualRoom r = new PerpetualRoom();
        r.setId(UUID.randomUUID().toString());
        r.setRoomCode(code);
        r.setRoomName(code);
        r.setDifficulty(difficulty);
        r.setStatus(RoomStatus.ACTIVE);
        r.setIntermissionDurationSeconds(10);
        r.setMaxPlayersPerGame(maxPlayers);
        r.setTotalPairs(totalPairs);
        r.setTurnTimeLimitSeconds(30);
        r.setAiFillEnabled(true);
        r.setAiFillPolicy(AiFillPolicy.MIXED);
        r.setEnabled(true);
        r.setFeatured(true);
        r.setCreatedAt(clock.millis());
        rooms.save(r);
        return r;
    }

    /**
     * 开一局：真人按顺序入座，其余座位由 AI 补齐，然后开局。
     */
    public GameSession startedSession(PerpetualRoom room, String... userIds) {
        GameSession session = sessionManager.getOrCreateActiveSession(room.getId());
        for (String userId : userIds) {
            registry.addUserParticipant(session, sessionManager.requireRoom(room.getId()), userId, userId);
        }
        return sessionManager.startGameSession(session.getId());
    }

    /**
     * 用指定布局替换牌面。pairIds[i] 即位置 i 的 pairId。
     */
    public void layDeck(String sessionId, String... pairIds) {
        cards.deleteBySession(sessionId);
        List<Card> deck = new ArrayList<>();
        for (int i = 0; i < pairIds.length; i++) {
            Card c = new Card();
            c.setSessionId(sessionId);
            c.setPosition(i);
            c.setPairId(pairIds[i]);
            c.setCareerName(pairIds[i]);
            deck.add(c);
        }
        cards.saveAll(sessionId, deck);
    }

    /**
     * 把回合直接交给指定参与者（用于固定先手）。
     */
    public void giveTurnTo(String sessionId, String participantId) {
        GameSession session = sessionManager.requireSession(sessionId);
        for (Participant p : registry.listParticipants(sessionId)) {
            p.setActiveTurn(p.getId().equals(participantId));
            participants.save(p);
        }
        session.setCurrentTurnPlayerId(participantId);
        sessionManager.persist(session);
    }

    public GameSession session(String sessionId) {
        return sessionManager.requireSession(sessionId);
    }

    public Participant participant(String sessionId, String participantId) {
        return participants.find(sessionId, participantId).orElseThrow();
    }

    public Card card(String sessionId, int position) {
        return cards.find(sessionId, position).orElseThrow();
    }

    @Override
    public void close() throws InterruptedException {
        scheduler.shutdownNow();
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
    }
}
