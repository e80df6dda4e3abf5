package com.careerhub.matchservice.games.careermatch.application;

import com.careerhub.matchservice.games.careermatch.domain.event.SessionClosedEvent;
import com.careerhub.matchservice.games.careermatch.domain.event.SessionOpenedEvent;
import com.careerhub.matchservice.games.careermatch.domain.exception.CareerMatchException;
import com.careerhub.matchservice.games.careermatch.domain.exception.ErrorCode;
import com.careerhub.matchservice.games.careermatch.domain.model.GameSession;
import com.careerhub.matchservice.games.careermatch.service.CareerMatchService;
import com.careerhub.matchservice.games.careermatch.service.GameCompletionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ScheduledThreadPoolExecutor;

import static org.mockito.Mockito.after;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RoomCycleCoordinatorTest {

    @Mock
    private CareerMatchService matchService;

    @Mock
    private GameCompletionService completion;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC);
    private ScheduledThreadPoolExecutor scheduler;
    private RoomCycleCoordinator coordinator;

    @BeforeEach
    void setUp() {
        scheduler = new ScheduledThreadPoolExecutor(1);
        coordinator = new RoomCycleCoordinator(matchService, completion, scheduler, clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    @DisplayName("补位时间到达后开局")
    void onSessionOpened_startsWhenDue() {
        coordinator.onSessionOpened(new SessionOpenedEvent("r1", "s1", clock.millis()));

        verify(matchService, timeout(2000)).startGameSession("s1");
    }

    @Test
    @DisplayName("补位时间未到时不开局")
    void onSessionOpened_waitsUntilDue() {
        coordinator.onSessionOpened(new SessionOpenedEvent("r1", "s1", clock.millis() + 60_000));

        verify(matchService, after(300).never()).startGameSession("s1");
    }

    @Test
    @DisplayName("房间正忙时重试开局")
    void fillAndStart_retriesOnRoomBusy() {
        when(matchService.startGameSession("s1"))
                .thenThrow(CareerMatchException.of(ErrorCode.ROOM_BUSY, "busy"))
                .thenReturn(new GameSession());

        coordinator.fillAndStart("s1");

        verify(matchService, timeout(3000).times(2)).startGameSession("s1");
    }

    @Test
    @DisplayName("状态类错误不重试")
    void fillAndStart_noRetryOnStateError() {
        when(matchService.startGameSession("s1"))
                .thenThrow(CareerMatchException.of(ErrorCode.SESSION_NOT_ACTIVE, "done"));

        coordinator.fillAndStart("s1");

        verify(matchService, after(800).times(1)).startGameSession("s1");
    }

    @Test
    @DisplayName("局间休息结束后恢复房间")
    void onSessionClosed_reopensRoom() {
        coordinator.onSessionClosed(new SessionClosedEvent("r1", "s1", clock.millis()));

        verify(completion, timeout(2000)).reopenRoom("r1");
        verify(matchService, never()).startGameSession("s1");
    }

    @Test
    @DisplayName("恢复开放时房间正忙则稍后重试")
    void reopen_retriesOnRoomBusy() {
        when(completion.reopenRoom("r1"))
                .thenThrow(CareerMatchException.of(ErrorCode.ROOM_BUSY, "busy"))
                .thenReturn(true);

        coordinator.reopen("r1");

        verify(completion, timeout(3000).times(2)).reopenRoom("r1");
    }
}
