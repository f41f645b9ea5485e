package com.typerace.partyservice.games.typing.service.impl;

import com.typerace.partyservice.clock.scheduler.RoomTimerSchedulerImpl;
import com.typerace.partyservice.config.TypingProperties;
import com.typerace.partyservice.games.typing.application.PartyBroadcaster;
import com.typerace.partyservice.games.typing.application.PartyStateMachine;
import com.typerace.partyservice.games.typing.application.RoundClockCoordinator;
import com.typerace.partyservice.games.typing.domain.challenge.ChallengeTextGenerator;
import com.typerace.partyservice.games.typing.domain.constants.PartyEvents;
import com.typerace.partyservice.games.typing.domain.enums.PartyState;
import com.typerace.partyservice.games.typing.domain.model.PartySnapshot;
import com.typerace.partyservice.games.typing.domain.model.PlayerView;
import com.typerace.partyservice.games.typing.service.PartyService;
import com.typerace.partyservice.games.typing.service.dto.JoinResult;
import com.typerace.partyservice.platform.ws.ConnectionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;
import java.util.Random;
import java.util.concurrent.ScheduledThreadPoolExecutor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PartyServiceImplTest {

    private static final String ROOM = "R";

    private ScheduledThreadPoolExecutor executor;
    private RoomTimerSchedulerImpl timers;
    private RoundClockCoordinator roundClock;
    private ConnectionRegistry connections;
    private PartyBroadcaster broadcaster;
    private TypingProperties properties;
    private PartyServiceImpl service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        executor = new ScheduledThreadPoolExecutor(1);
        executor.setRemoveOnCancelPolicy(true);
        timers = new RoomTimerSchedulerImpl(executor);
        ObjectProvider<PartyService> provider = mock(ObjectProvider.class);
        when(provider.getObject()).thenAnswer(inv -> service);
        roundClock = new RoundClockCoordinator(timers, provider);

        properties = new TypingProperties();
        properties.getRound().setDurationMs(60_000L);
        ChallengeTextGenerator generator = new ChallengeTextGenerator(List.of("alpha", "beta"), 12, new Random(5));
        PartyStateMachine stateMachine = new PartyStateMachine(generator, roundClock, properties);

        connections = new ConnectionRegistry();
        broadcaster = mock(PartyBroadcaster.class);
        service = new PartyServiceImpl(connections, stateMachine, broadcaster);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private PartySnapshot snapshot() {
        return service.snapshot(ROOM).orElseThrow();
    }

    private void connectAndJoin(String connectionId, String name) {
        service.connect(connectionId);
        service.joinRoom(ROOM, connectionId, name);
    }

    @Test
    void connectRegistersAnonymousPlayer() {
        service.connect("a");

        assertEquals("Anonymous", connections.lookup("a").orElseThrow().getName());
        assertTrue(service.acknowledge("a"));
        verify(broadcaster).sendToConnection(eq("a"), eq(PartyEvents.RES_CONN), any());
        assertFalse(service.acknowledge("ghost"));
    }

    @Test
    void joinCreatesLobbyPartyAndRepliesToCaller() {
        service.connect("a");

        JoinResult result = service.joinRoom(ROOM, "a", "Alice").orElseThrow();

        assertEquals("Alice", result.player().name());
        assertEquals(ROOM, result.player().room());
        assertEquals(PartyState.LOBBY, result.party().state());
        assertEquals(ROOM, connections.lookup("a").orElseThrow().getRoom());
        verify(broadcaster).sendToConnection(eq("a"), eq(PartyEvents.JOIN_ROOM_SUCCESS), any(PlayerView.class));
        verify(broadcaster).publish(argThat(s -> s.players().size() == 1));
    }

    @Test
    void repeatedJoinsNeverDuplicatePlayers() {
        service.connect("a");
        service.connect("b");

        service.joinRoom(ROOM, "a", "Alice");
        service.joinRoom(ROOM, "a", "Alice");
        service.joinRoom(ROOM, "b", "Bob");
        service.joinRoom(ROOM, "a", "Alice2");

        List<PlayerView> players = snapshot().players();
        assertEquals(2, players.size());
        assertEquals(List.of("a", "b"), players.stream().map(PlayerView::connectionId).toList());
        assertEquals("Alice2", players.get(0).name());
    }

    @Test
    void joinFromUnknownConnectionIsIgnored() {
        assertTrue(service.joinRoom(ROOM, "ghost", "x").isEmpty());
        assertTrue(service.snapshot(ROOM).isEmpty());
    }

    @Test
    void blankNameKeepsCurrentName() {
        service.connect("a");

        assertEquals("Anonymous", service.joinRoom(ROOM, "a", "  ").orElseThrow().player().name());
    }

    @Test
    void joiningAnotherRoomLeavesThePreviousOne() {
        connectAndJoin("a", "Alice");
        connectAndJoin("b", "Bob");

        service.joinRoom("OTHER", "a", "Alice");

        assertEquals(1, snapshot().players().size());
        assertTrue(service.findInRoom(ROOM, "a").isEmpty());
        assertTrue(service.findInRoom("OTHER", "a").isPresent());
    }

    @Test
    void readinessDrivesLobbyAndReady() {
        connectAndJoin("a", "Alice");
        connectAndJoin("b", "Bob");

        service.updateReadiness(ROOM, "a", true);
        assertEquals(PartyState.LOBBY, snapshot().state());

        service.updateReadiness(ROOM, "b", true);
        assertEquals(PartyState.READY, snapshot().state());
        assertNotNull(snapshot().targetString());

        service.updateReadiness(ROOM, "a", false);
        assertEquals(PartyState.LOBBY, snapshot().state());
    }

    @Test
    void newcomerRevertsReadyRoomToLobby() {
        connectAndJoin("a", "Alice");
        service.updateReadiness(ROOM, "a", true);
        assertEquals(PartyState.READY, snapshot().state());

        connectAndJoin("b", "Bob");

        assertEquals(PartyState.LOBBY, snapshot().state());
    }

    @Test
    void eventsForUnknownRoomAreDropped() {
        service.connect("a");

        assertFalse(service.updateReadiness("nope", "a", true));
        assertFalse(service.updateProgress("nope", "a", 50));
        assertFalse(service.startGame("nope", "a"));
        assertFalse(service.onRoundTimeout("nope", 1L));
        verify(broadcaster, never()).publish(any());
    }

    @Test
    void nonMemberCannotStart() {
        connectAndJoin("a", "Alice");
        service.connect("b");

        assertFalse(service.startGame(ROOM, "b"));
        assertEquals(PartyState.LOBBY, snapshot().state());
    }

    @Test
    void progressOnlyAcceptedWhileRunning() {
        connectAndJoin("a", "Alice");

        assertFalse(service.updateProgress(ROOM, "a", 100));
        assertNull(service.findInRoom(ROOM, "a").orElseThrow().place());

        service.startGame(ROOM, "a");
        assertTrue(service.updateProgress(ROOM, "a", 50));
        assertEquals(50, service.findInRoom(ROOM, "a").orElseThrow().progress());
    }

    @Test
    void outOfRangeProgressIsDropped() {
        connectAndJoin("a", "Alice");
        service.startGame(ROOM, "a");

        assertFalse(service.updateProgress(ROOM, "a", 101));
        assertFalse(service.updateProgress(ROOM, "a", -1));
        assertEquals(0, service.findInRoom(ROOM, "a").orElseThrow().progress());
    }

    @Test
    void finishersThenTimeoutProduceFullRanking() {
        connectAndJoin("p1", "P1");
        connectAndJoin("p2", "P2");
        connectAndJoin("p3", "P3");
        service.startGame(ROOM, "p3");

        service.updateProgress(ROOM, "p1", 100);
        service.updateProgress(ROOM, "p2", 100);
        service.updateProgress(ROOM, "p3", 40);
        assertTrue(service.onRoundTimeout(ROOM, snapshot().roundSeq()));

        PartySnapshot snap = snapshot();
        assertEquals(PartyState.FINISHED, snap.state());
        assertEquals(1, snap.player("p1").place());
        assertEquals(2, snap.player("p2").place());
        assertEquals(3, snap.player("p3").place());
    }

    @Test
    void completingTwiceAssignsPlaceOnce() {
        connectAndJoin("a", "Alice");
        connectAndJoin("b", "Bob");
        service.startGame(ROOM, "a");

        service.updateProgress(ROOM, "a", 100);
        service.updateProgress(ROOM, "a", 100);
        service.updateProgress(ROOM, "b", 100);

        assertEquals(1, snapshot().player("a").place());
        assertEquals(2, snapshot().player("b").place());
    }

    @Test
    void finisherLeavingMidRoundDoesNotFreeTheirPlace() {
        connectAndJoin("a", "A");
        connectAndJoin("b", "B");
        connectAndJoin("c", "C");
        service.startGame(ROOM, "a");

        service.updateProgress(ROOM, "a", 100);
        service.updateProgress(ROOM, "b", 100);
        service.leaveRoom("a");
        service.updateProgress(ROOM, "c", 100);

        assertEquals(2, snapshot().player("b").place());
        assertEquals(3, snapshot().player("c").place());
    }

    @Test
    void timeoutFromDissolvedRoomDoesNotEndRecreatedRoom() {
        connectAndJoin("a", "Alice");
        service.startGame(ROOM, "a");
        long staleRound = snapshot().roundSeq();
        service.disconnect("a");

        connectAndJoin("b", "Bob");
        service.startGame(ROOM, "b");

        assertFalse(service.onRoundTimeout(ROOM, staleRound));
        assertEquals(PartyState.RUNNING, snapshot().state());
        assertNull(snapshot().player("b").place());
    }

    @Test
    void secondStartReplacesRoundTimer() {
        connectAndJoin("a", "Alice");

        service.startGame(ROOM, "a");
        service.startGame(ROOM, "a");

        assertEquals(2L, snapshot().roundSeq());
        assertEquals(1, timers.activeCount());
        assertFalse(service.onRoundTimeout(ROOM, 1L));
        assertEquals(PartyState.RUNNING, snapshot().state());
    }

    @Test
    void lastPlayerLeavingDeletesPartyAndTimer() {
        connectAndJoin("a", "Alice");
        service.startGame(ROOM, "a");
        assertTrue(roundClock.isRunning(ROOM));

        service.disconnect("a");

        assertTrue(service.snapshot(ROOM).isEmpty());
        assertFalse(roundClock.isRunning(ROOM));
        assertTrue(connections.lookup("a").isEmpty());
        assertFalse(service.onRoundTimeout(ROOM, 1L));
    }

    @Test
    void leavingBroadcastsToRemainingPlayers() {
        connectAndJoin("a", "Alice");
        connectAndJoin("b", "Bob");
        clearInvocations(broadcaster);

        service.leaveRoom("b");

        ArgumentCaptor<PartySnapshot> captor = ArgumentCaptor.forClass(PartySnapshot.class);
        verify(broadcaster).publish(captor.capture());
        assertEquals(1, captor.getValue().players().size());
        assertNull(connections.lookup("b").orElseThrow().getRoom());
    }

    @Test
    void remainingReadyPlayersEnterReadyWhenStragglerLeaves() {
        connectAndJoin("a", "Alice");
        connectAndJoin("b", "Bob");
        service.updateReadiness(ROOM, "a", true);

        service.disconnect("b");

        assertEquals(PartyState.READY, snapshot().state());
    }

    @Test
    void listPartiesReturnsEveryRoom() {
        connectAndJoin("a", "Alice");
        service.connect("b");
        service.joinRoom("OTHER", "b", "Bob");

        assertEquals(2, service.listParties().size());
    }

    @Test
    void fullRoundEndsWhenTimerElapses() {
        properties.getRound().setDurationMs(150L);
        connectAndJoin("a", "Alice");
        connectAndJoin("b", "Bob");

        service.updateReadiness(ROOM, "a", true);
        service.updateReadiness(ROOM, "b", true);
        assertEquals(PartyState.READY, snapshot().state());

        assertTrue(service.startGame(ROOM, "a"));
        assertEquals(PartyState.RUNNING, snapshot().state());
        service.updateProgress(ROOM, "b", 60);

        verify(broadcaster, timeout(3_000)).publish(argThat(s -> s.state() == PartyState.FINISHED));
        PartySnapshot done = snapshot();
        assertEquals(PartyState.FINISHED, done.state());
        assertEquals(1, done.player("b").place());
        assertEquals(2, done.player("a").place());
        assertFalse(roundClock.isRunning(ROOM));
    }
}
