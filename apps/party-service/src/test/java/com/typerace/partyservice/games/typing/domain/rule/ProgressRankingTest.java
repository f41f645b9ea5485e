package com.typerace.partyservice.games.typing.domain.rule;

import com.typerace.partyservice.games.typing.domain.model.Party;
import com.typerace.partyservice.games.typing.domain.model.Player;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProgressRankingTest {

    private Party party;
    private Player p1;
    private Player p2;
    private Player p3;

    @BeforeEach
    void setUp() {
        party = new Party("R", 0L);
        p1 = new Player("c1", "R");
        p2 = new Player("c2", "R");
        p3 = new Player("c3", "R");
        party.getPlayers().add(p1);
        party.getPlayers().add(p2);
        party.getPlayers().add(p3);
    }

    @Test
    void finishersArePlacedInCompletionOrder() {
        assertTrue(ProgressRanking.recordProgress(party, p2, 100));
        assertTrue(ProgressRanking.recordProgress(party, p1, 100));

        assertEquals(1, p2.getPlace());
        assertEquals(2, p1.getPlace());
        assertNull(p3.getPlace());
    }

    @Test
    void partialProgressDoesNotAssignPlace() {
        assertFalse(ProgressRanking.recordProgress(party, p1, 99));

        assertEquals(99, p1.getProgress());
        assertNull(p1.getPlace());
    }

    @Test
    void repeatedCompletionAssignsPlaceOnce() {
        ProgressRanking.recordProgress(party, p1, 100);
        assertFalse(ProgressRanking.recordProgress(party, p1, 100));
        ProgressRanking.recordProgress(party, p2, 100);

        assertEquals(1, p1.getPlace());
        assertEquals(2, p2.getPlace());
    }

    @Test
    void placeOfDepartedFinisherIsNotReused() {
        ProgressRanking.recordProgress(party, p1, 100);
        ProgressRanking.recordProgress(party, p2, 100);
        party.removePlayer("c1");

        ProgressRanking.recordProgress(party, p3, 100);

        assertEquals(2, p2.getPlace());
        assertEquals(3, p3.getPlace());
    }

    @Test
    void finalizeAfterDepartureContinuesCounting() {
        ProgressRanking.recordProgress(party, p1, 100);
        party.removePlayer("c1");
        p2.setProgress(30);
        p3.setProgress(60);

        ProgressRanking.finalizeRanking(party);

        assertEquals(2, p3.getPlace());
        assertEquals(3, p2.getPlace());
    }

    @Test
    void finalizeContinuesAfterFinishers() {
        ProgressRanking.recordProgress(party, p1, 100);
        ProgressRanking.recordProgress(party, p2, 100);
        ProgressRanking.recordProgress(party, p3, 40);

        ProgressRanking.finalizeRanking(party);

        assertEquals(1, p1.getPlace());
        assertEquals(2, p2.getPlace());
        assertEquals(3, p3.getPlace());
    }

    @Test
    void finalizeOrdersByProgressAndKeepsListOrderOnTies() {
        Player p4 = new Player("c4", "R");
        party.getPlayers().add(p4);
        ProgressRanking.recordProgress(party, p3, 100);
        p1.setProgress(20);
        p2.setProgress(70);
        p4.setProgress(20);

        ProgressRanking.finalizeRanking(party);

        assertEquals(1, p3.getPlace());
        assertEquals(2, p2.getPlace());
        assertEquals(3, p1.getPlace());
        assertEquals(4, p4.getPlace());
    }

    @Test
    void finalizeDoesNotRenumberFinishers() {
        ProgressRanking.recordProgress(party, p3, 100);
        p1.setProgress(90);

        ProgressRanking.finalizeRanking(party);
        ProgressRanking.finalizeRanking(party);

        assertEquals(1, p3.getPlace());
        assertEquals(2, p1.getPlace());
        assertEquals(3, p2.getPlace());
    }

    @Test
    void resetClearsPlaceProgressAndCounter() {
        ProgressRanking.recordProgress(party, p1, 100);
        p2.setProgress(55);

        ProgressRanking.resetRoundState(party);

        for (Player p : party.getPlayers()) {
            assertNull(p.getPlace());
            assertEquals(0, p.getProgress());
        }
        assertEquals(0, party.getPlacesAssigned());
        ProgressRanking.recordProgress(party, p2, 100);
        assertEquals(1, p2.getPlace());
    }
}
