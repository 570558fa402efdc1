package com.tugochat.tugochat_api.service;

import com.tugochat.tugochat_api.exception.AlreadyQueuedException;
import com.tugochat.tugochat_api.exception.DuplicateParticipantException;
import com.tugochat.tugochat_api.messaging.GameMessages;
import com.tugochat.tugochat_api.messaging.MessageSender;
import com.tugochat.tugochat_api.model.Player;
import com.tugochat.tugochat_api.model.QueueEntry;
import com.tugochat.tugochat_api.model.SideId;
import com.tugochat.util.MutableClock;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.tugochat.util.TestFixtures.T0;
import static com.tugochat.util.TestFixtures.buildPlayer;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MatchmakingQueueTest {

    @Mock private MatchRegistry matchRegistry;
    @Mock private MessageSender sender;

    private MutableClock clock;
    private MatchmakingQueue queue;

    private final Player alice = buildPlayer("alice", 100);
    private final Player bob = buildPlayer("bob", 1000);
    private final Player carol = buildPlayer("carol", 50);

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        queue = new MatchmakingQueue(matchRegistry, sender, clock);
    }

    // =========================================================================
    // Join / leave
    // =========================================================================

    @Nested
    @DisplayName("Join and leave")
    class JoinAndLeave {

        @Test
        @DisplayName("enqueue_acknowledgesWithQueueJoined")
        void enqueue_acknowledgesWithQueueJoined() {
            QueueEntry entry = queue.enqueue(alice, "s-alice");

            assertEquals(T0, entry.joinedAt());
            assertTrue(queue.isQueued("alice"));
            verify(sender).send("s-alice", GameMessages.queueJoined());
        }

        @Test
        @DisplayName("enqueueTwice_throwsAlreadyQueued")
        void enqueueTwice_throwsAlreadyQueued() {
            queue.enqueue(alice, "s-alice");

            assertThrows(AlreadyQueuedException.class, () -> queue.enqueue(alice, "s-alice-2"));
            assertEquals(1, queue.size());
        }

        @Test
        @DisplayName("enqueueWhilePlaying_throwsAlreadyQueued")
        void enqueueWhilePlaying_throwsAlreadyQueued() {
            when(matchRegistry.hasLiveMatch("alice")).thenReturn(true);

            assertThrows(AlreadyQueuedException.class, () -> queue.enqueue(alice, "s-alice"));
            verifyNoInteractions(sender);
        }

        @Test
        @DisplayName("dequeue_removesAndAcknowledges")
        void dequeue_removesAndAcknowledges() {
            queue.enqueue(alice, "s-alice");

            assertTrue(queue.dequeue("alice"));

            assertEquals(0, queue.size());
            verify(sender).send("s-alice", GameMessages.queueLeft());
        }

        @Test
        @DisplayName("dequeueAbsentPlayer_isSilentNoOp")
        void dequeueAbsentPlayer_isSilentNoOp() {
            queue.enqueue(alice, "s-alice");
            queue.dequeue("alice");
            clearInvocations(sender);

            assertFalse(queue.dequeue("alice"));
            verifyNoInteractions(sender);
        }

        @Test
        @DisplayName("dropSession_removesWithoutNotifying")
        void dropSession_removesWithoutNotifying() {
            queue.enqueue(alice, "s-alice");
            clearInvocations(sender);

            assertTrue(queue.dropSession("s-alice"));
            assertFalse(queue.isQueued("alice"));
            verifyNoInteractions(sender);
        }
    }

    // =========================================================================
    // Pairing
    // =========================================================================

    @Nested
    @DisplayName("Pairing")
    class Pairing {

        @Test
        @DisplayName("twoWaiting_arePairedEarliestAsPlayer1")
        void twoWaiting_arePairedEarliestAsPlayer1() {
            when(matchRegistry.createMatch(any(), any())).thenReturn("room-1");

            queue.enqueue(alice, "s-alice");
            clock.advanceSeconds(3);
            queue.enqueue(bob, "s-bob");

            ArgumentCaptor<QueueEntry> first = ArgumentCaptor.forClass(QueueEntry.class);
            ArgumentCaptor<QueueEntry> second = ArgumentCaptor.forClass(QueueEntry.class);
            verify(matchRegistry).createMatch(first.capture(), second.capture());
            assertEquals("alice", first.getValue().playerId());
            assertEquals("bob", second.getValue().playerId());
            assertEquals(0, queue.size());
        }

        @Test
        @DisplayName("matchFound_tellsEachPlayerTheOther")
        void matchFound_tellsEachPlayerTheOther() {
            when(matchRegistry.createMatch(any(), any())).thenReturn("room-1");

            queue.enqueue(alice, "s-alice");
            queue.enqueue(bob, "s-bob");

            verify(sender).send("s-alice", GameMessages.matchFound("room-1", bob, SideId.PLAYER1));
            verify(sender).send("s-bob", GameMessages.matchFound("room-1", alice, SideId.PLAYER2));
        }

        @Test
        @DisplayName("thirdPlayer_waitsForAPartner")
        void thirdPlayer_waitsForAPartner() {
            when(matchRegistry.createMatch(any(), any())).thenReturn("room-1");

            queue.enqueue(alice, "s-alice");
            queue.enqueue(bob, "s-bob");
            queue.enqueue(carol, "s-carol");

            verify(matchRegistry, times(1)).createMatch(any(), any());
            assertTrue(queue.isQueued("carol"));
            verify(sender, never()).send(eq("s-carol"), isA(GameMessages.MatchFound.class));
        }

        @Test
        @DisplayName("singlePlayer_isNotPaired")
        void singlePlayer_isNotPaired() {
            queue.enqueue(alice, "s-alice");

            verify(matchRegistry, never()).createMatch(any(), any());
        }

        @Test
        @DisplayName("duplicateParticipant_keepsTheFreePlayerQueued")
        void duplicateParticipant_keepsTheFreePlayerQueued() {
            // alice is free when she joins but picks up a match before pairing runs
            when(matchRegistry.hasLiveMatch("alice")).thenReturn(false, true);
            when(matchRegistry.hasLiveMatch("bob")).thenReturn(false);
            when(matchRegistry.createMatch(any(), any()))
                    .thenThrow(new DuplicateParticipantException("alice"));

            queue.enqueue(alice, "s-alice");
            queue.enqueue(bob, "s-bob");

            assertFalse(queue.isQueued("alice"));
            assertTrue(queue.isQueued("bob"));
            verify(sender, never()).send(anyString(), isA(GameMessages.MatchFound.class));
        }
    }
}
