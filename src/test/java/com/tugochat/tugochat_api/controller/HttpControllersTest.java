package com.tugochat.tugochat_api.controller;

import com.tugochat.tugochat_api.controller.ChatPullController.ChatPullRequest;
import com.tugochat.tugochat_api.controller.PlayerLoginController.LoginResolved;
import com.tugochat.tugochat_api.engine.MatchSnapshot;
import com.tugochat.tugochat_api.exception.UnknownSessionException;
import com.tugochat.tugochat_api.messaging.InboundEvent;
import com.tugochat.tugochat_api.model.MatchState;
import com.tugochat.tugochat_api.model.Player;
import com.tugochat.tugochat_api.service.GameEventDispatcher;
import com.tugochat.tugochat_api.service.MatchRegistry;
import com.tugochat.tugochat_api.service.MatchmakingQueue;
import com.tugochat.tugochat_api.service.SessionRegistry;
import com.tugochat.util.MutableClock;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;
import java.util.Optional;

import static com.tugochat.util.TestFixtures.T0;
import static com.tugochat.util.TestFixtures.buildPlayer;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Calls the REST controllers directly: no HTTP, no Spring context.
 */
@ExtendWith(MockitoExtension.class)
class HttpControllersTest {

    @Mock private GameEventDispatcher dispatcher;
    @Mock private SessionRegistry sessionRegistry;
    @Mock private MatchRegistry matchRegistry;
    @Mock private MatchmakingQueue matchmakingQueue;

    // =========================================================================
    // Chat pulls
    // =========================================================================

    @Nested
    @DisplayName("POST /api/chat/pull")
    class ChatPull {

        private ChatPullController controller;

        @BeforeEach
        void setUp() {
            controller = new ChatPullController(dispatcher, new MutableClock(T0));
        }

        @Test
        @DisplayName("pull_isAcceptedAndStampedWithServerClock")
        void pull_isAcceptedAndStampedWithServerClock() {
            ResponseEntity<?> response = controller.pull(new ChatPullRequest("alice", "viewer-1", null));

            assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
            verify(dispatcher).dispatch(new InboundEvent.ChatPull("alice", "viewer-1", T0));
        }

        @Test
        @DisplayName("pull_keepsCallerTimestamp")
        void pull_keepsCallerTimestamp() {
            controller.pull(new ChatPullRequest("alice", "viewer-1", T0.minusSeconds(2)));

            verify(dispatcher).dispatch(new InboundEvent.ChatPull("alice", "viewer-1", T0.minusSeconds(2)));
        }

        @Test
        @DisplayName("pull_withoutViewer_isBadRequest")
        void pull_withoutViewer_isBadRequest() {
            ResponseEntity<?> response = controller.pull(new ChatPullRequest("alice", " ", null));

            assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
            verifyNoInteractions(dispatcher);
        }
    }

    // =========================================================================
    // Login resolution
    // =========================================================================

    @Nested
    @DisplayName("POST /api/auth/resolved")
    class LoginResolution {

        private PlayerLoginController controller;

        @BeforeEach
        void setUp() {
            controller = new PlayerLoginController(sessionRegistry);
        }

        @Test
        @DisplayName("resolved_attachesPlayerToSession")
        void resolved_attachesPlayerToSession() {
            Player alice = buildPlayer("alice");

            ResponseEntity<?> response = controller.resolved(new LoginResolved("s1", alice));

            assertEquals(HttpStatus.OK, response.getStatusCode());
            verify(sessionRegistry).attachPlayer("s1", alice);
        }

        @Test
        @DisplayName("resolved_forUnknownSession_is404")
        void resolved_forUnknownSession_is404() {
            Player alice = buildPlayer("alice");
            doThrow(new UnknownSessionException("s9")).when(sessionRegistry).attachPlayer("s9", alice);

            ResponseEntity<?> response = controller.resolved(new LoginResolved("s9", alice));

            assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
            assertInstanceOf(ErrorResponse.class, response.getBody());
        }

        @Test
        @DisplayName("resolved_withNegativeAudience_is400")
        void resolved_withNegativeAudience_is400() {
            ResponseEntity<?> response = controller.resolved(
                    new LoginResolved("s1", new Player("alice", "alice", null, -1)));

            assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
            verify(sessionRegistry, never()).attachPlayer(any(), any());
        }
    }

    // =========================================================================
    // Queries
    // =========================================================================

    @Nested
    @DisplayName("GET /api/matches and /api/queue")
    class Queries {

        private MatchQueryController controller;

        @BeforeEach
        void setUp() {
            controller = new MatchQueryController(matchRegistry, matchmakingQueue);
        }

        @Test
        @DisplayName("liveMatch_returnsSnapshot")
        void liveMatch_returnsSnapshot() {
            MatchSnapshot snapshot = new MatchSnapshot("room-1", MatchState.IN_PROGRESS, null,
                    12.5, 3, 1, 0.03, 0.001, 90, null);
            when(matchRegistry.snapshot("room-1")).thenReturn(Optional.of(snapshot));

            ResponseEntity<?> response = controller.match("room-1");

            assertEquals(HttpStatus.OK, response.getStatusCode());
            assertEquals(snapshot, response.getBody());
        }

        @Test
        @DisplayName("unknownMatch_is404")
        void unknownMatch_is404() {
            when(matchRegistry.snapshot("gone")).thenReturn(Optional.empty());

            assertEquals(HttpStatus.NOT_FOUND, controller.match("gone").getStatusCode());
        }

        @Test
        @DisplayName("queue_reportsDepth")
        void queue_reportsDepth() {
            when(matchmakingQueue.size()).thenReturn(3);

            assertEquals(Map.of("size", 3), controller.queue());
        }
    }
}
