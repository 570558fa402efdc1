package com.tugochat.tugochat_api.engine;

/**
 * Lifecycle callbacks from a match to whoever owns it. Invoked on the match's
 * own mailbox.
 */
public interface MatchListener {

    void matchStarted(MatchEngine match);

    /** Called once, after the final broadcast. The match may be discarded afterwards. */
    void matchEnded(MatchEngine match);
}
