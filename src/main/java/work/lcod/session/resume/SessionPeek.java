package work.lcod.session.resume;

import work.lcod.session.state.SessionMetadata;

/**
 * Format version and metadata of a dormant session, read without rebuilding it.
 */
public record SessionPeek(int version, SessionMetadata metadata) {}
