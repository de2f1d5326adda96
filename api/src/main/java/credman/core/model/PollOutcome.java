package credman.core.model;

/**
 * Result of a single poll of the provider's token endpoint with a device code.
 */
public sealed interface PollOutcome {

    /**
     * The user has not finished signing in yet.
     */
    record Pending() implements PollOutcome {}

    /**
     * The provider asked the client to poll less often.
     */
    record SlowDown() implements PollOutcome {}

    /**
     * The user signed in and the provider issued tokens.
     *
     * @param tokens raw, unvalidated tokens
     */
    record TokenIssued(IssuedTokens tokens) implements PollOutcome {}

    /**
     * The device code expired before the user completed sign-in.
     */
    record Expired() implements PollOutcome {}

    /**
     * The user declined the authorization request.
     */
    record Denied() implements PollOutcome {}
}
