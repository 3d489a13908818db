package work.lcod.session.result;

/**
 * Outcome of a job run. {@link #NONE} means the job has not produced a result yet and is
 * persisted as JSON {@code null}.
 */
public enum Outcome {
    NONE(null),
    PASS("pass"),
    FAIL("fail"),
    SKIP("skip"),
    NOT_SUPPORTED("not-supported"),
    NOT_IMPLEMENTED("not-implemented"),
    UNDECIDED("undecided"),
    CRASH("crash");

    private final String wireName;

    Outcome(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used in persisted sessions, {@code null} for {@link #NONE}.
     */
    public String wireName() {
        return wireName;
    }

    public static Outcome fromWire(String value) {
        if (value == null) {
            return NONE;
        }
        for (Outcome outcome : values()) {
            if (value.equals(outcome.wireName)) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Unknown outcome: " + value);
    }

    @Override
    public String toString() {
        return wireName == null ? "none" : wireName;
    }
}
