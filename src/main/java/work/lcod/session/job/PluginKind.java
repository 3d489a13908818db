package work.lcod.session.job;

import java.util.Locale;

/**
 * Closed set of job plugin kinds. The wire name is what job definitions use in their {@code plugin} field.
 */
public enum PluginKind {
    SHELL("shell", true),
    RESOURCE("resource", true),
    LOCAL("local", true),
    ATTACHMENT("attachment", true),
    MANUAL("manual", false),
    USER_INTERACT("user-interact", false),
    USER_VERIFY("user-verify", false),
    USER_INTERACT_VERIFY("user-interact-verify", false);

    private final String wireName;
    private final boolean automated;

    PluginKind(String wireName, boolean automated) {
        this.wireName = wireName;
        this.automated = automated;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Whether jobs of this kind run without operator interaction.
     */
    public boolean isAutomated() {
        return automated;
    }

    public static PluginKind from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Job plugin is required");
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (var kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported job plugin: " + value);
    }
}
