package work.lcod.session.resource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Requirement program of a job: one {@link ResourceExpression} per non-blank line.
 */
public final class ResourceProgram {
    private final List<ResourceExpression> expressions;

    public ResourceProgram(String programText) {
        var list = new ArrayList<ResourceExpression>();
        if (programText != null) {
            for (String line : programText.split("\\r?\\n")) {
                if (!line.isBlank()) {
                    list.add(new ResourceExpression(line));
                }
            }
        }
        this.expressions = Collections.unmodifiableList(list);
    }

    public List<ResourceExpression> expressions() {
        return expressions;
    }

    /**
     * Ids of the resource jobs this program needs.
     */
    public Set<String> requiredResources() {
        var ids = new LinkedHashSet<String>();
        for (var expression : expressions) {
            ids.add(expression.resourceId());
        }
        return Collections.unmodifiableSet(ids);
    }

    /**
     * Evaluates every expression against the resource map and reports the ones that do not hold.
     * An expression whose resource has no entry in the map is {@link Verdict#PENDING}; one whose
     * resource records do not satisfy it is {@link Verdict#FAILED}.
     */
    public List<Failure> evaluate(Map<String, List<ResourceRecord>> resourceMap) {
        var failures = new ArrayList<Failure>();
        for (var expression : expressions) {
            var records = resourceMap.get(expression.resourceId());
            if (records == null) {
                failures.add(new Failure(expression, Verdict.PENDING));
            } else if (!expression.evaluate(records)) {
                failures.add(new Failure(expression, Verdict.FAILED));
            }
        }
        return failures;
    }

    public enum Verdict {
        PENDING,
        FAILED
    }

    public record Failure(ResourceExpression expression, Verdict verdict) {}
}
