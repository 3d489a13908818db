package work.lcod.session.resource;

import java.util.List;
import java.util.Map;

/**
 * Turns the textual output of a job into key/value records.
 *
 * <p>Implementations never fail on malformed input: bad records are skipped and reported through
 * {@link Result#problems()} so the caller can log them.
 */
public interface RecordParser {
    Result parse(String text);

    record Result(List<Map<String, String>> records, List<String> problems) {
        public Result {
            records = List.copyOf(records);
            problems = List.copyOf(problems);
        }

        public boolean hasProblems() {
            return !problems.isEmpty();
        }
    }
}
