package eu.okaeri.query.filter.predicate.string;

import eu.okaeri.query.QueryValidationException;
import eu.okaeri.query.filter.predicate.SimplePredicate;
import lombok.Getter;
import lombok.NonNull;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Regular expression predicate, matching anywhere in the value.
 * Absent and non-string values do not match.
 * {@code field matches /pattern/}
 */
public class MatchesPredicate extends SimplePredicate {

    @Getter
    private final Pattern pattern;

    public MatchesPredicate(@NonNull String regex, boolean caseSensitive) {
        super(regex);
        this.pattern = compile(regex, caseSensitive);
    }

    public static Pattern compile(@NonNull String regex, boolean caseSensitive) {
        try {
            return caseSensitive
                ? Pattern.compile(regex)
                : Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        } catch (PatternSyntaxException exception) {
            throw new QueryValidationException("invalid regular expression '" + regex + "': " + exception.getDescription(), exception);
        }
    }

    @Override
    public boolean check(Object leftOperand) {
        return (leftOperand instanceof CharSequence) && this.pattern.matcher((CharSequence) leftOperand).find();
    }
}
