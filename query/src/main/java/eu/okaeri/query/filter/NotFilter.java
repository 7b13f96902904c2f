package eu.okaeri.query.filter;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Negation of a single child filter.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class NotFilter implements Filter {

    private final @NonNull Filter child;
}
