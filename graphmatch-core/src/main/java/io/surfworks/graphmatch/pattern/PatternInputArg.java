package io.surfworks.graphmatch.pattern;

import java.util.Arrays;
import java.util.Set;

/**
 * A symbolic input argument of a pattern.
 *
 * <p>Only arguments declared this way are compared against target arguments;
 * any other name appearing in a pattern node's inputs is a don't-care slot.
 *
 * @param name argument name shared with the pattern nodes reading it
 * @param allowedTypes accepted element types, empty for any
 * @param allowedRanks accepted tensor ranks, empty for any
 */
public record PatternInputArg(String name, Set<String> allowedTypes, Set<Integer> allowedRanks) {

    public PatternInputArg {
        if (name == null || name.isEmpty()) {
            throw new PatternGraphException("Pattern input name must not be empty");
        }
        allowedTypes = Set.copyOf(allowedTypes);
        allowedRanks = Set.copyOf(allowedRanks);
    }

    public static PatternInputArg of(String name) {
        return new PatternInputArg(name, Set.of(), Set.of());
    }

    public PatternInputArg withTypes(String... types) {
        return new PatternInputArg(name, Set.copyOf(Arrays.asList(types)), allowedRanks);
    }

    public PatternInputArg withRanks(Integer... ranks) {
        return new PatternInputArg(name, allowedTypes, Set.copyOf(Arrays.asList(ranks)));
    }
}
