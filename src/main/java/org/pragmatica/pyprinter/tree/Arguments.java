package org.pragmatica.pyprinter.tree;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Parameter list of a function or lambda.
 *
 * @param posOnlyArgs positional-only parameters, printed before {@code /}
 * @param args        regular parameters
 * @param defaults    default values for the trailing {@code defaults.size()} regular parameters
 * @param varArg      {@code *args} parameter
 * @param kwArg       {@code **kwargs} parameter
 */
public record Arguments(
    List<Arg> posOnlyArgs,
    List<Arg> args,
    List<Expression> defaults,
    Optional<Arg> varArg,
    Optional<Arg> kwArg
) {
    public static final Arguments EMPTY = new Arguments(List.of(), List.of(), List.of(), Optional.empty(), Optional.empty());

    public Arguments {
        posOnlyArgs = List.copyOf(posOnlyArgs);
        args = List.copyOf(args);
        defaults = List.copyOf(defaults);
        if (defaults.size() > args.size()) {
            throw new IllegalArgumentException("More defaults (" + defaults.size() + ") than parameters (" + args.size() + ")");
        }
    }

    public static Arguments of(String... names) {
        var args = Arrays.stream(names)
                         .map(Arg::of)
                         .toList();
        return new Arguments(List.of(), args, List.of(), Optional.empty(), Optional.empty());
    }

    public Arguments withDefaults(List<Expression> newDefaults) {
        return new Arguments(posOnlyArgs, args, newDefaults, varArg, kwArg);
    }

    public boolean isEmpty() {
        return posOnlyArgs.isEmpty() && args.isEmpty() && varArg.isEmpty() && kwArg.isEmpty();
    }
}
