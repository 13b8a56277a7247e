package com.spreadsheet.formula.services;

import com.spreadsheet.formula.exceptions.FunctionException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The fixed set of functions a formula may call. Names match case-insensitively.
 * Arguments are evaluated lazily through {@link Arguments}, so {@code if}
 * only evaluates the branch it selects.
 */
public enum BuiltinFunction {

    SUM("sum", 1, Integer.MAX_VALUE) {
        @Override
        double apply(Arguments args, Random random) {
            double sum = 0.0;
            for (int i = 0; i < args.size(); i++) {
                sum += args.get(i);
            }
            return sum;
        }
    },
    AVERAGE("average", 1, Integer.MAX_VALUE) {
        @Override
        double apply(Arguments args, Random random) {
            return SUM.apply(args, random) / args.size();
        }
    },
    MAX("max", 1, Integer.MAX_VALUE) {
        @Override
        double apply(Arguments args, Random random) {
            double max = args.get(0);
            for (int i = 1; i < args.size(); i++) {
                double value = args.get(i);
                if (value > max) {
                    max = value;
                }
            }
            return max;
        }
    },
    MIN("min", 1, Integer.MAX_VALUE) {
        @Override
        double apply(Arguments args, Random random) {
            double min = args.get(0);
            for (int i = 1; i < args.size(); i++) {
                double value = args.get(i);
                if (value < min) {
                    min = value;
                }
            }
            return min;
        }
    },
    IF("if", 3, 3) {
        @Override
        double apply(Arguments args, Random random) {
            return args.get(0) != 0.0 ? args.get(1) : args.get(2);
        }
    },
    RANDOM("random", 0, 0) {
        @Override
        double apply(Arguments args, Random random) {
            return random.nextDouble();
        }
    },
    RANDBETWEEN("randbetween", 2, 2) {
        @Override
        double apply(Arguments args, Random random) {
            double lo = args.get(0);
            double hi = args.get(1);
            if (lo > hi) {
                throw new FunctionException(getName(), "Function `randbetween` expects its first argument ("
                        + lo + ") to be at most its second (" + hi + ")");
            }
            // Draw from [0, 2^53] so that both bounds are reachable
            long step = random.nextLong(UNIT_STEPS + 1);
            return step == UNIT_STEPS ? hi : lo + (step / (double) UNIT_STEPS) * (hi - lo);
        }
    };

    private static final long UNIT_STEPS = 1L << 53;

    private static final Map<String, BuiltinFunction> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(BuiltinFunction::getName, Function.identity()));

    private final String name;
    private final int minArguments;
    private final int maxArguments;

    BuiltinFunction(String name, int minArguments, int maxArguments) {
        this.name = name;
        this.minArguments = minArguments;
        this.maxArguments = maxArguments;
    }

    /**
     * Lazily evaluated call arguments. Each {@link #get(int)} evaluates its argument afresh.
     */
    public interface Arguments {

        int size();

        double get(int index);
    }

    public static BuiltinFunction lookup(String name) {
        BuiltinFunction function = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (function == null) {
            throw new FunctionException(name, "Unknown function `" + name + "`");
        }
        return function;
    }

    /**
     * Checks the argument count, then applies the function.
     */
    public double call(Arguments args, Random random) {
        int count = args.size();
        if (count < minArguments || count > maxArguments) {
            throw new FunctionException(name, "Function `" + name + "` " + describeArity()
                    + ", got " + count);
        }
        return apply(args, random);
    }

    abstract double apply(Arguments args, Random random);

    public String getName() {
        return name;
    }

    private String describeArity() {
        if (minArguments == maxArguments) {
            return minArguments == 0
                    ? "takes no arguments"
                    : "takes exactly " + minArguments + " argument" + (minArguments == 1 ? "" : "s");
        }
        return "expects at least " + minArguments + " argument" + (minArguments == 1 ? "" : "s");
    }
}
