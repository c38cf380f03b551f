package org.g10asm.compiler.frontend.preprocessor.eval;

import org.g10asm.compiler.frontend.lexer.Token;
import org.g10asm.compiler.frontend.preprocessor.value.FixedPoint;
import org.g10asm.compiler.frontend.preprocessor.value.PpValue;

import java.util.List;
import java.util.Locale;

/**
 * Implementations of the preprocessor's built-in functions. Argument counts have already
 * been checked by the {@link ExpressionEvaluator}; this class checks argument types and domains.
 * <p>
 * Trigonometric functions measure angles in turns, so {@code sin(0.25)} is 1.
 */
final class BuiltinFunctions {

    private static final double TURN = 2.0 * Math.PI;

    private BuiltinFunctions() {}

    static PpValue call(String name, List<PpValue> args, Token at) throws EvaluationException {
        switch (name) {
            case "high":
                return PpValue.ofInteger((integer(name, args, 0, at) >> 8) & 0xFF);
            case "low":
                return PpValue.ofInteger(integer(name, args, 0, at) & 0xFF);
            case "bitwidth":
                return PpValue.ofInteger(bitWidth(integer(name, args, 0, at)));
            case "abs":
                return abs(name, args, at);
            case "min":
            case "max":
                return minMax(name, args, at);
            case "clamp":
                return clamp(name, args, at);
            case "fmul":
                return PpValue.ofNumber(fixed(name, args, 0, at).multiply(fixed(name, args, 1, at)));
            case "fdiv": {
                FixedPoint divisor = fixed(name, args, 1, at);
                if (divisor.isZero()) throw new EvaluationException("Division by zero in 'fdiv'.", at);
                return PpValue.ofNumber(fixed(name, args, 0, at).divide(divisor));
            }
            case "fmod": {
                FixedPoint divisor = fixed(name, args, 1, at);
                if (divisor.isZero()) throw new EvaluationException("Modulo by zero in 'fmod'.", at);
                return PpValue.ofNumber(fixed(name, args, 0, at).remainder(divisor));
            }
            case "fint":
                numeric(name, args, 0, at);
                return args.get(0).isInteger() ? args.get(0) : PpValue.ofInteger(args.get(0).asNumber().truncate());
            case "ffrac":
                numeric(name, args, 0, at);
                return PpValue.ofNumber(args.get(0).asNumber().fraction());
            case "round": {
                if (args.get(0).isInteger()) return args.get(0);
                double v = numeric(name, args, 0, at);
                return PpValue.ofInteger((long) (v >= 0 ? Math.floor(v + 0.5) : -Math.floor(-v + 0.5)));
            }
            case "ceil":
                if (args.get(0).isInteger()) return args.get(0);
                return PpValue.ofInteger((long) Math.ceil(numeric(name, args, 0, at)));
            case "floor":
                if (args.get(0).isInteger()) return args.get(0);
                return PpValue.ofInteger((long) Math.floor(numeric(name, args, 0, at)));
            case "trunc":
                if (args.get(0).isInteger()) return args.get(0);
                numeric(name, args, 0, at);
                return PpValue.ofInteger(args.get(0).asNumber().truncate());
            case "pow":
                return power(args.get(0), args.get(1), name, at);
            case "sqrt": {
                double v = numeric(name, args, 0, at);
                if (v < 0) throw new EvaluationException("Cannot take 'sqrt' of a negative value.", at);
                return number(Math.sqrt(v), name, at);
            }
            case "exp":
                return number(Math.exp(numeric(name, args, 0, at)), name, at);
            case "ln":
                return number(Math.log(positive(name, args, 0, at)), name, at);
            case "log2":
                return number(Math.log(positive(name, args, 0, at)) / Math.log(2.0), name, at);
            case "log10":
                return number(Math.log10(positive(name, args, 0, at)), name, at);
            case "log": {
                double base = positive(name, args, 1, at);
                if (base == 1.0) throw new EvaluationException("Logarithm base must not be 1.", at);
                return number(Math.log(positive(name, args, 0, at)) / Math.log(base), name, at);
            }
            case "sin":
                return number(Math.sin(numeric(name, args, 0, at) * TURN), name, at);
            case "cos":
                return number(Math.cos(numeric(name, args, 0, at) * TURN), name, at);
            case "tan":
                return number(Math.tan(numeric(name, args, 0, at) * TURN), name, at);
            case "asin":
                return number(Math.asin(unit(name, args, 0, at)) / TURN, name, at);
            case "acos":
                return number(Math.acos(unit(name, args, 0, at)) / TURN, name, at);
            case "atan":
                return number(Math.atan(numeric(name, args, 0, at)) / TURN, name, at);
            case "atan2":
                return number(Math.atan2(numeric(name, args, 0, at), numeric(name, args, 1, at)) / TURN, name, at);
            case "strlen":
                return PpValue.ofInteger(string(name, args, 0, at).length());
            case "strcmp":
                return PpValue.ofInteger(Integer.signum(string(name, args, 0, at).compareTo(string(name, args, 1, at))));
            case "substr":
                return substring(name, args, at);
            case "indexof":
                return PpValue.ofInteger(string(name, args, 0, at).indexOf(string(name, args, 1, at)));
            case "toupper":
                return PpValue.ofString(string(name, args, 0, at).toUpperCase(Locale.ROOT));
            case "tolower":
                return PpValue.ofString(string(name, args, 0, at).toLowerCase(Locale.ROOT));
            case "concat": {
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < args.size(); i++) {
                    sb.append(string(name, args, i, at));
                }
                return PpValue.ofString(sb.toString());
            }
            case "typeof":
                return PpValue.ofString(args.get(0).typeName());
            default:
                throw new EvaluationException(String.format("Unknown function '%s'.", name), at);
        }
    }

    /**
     * Raises {@code base} to {@code exponent}. Integer operands with a non-negative exponent
     * give an exact (wrapping) integer, everything else a fixed-point number.
     */
    static PpValue power(PpValue base, PpValue exponent, String operator, Token at) throws EvaluationException {
        if (!base.isNumeric() || !exponent.isNumeric()) {
            throw new EvaluationException(String.format("'%s' requires numeric operands, but got %s and %s.",
                    operator, base.typeName(), exponent.typeName()), at);
        }
        if (base.isInteger() && exponent.isInteger() && exponent.asInteger() >= 0) {
            long result = 1L;
            long factor = base.asInteger();
            long e = exponent.asInteger();
            while (e > 0) {
                if ((e & 1L) != 0) result *= factor;
                factor *= factor;
                e >>= 1;
            }
            return PpValue.ofInteger(result);
        }
        return number(Math.pow(base.asDouble(), exponent.asDouble()), operator, at);
    }

    /**
     * Wraps a double result, rejecting values outside the Q32.32 range.
     */
    static PpValue number(double value, String operation, Token at) throws EvaluationException {
        if (!FixedPoint.isRepresentable(value)) {
            throw new EvaluationException(String.format("Result of '%s' is out of the fixed-point range.", operation), at);
        }
        return PpValue.ofNumber(FixedPoint.fromDouble(value));
    }

    private static long bitWidth(long value) {
        if (value == 0L) return 0L;
        if (value > 0L) return 64 - Long.numberOfLeadingZeros(value);
        return 65 - Long.numberOfLeadingZeros(~value);
    }

    private static PpValue abs(String name, List<PpValue> args, Token at) throws EvaluationException {
        numeric(name, args, 0, at);
        PpValue v = args.get(0);
        if (v.isInteger()) return PpValue.ofInteger(Math.abs(v.asInteger()));
        return PpValue.ofNumber(v.asNumber().isNegative() ? v.asNumber().negate() : v.asNumber());
    }

    private static PpValue minMax(String name, List<PpValue> args, Token at) throws EvaluationException {
        numeric(name, args, 0, at);
        numeric(name, args, 1, at);
        PpValue a = args.get(0);
        PpValue b = args.get(1);
        boolean wantMin = name.equals("min");
        if (a.isInteger() && b.isInteger()) {
            return PpValue.ofInteger(wantMin ? Math.min(a.asInteger(), b.asInteger()) : Math.max(a.asInteger(), b.asInteger()));
        }
        int cmp = a.asNumber().compareTo(b.asNumber());
        FixedPoint chosen = (wantMin ? cmp <= 0 : cmp >= 0) ? a.asNumber() : b.asNumber();
        return PpValue.ofNumber(chosen);
    }

    private static PpValue clamp(String name, List<PpValue> args, Token at) throws EvaluationException {
        for (int i = 0; i < 3; i++) numeric(name, args, i, at);
        PpValue v = args.get(0);
        PpValue lo = args.get(1);
        PpValue hi = args.get(2);
        if (v.isInteger() && lo.isInteger() && hi.isInteger()) {
            return PpValue.ofInteger(Math.max(lo.asInteger(), Math.min(hi.asInteger(), v.asInteger())));
        }
        FixedPoint value = v.asNumber();
        if (value.compareTo(lo.asNumber()) < 0) value = lo.asNumber();
        if (value.compareTo(hi.asNumber()) > 0) value = hi.asNumber();
        return PpValue.ofNumber(value);
    }

    private static PpValue substring(String name, List<PpValue> args, Token at) throws EvaluationException {
        String s = string(name, args, 0, at);
        long start = integer(name, args, 1, at);
        if (start < 0 || start > s.length()) {
            throw new EvaluationException(String.format("'substr' start index %d is out of range for a string of length %d.",
                    start, s.length()), at);
        }
        long end = s.length();
        if (args.size() > 2) {
            long length = integer(name, args, 2, at);
            if (length < 0) throw new EvaluationException("'substr' length must not be negative.", at);
            end = Math.min(end, start + length);
        }
        return PpValue.ofString(s.substring((int) start, (int) end));
    }

    private static long integer(String name, List<PpValue> args, int index, Token at) throws EvaluationException {
        PpValue v = args.get(index);
        if (!v.isInteger()) throw typeError(name, index, "an integer", v, at);
        return v.asInteger();
    }

    private static double numeric(String name, List<PpValue> args, int index, Token at) throws EvaluationException {
        PpValue v = args.get(index);
        if (!v.isNumeric()) throw typeError(name, index, "a number", v, at);
        return v.asDouble();
    }

    private static double positive(String name, List<PpValue> args, int index, Token at) throws EvaluationException {
        double v = numeric(name, args, index, at);
        if (v <= 0) throw new EvaluationException(String.format("'%s' requires a positive argument.", name), at);
        return v;
    }

    private static double unit(String name, List<PpValue> args, int index, Token at) throws EvaluationException {
        double v = numeric(name, args, index, at);
        if (v < -1.0 || v > 1.0) throw new EvaluationException(String.format("'%s' requires an argument between -1 and 1.", name), at);
        return v;
    }

    private static FixedPoint fixed(String name, List<PpValue> args, int index, Token at) throws EvaluationException {
        numeric(name, args, index, at);
        return args.get(index).asNumber();
    }

    private static String string(String name, List<PpValue> args, int index, Token at) throws EvaluationException {
        PpValue v = args.get(index);
        if (!v.isString()) throw typeError(name, index, "a string", v, at);
        return v.asString();
    }

    private static EvaluationException typeError(String name, int index, String expected, PpValue actual, Token at) {
        return new EvaluationException(String.format("Argument %d of '%s' must be %s, but got %s.",
                index + 1, name, expected, actual.typeName()), at);
    }
}
