package org.hpn.expression;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.math3.special.Gamma;

/**
 * Function Catalog
 *
 * The fixed set of functions callable from rate and guard expressions.
 * Nothing outside this catalog can be called.
 *
 * Families:
 * =========
 * - Math: min, max, abs, sqrt, exp, log, log10, pow, sin, cos, tan, floor, ceil, round
 * - Activation: sigmoid, tanh, relu, leaky_relu, softplus
 * - Growth: exponential_growth, exponential_decay, logistic_growth, gompertz_growth
 * - Kinetics: michaelis_menten, hill_equation, competitive_inhibition, mass_action
 * - Densities: normal_pdf, exponential_pdf, gamma_pdf, uniform
 * - Signals: step, ramp, pulse, periodic_pulse, triangle_wave, sawtooth_wave,
 *   double_sigmoid, bell_curve, bounded_linear, smooth_threshold
 *
 * Trailing parameters with a default may be omitted, e.g.
 * {@code sigmoid(time, 10, 0.5)} leaves the amplitude at 1. Parameters can
 * also be passed by name after the positional ones, e.g.
 * {@code michaelis_menten(P1, vmax=10, km=5)} or
 * {@code sigmoid(time, center=20, amplitude=2)}; skipped parameters take
 * their default.
 *
 * The rate laws are also public static methods so Java rate functions can
 * call them directly.
 */
public final class FunctionCatalog {

    /**
     * Body of a catalog function; receives the arguments as written.
     */
    public interface Body {
        double apply(double[] args);
    }

    /**
     * A named catalog entry with its accepted argument count.
     */
    public static final class CatalogFunction {
        private final String name;
        private final int minArgs;
        private final int maxArgs; // -1 = unbounded
        private final String signature;
        private final Body body;
        private final List<String> parameterNames = new ArrayList<>();
        private final List<Double> defaults = new ArrayList<>(); // null = required

        CatalogFunction(String name, int minArgs, int maxArgs, String signature, Body body) {
            this.name = name;
            this.minArgs = minArgs;
            this.maxArgs = maxArgs;
            this.signature = signature;
            this.body = body;
            parseParameters(signature);
        }

        // "f(x, center=0, amplitude=1)" -> names [x, center, amplitude], defaults [null, 0, 1]
        private void parseParameters(String text) {
            String inner = text.substring(text.indexOf('(') + 1, text.lastIndexOf(')'));
            for (String part : inner.split(",")) {
                String parameter = part.trim();
                if (parameter.isEmpty() || parameter.equals("...")) {
                    continue;
                }
                int eq = parameter.indexOf('=');
                if (eq < 0) {
                    parameterNames.add(parameter);
                    defaults.add(null);
                } else {
                    parameterNames.add(parameter.substring(0, eq).trim());
                    defaults.add(defaultValue(parameter.substring(eq + 1).trim()));
                }
            }
        }

        private static double defaultValue(String text) {
            switch (text) {
                case "e":
                    return Math.E;
                case "inf":
                    return Double.POSITIVE_INFINITY;
                default:
                    return Double.parseDouble(text);
            }
        }

        public String getName() { return name; }
        public int getMinArgs() { return minArgs; }
        public int getMaxArgs() { return maxArgs; }
        public String getSignature() { return signature; }

        public List<String> getParameterNames() {
            return Collections.unmodifiableList(parameterNames);
        }

        public boolean isVariadic() {
            return maxArgs < 0;
        }

        /**
         * Merge positional and named arguments into one positional list.
         * Parameters skipped before the last named one are filled with their
         * default value.
         *
         * @throws IllegalArgumentException for an unknown or repeated name, a
         *         missing required parameter, or names on a variadic function
         */
        public List<Expression> bindArguments(List<Expression> positional, Map<String, Expression> named) {
            if (named.isEmpty()) {
                return positional;
            }
            if (isVariadic()) {
                throw new IllegalArgumentException(name + " does not accept named arguments");
            }
            if (positional.size() > parameterNames.size()) {
                throw new IllegalArgumentException(String.format(
                    "%s takes %s, got %d positional argument(s)", name, signature, positional.size()));
            }

            Expression[] bound = new Expression[parameterNames.size()];
            for (int i = 0; i < positional.size(); i++) {
                bound[i] = positional.get(i);
            }
            int last = positional.size() - 1;
            for (Map.Entry<String, Expression> entry : named.entrySet()) {
                int slot = parameterNames.indexOf(entry.getKey());
                if (slot < 0) {
                    throw new IllegalArgumentException(String.format(
                        "%s has no parameter '%s' (%s)", name, entry.getKey(), signature));
                }
                if (bound[slot] != null) {
                    throw new IllegalArgumentException(String.format(
                        "%s got multiple values for '%s'", name, entry.getKey()));
                }
                bound[slot] = entry.getValue();
                last = Math.max(last, slot);
            }

            List<Expression> arguments = new ArrayList<>();
            for (int i = 0; i <= last; i++) {
                if (bound[i] == null) {
                    Double fallback = defaults.get(i);
                    if (fallback == null) {
                        throw new IllegalArgumentException(String.format(
                            "%s is missing required argument '%s'", name, parameterNames.get(i)));
                    }
                    bound[i] = new ConstantExpression(fallback);
                }
                arguments.add(bound[i]);
            }
            return arguments;
        }

        public boolean acceptsArgumentCount(int count) {
            return count >= minArgs && (maxArgs < 0 || count <= maxArgs);
        }

        public double invoke(double[] args) {
            if (!acceptsArgumentCount(args.length)) {
                throw new EvaluationException(String.format(
                    "%s called with %d arguments, expected %s", name, args.length, signature));
            }
            return body.apply(args);
        }

        @Override
        public String toString() {
            return signature;
        }
    }

    private static final Map<String, CatalogFunction> CATALOG = new TreeMap<>();

    static {
        // ========== Math ==========
        register("min", 1, -1, "min(x, ...)", a -> {
            double m = a[0];
            for (double v : a) m = Math.min(m, v);
            return m;
        });
        register("max", 1, -1, "max(x, ...)", a -> {
            double m = a[0];
            for (double v : a) m = Math.max(m, v);
            return m;
        });
        register("abs", 1, 1, "abs(x)", a -> Math.abs(a[0]));
        register("sqrt", 1, 1, "sqrt(x)", a -> Math.sqrt(a[0]));
        register("exp", 1, 1, "exp(x)", a -> Math.exp(a[0]));
        register("log", 1, 2, "log(x, base=e)",
            a -> a.length == 1 ? Math.log(a[0]) : Math.log(a[0]) / Math.log(a[1]));
        register("log10", 1, 1, "log10(x)", a -> Math.log10(a[0]));
        register("pow", 2, 2, "pow(x, y)", a -> Math.pow(a[0], a[1]));
        register("sin", 1, 1, "sin(x)", a -> Math.sin(a[0]));
        register("cos", 1, 1, "cos(x)", a -> Math.cos(a[0]));
        register("tan", 1, 1, "tan(x)", a -> Math.tan(a[0]));
        register("floor", 1, 1, "floor(x)", a -> Math.floor(a[0]));
        register("ceil", 1, 1, "ceil(x)", a -> Math.ceil(a[0]));
        register("round", 1, 2, "round(x, digits=0)",
            a -> round(a[0], a.length > 1 ? (int) a[1] : 0));

        // ========== Activation ==========
        register("sigmoid", 1, 4, "sigmoid(x, center=0, steepness=1, amplitude=1)",
            a -> sigmoid(a[0], arg(a, 1, 0.0), arg(a, 2, 1.0), arg(a, 3, 1.0)));
        register("tanh", 1, 4, "tanh(x, center=0, steepness=1, amplitude=1)",
            a -> tanhActivation(a[0], arg(a, 1, 0.0), arg(a, 2, 1.0), arg(a, 3, 1.0)));
        register("relu", 1, 2, "relu(x, threshold=0)",
            a -> relu(a[0], arg(a, 1, 0.0)));
        register("leaky_relu", 1, 3, "leaky_relu(x, threshold=0, alpha=0.01)",
            a -> leakyRelu(a[0], arg(a, 1, 0.0), arg(a, 2, 0.01)));
        register("softplus", 1, 2, "softplus(x, beta=1)",
            a -> softplus(a[0], arg(a, 1, 1.0)));

        // ========== Growth ==========
        register("exponential_growth", 2, 2, "exponential_growth(x, rate)",
            a -> exponentialGrowth(a[0], a[1]));
        register("exponential_decay", 2, 2, "exponential_decay(x, half_life)",
            a -> exponentialDecay(a[0], a[1]));
        register("logistic_growth", 3, 3, "logistic_growth(x, carrying_capacity, growth_rate)",
            a -> logisticGrowth(a[0], a[1], a[2]));
        register("gompertz_growth", 3, 3, "gompertz_growth(x, carrying_capacity, growth_rate)",
            a -> gompertzGrowth(a[0], a[1], a[2]));

        // ========== Kinetics ==========
        register("michaelis_menten", 3, 3, "michaelis_menten(substrate, vmax, km)",
            a -> michaelisMenten(a[0], a[1], a[2]));
        register("hill_equation", 3, 4, "hill_equation(substrate, vmax, kd, n=1)",
            a -> hillEquation(a[0], a[1], a[2], arg(a, 3, 1.0)));
        register("competitive_inhibition", 5, 5, "competitive_inhibition(substrate, inhibitor, vmax, km, ki)",
            a -> competitiveInhibition(a[0], a[1], a[2], a[3], a[4]));
        register("mass_action", 1, 3, "mass_action(reactant1, reactant2=1, rate_constant=1)",
            a -> massAction(a[0], arg(a, 1, 1.0), arg(a, 2, 1.0)));

        // ========== Densities ==========
        register("normal_pdf", 1, 3, "normal_pdf(x, mean=0, std=1)",
            a -> normalPdf(a[0], arg(a, 1, 0.0), arg(a, 2, 1.0)));
        register("exponential_pdf", 1, 2, "exponential_pdf(x, rate=1)",
            a -> exponentialPdf(a[0], arg(a, 1, 1.0)));
        register("gamma_pdf", 2, 3, "gamma_pdf(x, shape, scale=1)",
            a -> gammaPdf(a[0], a[1], arg(a, 2, 1.0)));
        register("uniform", 1, 3, "uniform(x, low=0, high=1)",
            a -> uniform(a[0], arg(a, 1, 0.0), arg(a, 2, 1.0)));

        // ========== Signals ==========
        register("step", 2, 4, "step(x, threshold, low=0, high=1)",
            a -> step(a[0], a[1], arg(a, 2, 0.0), arg(a, 3, 1.0)));
        register("ramp", 3, 5, "ramp(x, start, end, low=0, high=1)",
            a -> ramp(a[0], a[1], a[2], arg(a, 3, 0.0), arg(a, 4, 1.0)));
        register("pulse", 3, 4, "pulse(x, start, end, amplitude=1)",
            a -> pulse(a[0], a[1], a[2], arg(a, 3, 1.0)));
        register("periodic_pulse", 2, 4, "periodic_pulse(x, period, duty_cycle=0.5, amplitude=1)",
            a -> periodicPulse(a[0], a[1], arg(a, 2, 0.5), arg(a, 3, 1.0)));
        register("triangle_wave", 2, 3, "triangle_wave(x, period, amplitude=1)",
            a -> triangleWave(a[0], a[1], arg(a, 2, 1.0)));
        register("sawtooth_wave", 2, 3, "sawtooth_wave(x, period, amplitude=1)",
            a -> sawtoothWave(a[0], a[1], arg(a, 2, 1.0)));
        register("double_sigmoid", 3, 6,
            "double_sigmoid(x, center1, center2, steepness1=1, steepness2=1, amplitude=1)",
            a -> doubleSigmoid(a[0], a[1], a[2], arg(a, 3, 1.0), arg(a, 4, 1.0), arg(a, 5, 1.0)));
        register("bell_curve", 3, 4, "bell_curve(x, center, width, amplitude=1)",
            a -> bellCurve(a[0], a[1], a[2], arg(a, 3, 1.0)));
        register("bounded_linear", 2, 5, "bounded_linear(x, slope, intercept=0, min_val=0, max_val=inf)",
            a -> boundedLinear(a[0], a[1], arg(a, 2, 0.0), arg(a, 3, 0.0), arg(a, 4, Double.POSITIVE_INFINITY)));
        register("smooth_threshold", 2, 3, "smooth_threshold(x, threshold, width=1)",
            a -> smoothThreshold(a[0], a[1], arg(a, 2, 1.0)));
    }

    private FunctionCatalog() {
    }

    private static void register(String name, int minArgs, int maxArgs, String signature, Body body) {
        CATALOG.put(name, new CatalogFunction(name, minArgs, maxArgs, signature, body));
    }

    private static double arg(double[] args, int index, double defaultValue) {
        return index < args.length ? args[index] : defaultValue;
    }

    // ========== Lookup ==========

    /**
     * @return the catalog entry, or null when the name is not in the catalog
     */
    public static CatalogFunction getFunction(String name) {
        return CATALOG.get(name);
    }

    public static boolean contains(String name) {
        return CATALOG.containsKey(name);
    }

    /**
     * Sorted function names
     */
    public static List<String> listFunctions() {
        return Collections.unmodifiableList(new ArrayList<>(CATALOG.keySet()));
    }

    // ========== Math ==========

    /**
     * Round half to even, to the given number of decimal digits
     */
    public static double round(double x, int digits) {
        if (Double.isNaN(x) || Double.isInfinite(x)) {
            return x;
        }
        if (digits == 0) {
            return Math.rint(x);
        }
        return new BigDecimal(Double.toString(x)).setScale(digits, RoundingMode.HALF_EVEN).doubleValue();
    }

    // ========== Activation ==========

    /** A / (1 + e^(-k(x - x0))) */
    public static double sigmoid(double x, double center, double steepness, double amplitude) {
        return amplitude / (1.0 + Math.exp(-steepness * (x - center)));
    }

    /** A * tanh(k(x - x0)) */
    public static double tanhActivation(double x, double center, double steepness, double amplitude) {
        return amplitude * Math.tanh(steepness * (x - center));
    }

    public static double relu(double x, double threshold) {
        return Math.max(0.0, x - threshold);
    }

    public static double leakyRelu(double x, double threshold, double alpha) {
        return x > threshold ? x - threshold : alpha * (x - threshold);
    }

    /** (1/beta) * ln(1 + e^(beta x)) */
    public static double softplus(double x, double beta) {
        return (1.0 / beta) * Math.log(1.0 + Math.exp(beta * x));
    }

    // ========== Growth ==========

    public static double exponentialGrowth(double x, double rate) {
        return x * Math.exp(rate);
    }

    public static double exponentialDecay(double x, double halfLife) {
        return x * Math.exp(-Math.log(2.0) / halfLife);
    }

    /** r * x * (1 - x/K) */
    public static double logisticGrowth(double x, double carryingCapacity, double growthRate) {
        return growthRate * x * (1.0 - x / carryingCapacity);
    }

    /** r * x * ln(K/x), zero outside 0 < x < K */
    public static double gompertzGrowth(double x, double carryingCapacity, double growthRate) {
        if (x <= 0 || x >= carryingCapacity) {
            return 0.0;
        }
        return growthRate * x * Math.log(carryingCapacity / x);
    }

    // ========== Kinetics ==========

    /** Vmax * S / (Km + S) */
    public static double michaelisMenten(double substrate, double vmax, double km) {
        return vmax * substrate / (km + substrate);
    }

    /** Vmax * S^n / (Kd^n + S^n) */
    public static double hillEquation(double substrate, double vmax, double kd, double n) {
        double substrateN = Math.pow(substrate, n);
        return vmax * substrateN / (Math.pow(kd, n) + substrateN);
    }

    /** Vmax * S / (Km(1 + I/Ki) + S) */
    public static double competitiveInhibition(double substrate, double inhibitor, double vmax,
                                               double km, double ki) {
        double kmApparent = km * (1.0 + inhibitor / ki);
        return vmax * substrate / (kmApparent + substrate);
    }

    public static double massAction(double reactant1, double reactant2, double rateConstant) {
        return rateConstant * reactant1 * reactant2;
    }

    // ========== Densities ==========

    public static double normalPdf(double x, double mean, double std) {
        double coefficient = 1.0 / (std * Math.sqrt(2.0 * Math.PI));
        double z = (x - mean) / std;
        return coefficient * Math.exp(-0.5 * z * z);
    }

    public static double exponentialPdf(double x, double rate) {
        if (x < 0) {
            return 0.0;
        }
        return rate * Math.exp(-rate * x);
    }

    /** x^(k-1) e^(-x/theta) / (theta^k Gamma(k)), zero for x <= 0 */
    public static double gammaPdf(double x, double shape, double scale) {
        if (x <= 0) {
            return 0.0;
        }
        double coefficient = 1.0 / (Math.pow(scale, shape) * Gamma.gamma(shape));
        return coefficient * Math.pow(x, shape - 1.0) * Math.exp(-x / scale);
    }

    public static double uniform(double x, double low, double high) {
        if (low <= x && x <= high) {
            return 1.0 / (high - low);
        }
        return 0.0;
    }

    // ========== Signals ==========

    public static double step(double x, double threshold, double low, double high) {
        return x >= threshold ? high : low;
    }

    public static double ramp(double x, double start, double end, double low, double high) {
        if (x < start) {
            return low;
        } else if (x > end) {
            return high;
        }
        double fraction = (x - start) / (end - start);
        return low + fraction * (high - low);
    }

    public static double pulse(double x, double start, double end, double amplitude) {
        return (start <= x && x <= end) ? amplitude : 0.0;
    }

    public static double periodicPulse(double x, double period, double dutyCycle, double amplitude) {
        return phase(x, period) < dutyCycle ? amplitude : 0.0;
    }

    public static double triangleWave(double x, double period, double amplitude) {
        double phase = phase(x, period);
        if (phase < 0.5) {
            return 4.0 * amplitude * phase;
        }
        return 4.0 * amplitude * (1.0 - phase);
    }

    public static double sawtoothWave(double x, double period, double amplitude) {
        return amplitude * phase(x, period);
    }

    /** Two half-amplitude sigmoids: rise, plateau, rise again */
    public static double doubleSigmoid(double x, double center1, double center2,
                                       double steepness1, double steepness2, double amplitude) {
        return sigmoid(x, center1, steepness1, amplitude / 2.0)
            + sigmoid(x, center2, steepness2, amplitude / 2.0);
    }

    public static double bellCurve(double x, double center, double width, double amplitude) {
        double z = (x - center) / width;
        return amplitude * Math.exp(-0.5 * z * z);
    }

    public static double boundedLinear(double x, double slope, double intercept,
                                       double minVal, double maxVal) {
        double value = slope * x + intercept;
        return Math.max(minVal, Math.min(maxVal, value));
    }

    /** Sigmoid around the threshold with steepness 5/width */
    public static double smoothThreshold(double x, double threshold, double width) {
        return sigmoid(x, threshold, 5.0 / width, 1.0);
    }

    // position within the period in [0, 1)
    private static double phase(double x, double period) {
        double r = x % period;
        if (r < 0) {
            r += period;
        }
        return r / period;
    }
}
