package com.cryptobot.backtester.optimizer;

import com.cryptobot.backtester.exception.ParameterValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Candidate values per parameter. Combinations are produced in declaration order,
 * with the first parameter varying slowest.
 */
public class ParameterGrid {

    private final Map<String, List<Object>> ranges;

    public ParameterGrid(Map<String, ? extends List<?>> ranges) {
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        if (ranges != null) {
            ranges.forEach((name, values) -> {
                if (values == null || values.isEmpty()) {
                    throw new ParameterValidationException("Parameter range '" + name + "' has no values");
                }
                copy.put(name, List.copyOf(values));
            });
        }
        this.ranges = Collections.unmodifiableMap(copy);
    }

    public static ParameterGrid of(Map<String, ? extends List<?>> ranges) {
        return new ParameterGrid(ranges);
    }

    public Map<String, List<Object>> getRanges() {
        return ranges;
    }

    /**
     * Number of combinations in the full cartesian product.
     *
     * @throws ParameterValidationException if the product overflows a long
     */
    public long size() {
        long size = 1;
        for (List<Object> values : ranges.values()) {
            try {
                size = Math.multiplyExact(size, values.size());
            } catch (ArithmeticException e) {
                throw new ParameterValidationException("Parameter grid " + ranges.keySet() + " is too large");
            }
        }
        return size;
    }

    /**
     * @throws ParameterValidationException if the grid has more than {@code maxCombinations} combinations
     */
    public void requireAtMost(long maxCombinations) {
        long size = size();
        if (size > maxCombinations) {
            throw new ParameterValidationException("Parameter grid has " + size
                    + " combinations, at most " + maxCombinations + " allowed");
        }
    }

    public List<Map<String, Object>> combinations() {
        List<Map<String, Object>> result = new ArrayList<>();
        expand(new ArrayList<>(ranges.keySet()), 0, new LinkedHashMap<>(), result);
        return result;
    }

    private void expand(List<String> names, int depth, Map<String, Object> current,
            List<Map<String, Object>> result) {
        if (depth == names.size()) {
            result.add(Collections.unmodifiableMap(new LinkedHashMap<>(current)));
            return;
        }
        String name = names.get(depth);
        for (Object value : ranges.get(name)) {
            current.put(name, value);
            expand(names, depth + 1, current, result);
        }
        current.remove(name);
    }

    @Override
    public String toString() {
        return "ParameterGrid" + ranges;
    }
}
