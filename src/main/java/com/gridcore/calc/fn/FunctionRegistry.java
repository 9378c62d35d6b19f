package com.gridcore.calc.fn;

import com.gridcore.calc.api.CellFunction;
import com.gridcore.calc.fn.builtin.Abs;
import com.gridcore.calc.fn.builtin.And;
import com.gridcore.calc.fn.builtin.Average;
import com.gridcore.calc.fn.builtin.Concatenate;
import com.gridcore.calc.fn.builtin.Count;
import com.gridcore.calc.fn.builtin.If;
import com.gridcore.calc.fn.builtin.Len;
import com.gridcore.calc.fn.builtin.Lower;
import com.gridcore.calc.fn.builtin.Max;
import com.gridcore.calc.fn.builtin.Min;
import com.gridcore.calc.fn.builtin.Not;
import com.gridcore.calc.fn.builtin.Or;
import com.gridcore.calc.fn.builtin.Round;
import com.gridcore.calc.fn.builtin.Sqrt;
import com.gridcore.calc.fn.builtin.Sum;
import com.gridcore.calc.fn.builtin.Trim;
import com.gridcore.calc.fn.builtin.Upper;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import lombok.extern.log4j.Log4j2;

/**
 * Case-insensitive registry of spreadsheet functions.
 */
@Log4j2
public final class FunctionRegistry {
    private final Map<String, CellFunction> registry = new TreeMap<>();

    /** A registry pre-loaded with the built-in functions. */
    public FunctionRegistry() {
        registerBuiltIns();
    }

    /** Registers (or replaces) {@code name}. */
    public void register(String name, CellFunction fn) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Function name must not be blank");
        String key = name.toUpperCase(Locale.ROOT);
        if (registry.put(key, fn) != null)
            log.debug("Replaced function {}", key);
    }

    /** The function registered under {@code name}, or null. */
    public CellFunction get(String name) {
        return registry.get(name.toUpperCase(Locale.ROOT));
    }

    public boolean contains(String name) {
        return registry.containsKey(name.toUpperCase(Locale.ROOT));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(registry.keySet());
    }

    private void registerBuiltIns() {
        // Math
        register(new Sum());
        register(new Average());
        register(new Min());
        register(new Max());
        register(new Count());
        register(new Round());
        register(new Abs());
        register(new Sqrt());

        // Text
        register(new Concatenate());
        register(new Len());
        register(new Upper());
        register(new Lower());
        register(new Trim());

        // Logical
        register(new If());
        register(new And());
        register(new Or());
        register(new Not());
    }

    private void register(AbstractCellFunction fn) {
        register(fn.name(), fn);
    }
}
