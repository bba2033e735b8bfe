package dev.multiverse.engine;

import dev.multiverse.model.Condition;
import dev.multiverse.model.Option;
import dev.multiverse.model.Parameter;
import dev.multiverse.model.Universe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds declared decision points in declaration order.
 * Declaration order fixes expansion order and is the only direction a condition may reference.
 */
public final class BranchRegistry {

    private static final Logger log = LoggerFactory.getLogger(BranchRegistry.class);

    private final Map<String, Parameter> parameters = new LinkedHashMap<>();

    /**
     * Declare a parameter with its ordered options.
     *
     * @throws DeclarationException if {@code name} is blank or reserved, or {@code options} is empty
     * @throws DuplicateParameterException if {@code name} is already declared
     * @throws DuplicateOptionException if two options share a name
     * @throws InvalidConditionReferenceException if a condition references this or a later parameter,
     *         or an option the referenced parameter does not have
     */
    public Parameter declare(String name, List<Option> options) {
        if (name == null || name.isBlank()) {
            throw new DeclarationException("Parameter name must not be blank");
        }
        if (name.equals(Universe.ID_FIELD)) {
            throw new DeclarationException("Parameter name '%s' is reserved for the universe id".formatted(name));
        }
        if (parameters.containsKey(name)) {
            throw new DuplicateParameterException(name);
        }
        if (options == null || options.isEmpty()) {
            throw new DeclarationException("Parameter '%s' must declare at least one option".formatted(name));
        }

        var seen = new HashSet<String>();
        for (Option option : options) {
            if (option.name().isBlank()) {
                throw new DeclarationException("Parameter '%s' has an option with a blank name".formatted(name));
            }
            if (!seen.add(option.name())) {
                throw new DuplicateOptionException(name, option.name());
            }
            if (option.isConditional()) {
                checkReferences(name, option);
            }
        }

        Parameter parameter = new Parameter(name, options);
        parameters.put(name, parameter);
        log.debug("Declared parameter {} with options {}", name, parameter.optionNames());
        return parameter;
    }

    public Parameter declare(String name, Option... options) {
        return declare(name, List.of(options));
    }

    private void checkReferences(String name, Option option) {
        Condition condition = option.condition();
        for (Condition.Equals test : condition.tests()) {
            String ref = test.parameter();
            if (ref.equals(name)) {
                throw new InvalidConditionReferenceException(name, option.name(), ref,
                    "a condition cannot reference its own parameter");
            }
            Parameter referenced = parameters.get(ref);
            if (referenced == null) {
                throw new InvalidConditionReferenceException(name, option.name(), ref,
                    "parameter is not declared before '%s'".formatted(name));
            }
            if (!referenced.hasOption(test.option())) {
                throw new InvalidConditionReferenceException(name, option.name(), ref,
                    "no option '%s' (options: %s)".formatted(test.option(), referenced.optionNames()));
            }
        }
    }

    /** Declared parameters in declaration order. */
    public List<Parameter> parameters() {
        return List.copyOf(parameters.values());
    }

    public Optional<Parameter> parameter(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    public boolean contains(String name) {
        return parameters.containsKey(name);
    }

    public int size() {
        return parameters.size();
    }

    /** Parameter name to its ordered option names, in declaration order. */
    public Map<String, List<String>> optionNames() {
        var names = new LinkedHashMap<String, List<String>>();
        parameters.forEach((name, p) -> names.put(name, p.optionNames()));
        return Collections.unmodifiableMap(names);
    }

    /** Product of option counts: the universe count when no condition prunes anything. */
    public long unconditionedSize() {
        long product = 1;
        for (Parameter p : parameters.values()) {
            product = Math.multiplyExact(product, p.options().size());
        }
        return product;
    }

    @Override
    public String toString() {
        var parts = new ArrayList<String>();
        parameters.forEach((name, p) -> parts.add(name + p.optionNames()));
        return "BranchRegistry" + parts;
    }
}
