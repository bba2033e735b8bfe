package dev.multiverse.model;

import java.util.List;
import java.util.Optional;

/**
 * A decision point: a named place where the analysis can legitimately vary.
 */
public record Parameter(
    String name,
    List<Option> options
) {

    public Parameter {
        options = List.copyOf(options);
    }

    public Optional<Option> option(String optionName) {
        return options.stream().filter(o -> o.name().equals(optionName)).findFirst();
    }

    public boolean hasOption(String optionName) {
        return option(optionName).isPresent();
    }

    public List<String> optionNames() {
        return options.stream().map(Option::name).toList();
    }
}
