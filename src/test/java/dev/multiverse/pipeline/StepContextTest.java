package dev.multiverse.pipeline;

import dev.multiverse.model.Dataset;
import dev.multiverse.model.NamedOutcome;
import dev.multiverse.model.Option;
import dev.multiverse.model.Universe;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepContextTest {

    private static final Universe UNIVERSE = new Universe(4, Map.of("scale", "log"));
    private static final Dataset INPUT = Dataset.of(Map.of("x", List.of(1, 2, 3)));

    private StepContext context() {
        return new StepContext(UNIVERSE, Map.of("scale", Option.of("log", "ln")), INPUT);
    }

    @Test
    void initializesCorrectly() {
        var ctx = context();

        assertThat(ctx.universe().id()).isEqualTo(4);
        assertThat(ctx.dataset()).isSameAs(INPUT);
        assertThat(ctx.currentStep()).isNull();
        assertThat(ctx.stepCount()).isZero();
        assertThat(ctx.outcomes()).isEmpty();
    }

    @Test
    void exposesChosenOption() {
        var ctx = context();

        assertThat(ctx.choice("scale")).isEqualTo("log");
        assertThat(ctx.optionValue("scale")).isEqualTo("ln");
        assertThatThrownBy(() -> ctx.option("missing")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void enterStepTracksProgress() {
        var ctx = context();

        ctx.enterStep("load");
        ctx.enterStep("fit");

        assertThat(ctx.currentStep()).isEqualTo("fit");
        assertThat(ctx.stepCount()).isEqualTo(2);
    }

    @Test
    void replacingDatasetKeepsInput() {
        var ctx = context();
        Dataset derived = INPUT.filterRows(row -> ((Integer) row.get("x")) > 1);

        ctx.replaceDataset(derived);

        assertThat(ctx.dataset().rowCount()).isEqualTo(2);
        assertThat(ctx.input()).isSameAs(INPUT);
        assertThat(INPUT.rowCount()).isEqualTo(3);
    }

    @Test
    void workingValuesPassBetweenSteps() {
        var ctx = context();

        ctx.put("fit", 1.5);

        assertThat(ctx.has("fit")).isTrue();
        assertThat(ctx.get("fit", Double.class)).isEqualTo(1.5);
        assertThatThrownBy(() -> ctx.get("residuals"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("universe 4");
    }

    @Test
    void outcomesKeepEmissionOrder() {
        var ctx = context();

        ctx.emit("b", 1.0, 0.1);
        ctx.emit(new NamedOutcome.Parametric("a", 2.0, 0.2));

        assertThat(ctx.outcomes()).extracting(NamedOutcome::term).containsExactly("b", "a");
        assertThatThrownBy(() -> ctx.outcomes().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
