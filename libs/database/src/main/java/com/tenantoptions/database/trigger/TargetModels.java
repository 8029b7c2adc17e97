package com.tenantoptions.database.trigger;

import com.tenantoptions.database.OperatorConsole;
import com.tenantoptions.model.CatalogModel;
import com.tenantoptions.model.ModelRegistry;
import com.tenantoptions.model.SelectionModel;
import java.util.ArrayList;
import java.util.List;

/** Picks the selection models a trigger command works on. */
final class TargetModels {

    private TargetModels() {}

    /**
     * Resolves {@code --model} or {@code --app}, or every selection model when neither is given.
     * Option models named explicitly are skipped with a warning.
     *
     * @throws IllegalArgumentException for an unknown model, or one outside the requested app
     */
    static List<SelectionModel> select(ModelRegistry registry, TriggerCommandOptions options, OperatorConsole console) {
        List<CatalogModel> candidates;
        if (options.model() != null) {
            CatalogModel model = registry.lookup(options.model())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown model: " + options.model()));
            if (options.app() != null && !model.label().app().equals(options.app())) {
                throw new IllegalArgumentException(
                        "Model %s does not belong to app %s".formatted(model.label(), options.app()));
            }
            candidates = List.of(model);
        } else if (options.app() != null) {
            candidates = registry.modelsForApp(options.app());
            if (candidates.isEmpty()) {
                console.warning("No models registered for app " + options.app());
            }
            candidates = candidates.stream().filter(SelectionModel.class::isInstance).toList();
        } else {
            candidates = new ArrayList<>(registry.selectionModels());
        }

        List<SelectionModel> selected = new ArrayList<>();
        for (CatalogModel candidate : candidates) {
            if (candidate instanceof SelectionModel selection) {
                selected.add(selection);
            } else {
                console.warning("Model %s is not a selection model. Skipping...".formatted(candidate.label()));
            }
        }
        return selected;
    }
}
