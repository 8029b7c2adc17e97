package com.tenantoptions.store;

import com.tenantoptions.model.ModelLabel;
import com.tenantoptions.model.ModelRegistry;
import com.tenantoptions.model.OptionModel;
import com.tenantoptions.model.SelectionModel;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The managers bound to each registered model.
 * <p>
 * {@link #create(ModelRegistry, StoreContext)} binds an {@link OptionRepository} to every option
 * model and a {@link SelectionRepository} to every selection model whose option model is
 * registered. Hosts may bind their own manager implementations in place of these.
 */
public class OptionCatalog {

    private static final Logger log = LoggerFactory.getLogger(OptionCatalog.class);

    private final ModelRegistry registry;
    private final Map<ModelLabel, OptionManager> optionManagers = new ConcurrentHashMap<>();
    private final Map<ModelLabel, SelectionManager> selectionManagers = new ConcurrentHashMap<>();

    public OptionCatalog(ModelRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /** Builds a catalog with the JDBC repositories bound to every model of an initialized registry. */
    public static OptionCatalog create(ModelRegistry registry, StoreContext context) {
        if (!registry.isInitialized()) {
            throw new IllegalStateException("Model registry must be initialized before building the catalog");
        }
        var catalog = new OptionCatalog(registry);
        for (OptionModel model : registry.optionModels()) {
            SelectionModel paired = registry.selectionModelFor(model).orElse(null);
            catalog.bind(new OptionRepository(model, paired, context));
        }
        for (SelectionModel model : registry.selectionModels()) {
            registry.optionModelFor(model)
                    .flatMap(option -> catalog.optionManager(option.label()))
                    .ifPresentOrElse(
                            options -> catalog.bind(new SelectionRepository(model, options, context)),
                            () -> log.warn("{} has no option model; no selection manager bound", model.label()));
        }
        return catalog;
    }

    public ModelRegistry registry() {
        return registry;
    }

    /** Binds a manager to its model, replacing any earlier binding. */
    public void bind(OptionManager manager) {
        ModelLabel label = requireRegistered(manager == null ? null : manager.model().label());
        optionManagers.put(label, manager);
    }

    public void bind(SelectionManager manager) {
        ModelLabel label = requireRegistered(manager == null ? null : manager.model().label());
        selectionManagers.put(label, manager);
    }

    /** Removes whatever manager is bound to the label. */
    public boolean unbind(ModelLabel label) {
        return optionManagers.remove(label) != null | selectionManagers.remove(label) != null;
    }

    public Optional<OptionManager> optionManager(ModelLabel label) {
        return Optional.ofNullable(optionManagers.get(label));
    }

    public Optional<SelectionManager> selectionManager(ModelLabel label) {
        return Optional.ofNullable(selectionManagers.get(label));
    }

    /**
     * The option manager for a model reference given as a label or bare model name.
     *
     * @throws IllegalArgumentException if no option model matches or none is bound
     */
    public OptionManager requireOptionManager(String reference) {
        var model = registry.lookup(reference)
                .filter(OptionModel.class::isInstance)
                .orElseThrow(() -> new IllegalArgumentException("No option model named " + reference));
        return optionManager(model.label())
                .orElseThrow(() -> new IllegalArgumentException("No manager bound to " + model.label()));
    }

    private ModelLabel requireRegistered(ModelLabel label) {
        if (label == null) {
            throw new IllegalArgumentException("manager must not be null");
        }
        if (registry.find(label).isEmpty()) {
            throw new IllegalArgumentException("Model %s is not registered".formatted(label));
        }
        return label;
    }
}
