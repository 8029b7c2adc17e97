package com.tenantoptions.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds every concrete option and selection model, keyed by label.
 * <p>
 * Lifecycle: models are {@link #register(CatalogModel) registered}, then {@link #initialize()}
 * cross-checks the references between them and seals the registry. {@link #reset()} empties it
 * again, which tests use between cases.
 */
public final class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final Map<ModelLabel, CatalogModel> models = new LinkedHashMap<>();
    private boolean initialized;

    /**
     * Registers a model.
     *
     * @throws IllegalArgumentException if the model is null or its label is already registered
     * @throws IllegalStateException if the registry has been initialized
     */
    public synchronized ModelRegistry register(CatalogModel model) {
        if (model == null) {
            throw new IllegalArgumentException("model must not be null");
        }
        if (initialized) {
            throw new IllegalStateException("Registry is initialized; call reset() before registering " + model.label());
        }
        if (models.containsKey(model.label())) {
            throw new IllegalArgumentException("Model %s is already registered".formatted(model.label()));
        }
        models.put(model.label(), model);
        return this;
    }

    /**
     * Checks every set reference between models and seals the registry.
     *
     * @throws IncorrectModelException if a reference names an unregistered model or a model of the
     *         wrong kind
     */
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        for (CatalogModel model : models.values()) {
            if (model instanceof OptionModel option && option.selectionModel() != null) {
                requireKind(option, option.selectionModel(), SelectionModel.class);
            } else if (model instanceof SelectionModel selection && selection.optionModel() != null) {
                requireKind(selection, selection.optionModel(), OptionModel.class);
            }
        }
        initialized = true;
        log.debug("Model registry initialized with {} option and {} selection models",
                optionModels().size(), selectionModels().size());
    }

    /** Empties the registry and returns it to the registering state. */
    public synchronized void reset() {
        models.clear();
        initialized = false;
    }

    public synchronized boolean isInitialized() {
        return initialized;
    }

    public synchronized List<OptionModel> optionModels() {
        return ofKind(OptionModel.class).toList();
    }

    public synchronized List<SelectionModel> selectionModels() {
        return ofKind(SelectionModel.class).toList();
    }

    public synchronized Collection<CatalogModel> all() {
        return List.copyOf(models.values());
    }

    public synchronized Optional<CatalogModel> find(ModelLabel label) {
        return Optional.ofNullable(models.get(label));
    }

    public Optional<OptionModel> optionModel(ModelLabel label) {
        return find(label).filter(OptionModel.class::isInstance).map(OptionModel.class::cast);
    }

    public Optional<SelectionModel> selectionModel(ModelLabel label) {
        return find(label).filter(SelectionModel.class::isInstance).map(SelectionModel.class::cast);
    }

    /**
     * Looks a model up by full label ({@code tasks.TaskPriority}) or by bare model name, matched
     * case-insensitively.
     */
    public synchronized Optional<CatalogModel> lookup(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        if (reference.contains(".")) {
            return find(ModelLabel.parse(reference));
        }
        String wanted = reference.toLowerCase(Locale.ROOT);
        return models.values().stream()
                .filter(m -> m.label().modelName().equals(wanted))
                .findFirst();
    }

    /** Selection model paired with an option model, if both sides are configured. */
    public Optional<SelectionModel> selectionModelFor(OptionModel model) {
        return model.selectionModel() == null ? Optional.empty() : selectionModel(model.selectionModel());
    }

    /** Option model referenced by a selection model, if configured. */
    public Optional<OptionModel> optionModelFor(SelectionModel model) {
        return model.optionModel() == null ? Optional.empty() : optionModel(model.optionModel());
    }

    public synchronized List<CatalogModel> modelsForApp(String app) {
        return models.values().stream().filter(m -> m.label().app().equals(app)).toList();
    }

    /** App labels in alphabetical order. */
    public synchronized List<String> apps() {
        var apps = new TreeSet<String>();
        models.keySet().forEach(l -> apps.add(l.app()));
        return new ArrayList<>(apps);
    }

    // ── Private Helpers ──

    private <T extends CatalogModel> Stream<T> ofKind(Class<T> kind) {
        return models.values().stream().filter(kind::isInstance).map(kind::cast);
    }

    private void requireKind(CatalogModel owner, ModelLabel reference, Class<? extends CatalogModel> kind) {
        CatalogModel target = models.get(reference);
        if (target == null) {
            throw new IncorrectModelException(
                    "%s references %s, which is not registered".formatted(owner.label(), reference));
        }
        if (!kind.isInstance(target)) {
            throw new IncorrectModelException("%s references %s, which is not a %s"
                    .formatted(owner.label(), reference, kind.getSimpleName()));
        }
    }
}
