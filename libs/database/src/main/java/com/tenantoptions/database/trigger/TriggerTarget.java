package com.tenantoptions.database.trigger;

import com.tenantoptions.model.DatabaseVendor;
import com.tenantoptions.model.ModelLabel;
import com.tenantoptions.model.OptionModel;
import com.tenantoptions.model.SelectionModel;

/**
 * A selection table to guard, the option table it references and the trigger's name.
 *
 * @param model the selection model
 * @param selectionTable table receiving the inserts
 * @param optionTable table holding the referenced options
 * @param triggerName name from {@link TriggerNames#triggerName}
 */
public record TriggerTarget(ModelLabel model, String selectionTable, String optionTable, String triggerName) {

    public TriggerTarget {
        if (model == null) {
            throw new IllegalArgumentException("model must not be null");
        }
        TriggerNames.validate(selectionTable);
        TriggerNames.validate(optionTable);
        TriggerNames.validate(triggerName);
    }

    /** Builds the target for a selection model and the option model it references. */
    public static TriggerTarget of(SelectionModel selection, OptionModel option, DatabaseVendor vendor) {
        return new TriggerTarget(
                selection.label(),
                selection.table(),
                option.table(),
                TriggerNames.triggerName(selection.table(), vendor));
    }
}
