package com.shafts.catalog.service.core;

import com.shafts.catalog.config.VocabularyCfg;
import com.shafts.catalog.model.ShaftField;

import java.util.Map;
import java.util.function.Function;

/**
 * The enum-valued fields whose vendor spellings are translated through vocabulary tables.
 */
public enum VocabularyKind {
    CLUB_TYPE(ShaftField.CLUB_TYPE, VocabularyCfg::getClubType),
    FLEX(ShaftField.FLEX, VocabularyCfg::getFlex),
    LAUNCH(ShaftField.LAUNCH, VocabularyCfg::getLaunch),
    SPIN(ShaftField.SPIN, VocabularyCfg::getSpin),
    KICKPOINT(ShaftField.KICKPOINT, VocabularyCfg::getKickpoint),
    TIP_STIFF(ShaftField.TIP_STIFF, VocabularyCfg::getTipStiff);

    private final ShaftField field;
    private final Function<VocabularyCfg, Map<String, String>> table;

    VocabularyKind(ShaftField field, Function<VocabularyCfg, Map<String, String>> table) {
        this.field = field;
        this.table = table;
    }

    public ShaftField field() {
        return field;
    }

    /**
     * @param cfg configuration section
     * @return the raw table of this kind declared in {@code cfg}, never {@code null}
     */
    public Map<String, String> tableOf(final VocabularyCfg cfg) {
        Map<String, String> declared = table.apply(cfg);
        return declared != null ? declared : Map.of();
    }
}
