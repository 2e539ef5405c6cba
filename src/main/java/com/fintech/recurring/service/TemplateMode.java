package com.fintech.recurring.service;

/**
 * What a template is for, inferred from which of its fields are populated.
 */
public enum TemplateMode {
    /**
     * No movement type: the template only contributes to its category budget.
     */
    BUDGET_ONLY,

    /**
     * Movement type set without auto-generation: seeds a manual movement form, possibly partially.
     */
    PRE_FILL,

    /**
     * Movement type set with auto-generation: creates ledger movements on its schedule.
     */
    AUTO_GENERATE
}
