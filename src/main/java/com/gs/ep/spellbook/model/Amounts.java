package com.gs.ep.spellbook.model;

final class Amounts {

    private Amounts() {
    }

    /**
     * "1 minute", "10 minutes". The unit is given in the singular.
     */
    static String of(int amount, String unit) {
        return amount == 1 ? "1 " + unit : amount + " " + unit + "s";
    }
}
