package org.dice.simplifier.rewriting;

/**
 * Boolean algebra laws applied by the {@link RewriteEngine}, in the language they are
 * reported in.
 */
public enum Law {
    Idempotence("Idempotencia"),
    Annihilation("Anulación"),
    Identity("Identidad"),
    Complement("Complementario"),
    Absorption("Absorción"),
    DoubleNegation("Doble negación"),
    CommonFactor("Organización (factor común)");

    private final String label;

    Law(String label){
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
