package org.dice.simplifier;

/**
 * Configuration keys read by {@link SimplifierConfig}.
 */
public interface SimplifierParams {

    String PREFIX = "simplifier.";

    // most rewrite steps taken for a single expression before giving up
    String MAX_STEPS = PREFIX + "maxSteps";

    // classpath resource holding the defaults
    String RESOURCE = "simplifier.properties";
}
