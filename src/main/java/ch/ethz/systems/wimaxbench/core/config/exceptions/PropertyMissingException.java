package ch.ethz.systems.wimaxbench.core.config.exceptions;

public class PropertyMissingException extends RuntimeException {

    public PropertyMissingException(String property) {
        super("The property \"" + property + "\" is required but was not set.");
    }

}
