package ch.ethz.systems.wimaxbench.core.config.exceptions;

public class PropertyNotExistingException extends RuntimeException {

    public PropertyNotExistingException(String property, String fileName) {
        super("The property \"" + property + "\" (set in " + fileName + ") is not an allowed property.");
    }

}
