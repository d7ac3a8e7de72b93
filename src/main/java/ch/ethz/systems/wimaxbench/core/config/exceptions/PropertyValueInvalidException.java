package ch.ethz.systems.wimaxbench.core.config.exceptions;

public class PropertyValueInvalidException extends RuntimeException {

    public PropertyValueInvalidException(String property, String value) {
        super("The value \"" + value + "\" of property \"" + property + "\" is invalid.");
    }

    public PropertyValueInvalidException(String property, String value, Throwable cause) {
        super("The value \"" + value + "\" of property \"" + property + "\" is invalid.", cause);
    }

}
