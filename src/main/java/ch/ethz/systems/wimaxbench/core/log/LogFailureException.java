package ch.ethz.systems.wimaxbench.core.log;

public class LogFailureException extends RuntimeException {

    public LogFailureException(Exception cause) {
        super("Simulation logging failed: " + cause.getMessage(), cause);
    }

}
