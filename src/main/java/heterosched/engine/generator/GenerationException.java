package heterosched.engine.generator;

/**
 * Generation parameters that cannot produce a runnable batch.
 * Fatal to a run: it is raised before any scheduling starts.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }
}
