package plantopt.utility;

/**
 * Thrown when a scenario tree violates its structural invariants (dangling parent, wrong stage, orphan).
 */
public class TreeStructureException extends OptException {
    public TreeStructureException(String message) {
        super(message);
    }
}
