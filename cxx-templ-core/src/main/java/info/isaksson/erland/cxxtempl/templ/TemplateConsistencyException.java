package info.isaksson.erland.cxxtempl.templ;

/**
 * An internal inconsistency found while instantiating, such as a parameter pack surviving
 * expansion. Aborts the current instantiation only.
 */
public class TemplateConsistencyException extends RuntimeException {

    public TemplateConsistencyException(String message) {
        super(message);
    }
}
