package info.isaksson.erland.cxxtempl.core;

/**
 * Options for template instantiation.
 *
 * <p>Passed to {@link TemplateInstantiator} and threaded through resolution and expansion; there is
 * no global state.</p>
 */
public final class TemplateOptions {
    /** Record template debug traces in the diagnostics (and log them at DEBUG). */
    public boolean debugTemplates = false;

    /** Link successful instantiations into the symbol scope. */
    public boolean publishResults = true;

    /** Fill missing defaults of template-id arguments from their own primary templates. */
    public boolean fillNestedDefaults = true;

    public TemplateOptions copy() {
        TemplateOptions o = new TemplateOptions();
        o.debugTemplates = debugTemplates;
        o.publishResults = publishResults;
        o.fillNestedDefaults = fillNestedDefaults;
        return o;
    }
}
