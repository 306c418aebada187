package info.isaksson.erland.cxxtempl.core;

import info.isaksson.erland.cxxtempl.symtab.SymbolScope;
import info.isaksson.erland.cxxtempl.types.ParmList;

import java.util.Objects;

/**
 * One request to instantiate a template, e.g. {@code %template(IntBox) Box<int>;}.
 *
 * @param templateName name of the template, possibly qualified
 * @param arguments    actual arguments, defaults not applied
 * @param symName      external name of the instantiation; null for an anonymous one
 * @param scope        scope the request is made in
 * @param file         instantiation site, may be null
 * @param line         instantiation site line
 */
public record InstantiationRequest(String templateName, ParmList arguments, String symName,
                                   SymbolScope scope, String file, int line) {

    public InstantiationRequest {
        if (templateName == null || templateName.isEmpty()) {
            throw new IllegalArgumentException("templateName must not be empty");
        }
        Objects.requireNonNull(scope, "scope must not be null");
        arguments = arguments == null ? new ParmList() : arguments;
    }

    public static InstantiationRequest of(String templateName, ParmList arguments, String symName, SymbolScope scope) {
        return new InstantiationRequest(templateName, arguments, symName, scope, null, 0);
    }

    public InstantiationRequest at(String siteFile, int siteLine) {
        return new InstantiationRequest(templateName, arguments, symName, scope, siteFile, siteLine);
    }
}
