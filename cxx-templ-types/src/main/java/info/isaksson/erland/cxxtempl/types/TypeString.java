package info.isaksson.erland.cxxtempl.types;

import java.util.ArrayList;
import java.util.List;

/**
 * Operations on encoded type strings.
 *
 * <p>A type is a chain of prefix operators followed by a base, read outermost first:
 * {@code p.q(const).char} is a pointer to const char, {@code f(int).p.int} a function taking
 * {@code int} returning {@code int *}. The base is an identifier, optionally {@code ::}-qualified,
 * optionally a template-id {@code Name<A1,A2>} whose arguments are encoded types or value
 * expressions. Declarator strings are operator chains without a base.</p>
 *
 * <p>All methods are null-tolerant and return new strings.</p>
 */
public final class TypeString {

    private TypeString() {}

    // ------------------------------------------------------------------ decomposition

    /** Split into operator elements (each ending in {@code .}) followed by the base, if any. */
    public static List<String> split(String t) {
        List<String> out = new ArrayList<>();
        if (t == null || t.isEmpty()) return out;
        int i = 0;
        int n = t.length();
        while (i < n) {
            int end = operatorEnd(t, i);
            if (end < 0) {
                out.add(t.substring(i));
                break;
            }
            out.add(t.substring(i, end));
            i = end;
        }
        return out;
    }

    /** Operator of one element from {@link #split(String)}, or null when the element is the base. */
    public static TypeOperator operatorOf(String element) {
        if (element == null || !element.endsWith(".")) return null;
        return TypeOperator.of(element);
    }

    /** Everything in front of the base. */
    public static String prefix(String t) {
        if (t == null) return "";
        return t.substring(0, t.length() - base(t).length());
    }

    /** The base, or an empty string for a pure operator chain. */
    public static String base(String t) {
        List<String> el = split(t);
        if (el.isEmpty()) return "";
        String last = el.get(el.size() - 1);
        return operatorOf(last) == null ? last : "";
    }

    /** Last operator element of an operator chain, or null when there is none. */
    public static String last(String prefix) {
        List<String> el = split(prefix);
        for (int i = el.size() - 1; i >= 0; i--) {
            if (operatorOf(el.get(i)) != null) return el.get(i);
        }
        return null;
    }

    /** Argument of a parenthesized operator element, e.g. {@code const} for {@code q(const).}. */
    public static String argument(String element) {
        if (element == null) return "";
        int open = element.indexOf('(');
        if (open < 0) return "";
        int close = matchingClose(element, open);
        return close < 0 ? "" : element.substring(open + 1, close);
    }

    /** Parameter types of a function element or of a type whose outermost operator is a function. */
    public static List<String> functionParms(String t) {
        List<String> el = split(t);
        if (el.isEmpty() || operatorOf(el.get(0)) != TypeOperator.FUNCTION) return List.of();
        return splitTopLevel(argument(el.get(0)), ',');
    }

    // ------------------------------------------------------------------ classification

    public static boolean isPointer(String t) {
        return first(t) == TypeOperator.POINTER;
    }

    public static boolean isReference(String t) {
        TypeOperator op = first(t);
        return op == TypeOperator.REFERENCE || op == TypeOperator.RVALUE_REFERENCE;
    }

    public static boolean isQualifier(String t) {
        return first(t) == TypeOperator.QUALIFIER;
    }

    public static boolean isArray(String t) {
        return first(t) == TypeOperator.ARRAY;
    }

    public static boolean isFunction(String t) {
        return first(t) == TypeOperator.FUNCTION;
    }

    public static boolean isMemberPointer(String t) {
        return first(t) == TypeOperator.MEMBER_POINTER;
    }

    public static boolean isVariadic(String t) {
        return first(t) == TypeOperator.VARIADIC;
    }

    private static TypeOperator first(String t) {
        if (t == null) return null;
        int end = operatorEnd(t, 0);
        return end < 0 ? null : TypeOperator.of(t.substring(0, end));
    }

    /** Whether the base is a template-id such as {@code Box<int>}. */
    public static boolean isTemplate(String t) {
        String b = base(t);
        int lt = b.indexOf('<');
        return lt > 0 && b.endsWith(">");
    }

    /** A base that is not a (possibly qualified, possibly templated) type name. */
    public static boolean isExpression(String base) {
        if (base == null || base.isEmpty()) return false;
        return !isTypeName(base);
    }

    // ------------------------------------------------------------------ templates and scopes

    /** Name in front of the template arguments: {@code Box} for {@code Box<int>}. */
    public static String templatePrefix(String s) {
        if (s == null) return null;
        int lt = s.indexOf('<');
        return lt < 0 ? s : s.substring(0, lt);
    }

    /** Text after the first template argument list: {@code ::iterator} for {@code Box<int>::iterator}. */
    public static String templateSuffix(String s) {
        if (s == null) return "";
        int lt = s.indexOf('<');
        if (lt < 0) return "";
        int close = matchingAngle(s, lt);
        return close < 0 ? "" : s.substring(close + 1);
    }

    /** Arguments of the first template argument list. */
    public static List<String> templateArguments(String s) {
        if (s == null) return List.of();
        int lt = s.indexOf('<');
        if (lt < 0) return List.of();
        int close = matchingAngle(s, lt);
        if (close < 0) return List.of();
        return splitTopLevel(s.substring(lt + 1, close), ',');
    }

    /** {@code name} followed by the encoded argument list of {@code args}. */
    public static String addTemplate(String name, ParmList args) {
        return (name == null ? "" : name) + (args == null ? "<>" : args.templateArgs());
    }

    /** Split a name on top-level {@code ::}, keeping template argument lists intact. */
    public static List<String> splitScope(String name) {
        List<String> out = new ArrayList<>();
        if (name == null || name.isEmpty()) return out;
        int depth = 0;
        int start = 0;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '<' || c == '(') depth++;
            else if (c == '>' || c == ')') depth--;
            else if (depth == 0 && c == ':' && i + 1 < name.length() && name.charAt(i + 1) == ':') {
                out.add(name.substring(start, i));
                start = i + 2;
                i++;
            }
        }
        out.add(name.substring(start));
        return out;
    }

    /** Last component of a qualified name: {@code Box} for {@code ns::Box}. */
    public static String scopeLast(String name) {
        List<String> segs = splitScope(name);
        return segs.isEmpty() ? name : segs.get(segs.size() - 1);
    }

    // ------------------------------------------------------------------ editing

    /** Remove a leading variadic marker. */
    public static String delVariadic(String t) {
        if (t == null) return null;
        return isVariadic(t) ? t.substring(2) : t;
    }

    /**
     * Replace the type name {@code pat} by {@code rep} wherever it is used as a type: the base, the
     * first component of a qualified base, template arguments, function parameters, member-pointer
     * classes and array dimensions. A templated base {@code pat<..>} is only renamed when {@code rep}
     * is not a template-id itself, which keeps {@code Box<int>} intact when {@code Box} becomes
     * {@code Box<int>}. Value expressions get whole-identifier replacement with the rendered value.
     */
    public static String typenameReplace(String t, String pat, String rep) {
        if (t == null || pat == null || pat.isEmpty() || rep == null) return t;
        StringBuilder out = new StringBuilder(t.length() + rep.length());
        for (String e : split(t)) {
            TypeOperator op = operatorOf(e);
            if (op == null) {
                out.append(replaceInBase(e, pat, rep));
                continue;
            }
            switch (op) {
                case FUNCTION -> {
                    List<String> parms = new ArrayList<>();
                    for (String p : splitTopLevel(argument(e), ',')) parms.add(typenameReplace(p, pat, rep));
                    out.append("f(").append(String.join(",", parms)).append(").");
                }
                case MEMBER_POINTER -> out.append("m(").append(replaceInBase(argument(e), pat, rep)).append(").");
                case ARRAY -> out.append("a(").append(Identifiers.replace(argument(e), pat, str(rep))).append(").");
                default -> out.append(e);
            }
        }
        return out.toString();
    }

    private static String replaceInBase(String b, String pat, String rep) {
        if (b.isEmpty()) return b;
        if (b.equals(pat)) return rep;
        if (!isTypeName(b)) {
            String rendered = str(rep);
            return isTemplate(rep)
                    ? Identifiers.replaceUntemplated(b, pat, rendered)
                    : Identifiers.replace(b, pat, rendered);
        }
        List<String> segs = splitScope(b);
        List<String> out = new ArrayList<>(segs.size());
        for (int i = 0; i < segs.size(); i++) {
            String seg = segs.get(i);
            int lt = seg.indexOf('<');
            if (lt > 0 && seg.endsWith(">")) {
                String name = seg.substring(0, lt);
                String newName = (i == 0 && name.equals(pat) && !isTemplate(rep)) ? rep : name;
                List<String> args = new ArrayList<>();
                for (String a : templateArguments(seg)) args.add(typenameReplace(a, pat, rep));
                out.add(newName + "<" + String.join(",", args) + ">");
            } else if (i == 0 && seg.equals(pat)) {
                out.add(rep);
            } else {
                out.add(seg);
            }
        }
        return String.join("::", out);
    }

    /** Whether {@code t} uses {@code name} as a type anywhere {@link #typenameReplace} would reach. */
    public static boolean mentions(String t, String name) {
        if (t == null || name == null || name.isEmpty()) return false;
        return !typenameReplace(t, name, name + '\u0000').equals(t);
    }

    /**
     * Splice the actual pack into every pack expansion of {@code packName} found in function
     * parameter lists and template argument lists: {@code f(v.r.T).} with pack {@code A,B} becomes
     * {@code f(r.A,r.B).}. A pack expansion forming the whole of {@code t} is left to the caller.
     */
    public static String variadicReplace(String t, String packName, ParmList pack) {
        if (t == null || packName == null || pack == null) return t;
        StringBuilder out = new StringBuilder(t.length());
        for (String e : split(t)) {
            TypeOperator op = operatorOf(e);
            if (op == TypeOperator.FUNCTION) {
                out.append("f(").append(String.join(",", splice(splitTopLevel(argument(e), ','), packName, pack))).append(").");
            } else if (op == null) {
                out.append(variadicReplaceInBase(e, packName, pack));
            } else {
                out.append(e);
            }
        }
        return out.toString();
    }

    /** Expand one pack-expansion element ({@code v.r.T}) into one type per pack member. */
    public static List<String> expandPack(String variadicType, String packName, ParmList pack) {
        List<String> out = new ArrayList<>();
        String pattern = delVariadic(variadicType);
        for (Parm p : pack) out.add(typenameReplace(pattern, packName, p.valueOrType()));
        return out;
    }

    private static List<String> splice(List<String> items, String packName, ParmList pack) {
        List<String> out = new ArrayList<>();
        for (String item : items) {
            if (isVariadic(item) && mentions(item, packName)) {
                out.addAll(expandPack(item, packName, pack));
            } else {
                out.add(variadicReplace(item, packName, pack));
            }
        }
        return out;
    }

    private static String variadicReplaceInBase(String b, String packName, ParmList pack) {
        if (b.indexOf('<') < 0 || !isTypeName(b)) return b;
        List<String> segs = splitScope(b);
        List<String> out = new ArrayList<>(segs.size());
        for (String seg : segs) {
            int lt = seg.indexOf('<');
            if (lt > 0 && seg.endsWith(">")) {
                List<String> args = splice(templateArguments(seg), packName, pack);
                out.add(seg.substring(0, lt) + "<" + String.join(",", args) + ">");
            } else {
                out.add(seg);
            }
        }
        return String.join("::", out);
    }

    // ------------------------------------------------------------------ rendering

    /** Human-readable C++ rendering, e.g. {@code char const *} for {@code p.q(const).char}. */
    public static String str(String t) {
        return str(t, null);
    }

    /** Human-readable C++ declaration of {@code name} with type {@code t}. */
    public static String str(String t, String name) {
        String result = name == null ? "" : name;
        if (t == null) return result;
        List<String> el = split(t);
        boolean variadic = false;
        for (int i = 0; i < el.size(); i++) {
            String e = el.get(i);
            String next = i + 1 < el.size() ? el.get(i + 1) : null;
            TypeOperator op = operatorOf(e);
            if (op == null) {
                String b = renderBase(e);
                result = result.isEmpty() ? b : b + " " + result;
                continue;
            }
            switch (op) {
                case QUALIFIER -> result = result.isEmpty() ? argument(e) : argument(e) + " " + result;
                case POINTER, REFERENCE, RVALUE_REFERENCE, MEMBER_POINTER -> {
                    String sym = switch (op) {
                        case POINTER -> "*";
                        case REFERENCE -> "&";
                        case RVALUE_REFERENCE -> "&&";
                        default -> str(argument(e)) + "::*";
                    };
                    result = sym + result;
                    if (next != null && (operatorOf(next) == TypeOperator.ARRAY || operatorOf(next) == TypeOperator.FUNCTION)) {
                        result = "(" + result + ")";
                    }
                }
                case ARRAY -> result = result + "[" + argument(e) + "]";
                case FUNCTION -> {
                    List<String> parms = new ArrayList<>();
                    for (String p : splitTopLevel(argument(e), ',')) parms.add(str(p));
                    result = result + "(" + String.join(",", parms) + ")";
                }
                case VARIADIC -> variadic = true;
            }
        }
        result = result.trim();
        return variadic ? result + "..." : result;
    }

    private static String renderBase(String b) {
        if (b.indexOf('<') < 0 || !isTypeName(b)) return b;
        List<String> out = new ArrayList<>();
        for (String seg : splitScope(b)) {
            int lt = seg.indexOf('<');
            if (lt > 0 && seg.endsWith(">")) {
                List<String> args = new ArrayList<>();
                for (String a : templateArguments(seg)) args.add(str(a));
                out.add(seg.substring(0, lt) + "<" + String.join(",", args) + ">");
            } else {
                out.add(seg);
            }
        }
        return String.join("::", out);
    }

    // ------------------------------------------------------------------ scanning helpers

    /** Split on top-level separators, ignoring those nested in parentheses or angle brackets. */
    public static List<String> splitTopLevel(String s, char sep) {
        List<String> out = new ArrayList<>();
        if (s == null || s.isEmpty()) return out;
        int depth = 0;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(' || c == '<') depth++;
            else if (c == ')' || c == '>') depth--;
            else if (c == sep && depth == 0) {
                out.add(s.substring(start, i));
                start = i + 1;
            }
        }
        out.add(s.substring(start));
        return out;
    }

    private static int operatorEnd(String t, int i) {
        int n = t.length();
        if (i + 1 >= n) return -1;
        char c = t.charAt(i);
        char next = t.charAt(i + 1);
        if (next == '.' && (c == 'p' || c == 'r' || c == 'z' || c == 'v')) return i + 2;
        if (next == '(' && (c == 'q' || c == 'a' || c == 'f' || c == 'm')) {
            int close = matchingClose(t, i + 1);
            if (close > 0 && close + 1 < n && t.charAt(close + 1) == '.') return close + 2;
        }
        return -1;
    }

    private static int matchingClose(String s, int open) {
        int depth = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(') depth++;
            else if (c == ')') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    private static int matchingAngle(String s, int open) {
        int depth = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '<' || c == '(') depth++;
            else if (c == '>' || c == ')') {
                depth--;
                if (depth == 0) return c == '>' ? i : -1;
            }
        }
        return -1;
    }

    /** Each scope segment is an identifier (spaces and {@code ~} allowed) optionally ending in one argument list. */
    private static boolean isTypeName(String b) {
        for (String seg : splitScope(b)) {
            if (seg.isEmpty()) return false;
            int lt = seg.indexOf('<');
            String name = lt < 0 ? seg : seg.substring(0, lt);
            if (lt >= 0 && (!seg.endsWith(">") || matchingAngle(seg, lt) != seg.length() - 1)) return false;
            if (name.isBlank()) return false;
            for (int i = 0; i < name.length(); i++) {
                char c = name.charAt(i);
                if (!Identifiers.isIdentifierChar(c) && c != ' ' && c != '~') return false;
            }
        }
        return true;
    }
}
