package info.isaksson.erland.cxxtempl.ast;

/** Declaration kinds of the declaration tree. */
public enum NodeKind {
    TEMPLATE("template"),
    CLASS("class"),
    CDECL("cdecl"),
    CONSTRUCTOR("constructor"),
    DESTRUCTOR("destructor"),
    USING("using"),
    EXTEND("extend"),
    ENUM("enum"),
    ENUM_ITEM("enumitem"),
    NAMESPACE("namespace"),
    TYPEMAP("typemap"),
    INSERT("insert");

    /** Stable external tag, used in JSON. */
    public final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    public static NodeKind fromTag(String tag) {
        if (tag == null) return null;
        for (NodeKind k : values()) {
            if (k.tag.equals(tag)) return k;
        }
        throw new IllegalArgumentException("Unknown node kind: " + tag);
    }
}
