package info.isaksson.erland.cxxtempl.templ;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/** A string attribute of a node or parameter that substitution reads and rewrites in place. */
final class TextSlot {

    private final Supplier<String> getter;
    private final Consumer<String> setter;

    private TextSlot(Supplier<String> getter, Consumer<String> setter) {
        this.getter = getter;
        this.setter = setter;
    }

    static TextSlot of(Supplier<String> getter, Consumer<String> setter) {
        return new TextSlot(getter, setter);
    }

    static TextSlot element(List<String> list, int index) {
        return new TextSlot(() -> list.get(index), v -> list.set(index, v));
    }

    String get() {
        return getter.get();
    }

    void set(String value) {
        setter.accept(value);
    }
}
