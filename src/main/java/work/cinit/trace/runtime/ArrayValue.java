package work.cinit.trace.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import work.cinit.trace.shared.ExtractionException;
import work.cinit.trace.value.SymbolicValue.Undefined;

/**
 * Mutable routine-local array. It is snapshotted into an array literal when it escapes into a
 * symbolic value.
 */
public final class ArrayValue {
    private final List<Object> elements;

    public ArrayValue(Collection<?> elements) {
        this.elements = new ArrayList<>(elements);
    }

    public static ArrayValue ofSize(int size) {
        return new ArrayValue(Collections.nCopies(size, Undefined.INSTANCE));
    }

    public int size() {
        return elements.size();
    }

    public Object get(long index) {
        return elements.get(checkIndex(index));
    }

    public void set(long index, Object value) {
        elements.set(checkIndex(index), value);
    }

    public List<Object> elements() {
        return Collections.unmodifiableList(elements);
    }

    private int checkIndex(long index) {
        if (index < 0 || index >= elements.size()) {
            throw ExtractionException.invalidOperation("Index " + index + " out of bounds for array of size " + elements.size());
        }
        return (int) index;
    }

    @Override
    public String toString() {
        return "array" + elements;
    }
}
