package com.entity.blocking.predicate;

import com.entity.blocking.index.Tokenizers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

final class SetPredicates {

    private static final char SEPARATOR = '|';

    private SetPredicates() {
    }

    static List<String> elements(Object value) {
        return Tokenizers.setElements(value);
    }

    static Set<String> sortedDistinct(Object value) {
        return new TreeSet<>(elements(value));
    }

    static Set<String> orderedDistinct(Object value) {
        return new LinkedHashSet<>(elements(value));
    }

    /**
     * Joins elements with {@code '|'}, escaping backslashes and separators inside elements
     * so that different element lists never render to the same key.
     */
    static String join(Collection<String> elements) {
        StringBuilder key = new StringBuilder();
        for (String element : elements) {
            if (key.length() > 0) {
                key.append(SEPARATOR);
            }
            key.append(element.replace("\\", "\\\\").replace("|", "\\|"));
        }
        return key.toString();
    }

    /**
     * One key per combination of {@code size} distinct elements, taken in sorted order.
     */
    static Set<String> combinations(Object value, int size) {
        List<String> sorted = new ArrayList<>(sortedDistinct(value));
        Set<String> keys = new LinkedHashSet<>();
        collect(sorted, size, 0, new ArrayList<>(size), keys);
        return keys;
    }

    private static void collect(List<String> sorted, int size, int start, List<String> current, Set<String> keys) {
        if (current.size() == size) {
            keys.add(join(current));
            return;
        }
        for (int i = start; i <= sorted.size() - (size - current.size()); i++) {
            current.add(sorted.get(i));
            collect(sorted, size, i + 1, current, keys);
            current.remove(current.size() - 1);
        }
    }
}
