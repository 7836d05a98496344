package im.arun.pyfmt.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class Lists {
    private Lists() {}

    /**
     * Unmodifiable copy that tolerates a null list and null elements
     * (dict unpacking keys, keyword-only parameters without defaults).
     */
    static <T> List<T> copy(List<T> list) {
        if (list == null || list.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(list));
    }
}
