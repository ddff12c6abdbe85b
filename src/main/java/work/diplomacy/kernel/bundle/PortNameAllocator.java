package work.diplomacy.kernel.bundle;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns raw dangle names into unique port names.
 *
 * <p>Trailing {@code _<digits>} runs are trimmed first so that appending the index of a duplicate
 * cannot collide with a name the author already numbered. Names that are unique after trimming
 * keep the trimmed form; duplicates become {@code key_0, key_1, ...} in input order.
 */
public final class PortNameAllocator {
    private static final Pattern NUMERIC_SUFFIX = Pattern.compile("(_[0-9]+)*$");

    private PortNameAllocator() {}

    public static String normalize(String rawName) {
        return NUMERIC_SUFFIX.matcher(rawName).replaceFirst("");
    }

    public static List<String> allocate(List<String> rawNames) {
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < rawNames.size(); i++) {
            groups.computeIfAbsent(normalize(rawNames.get(i)), key -> new ArrayList<>()).add(i);
        }

        String[] names = new String[rawNames.size()];
        for (var group : groups.entrySet()) {
            List<Integer> positions = group.getValue();
            if (positions.size() == 1) {
                names[positions.get(0)] = group.getKey();
                continue;
            }
            for (int j = 0; j < positions.size(); j++) {
                names[positions.get(j)] = group.getKey() + "_" + j;
            }
        }

        List<String> allocated = List.of(names);
        if (new HashSet<>(allocated).size() != allocated.size()) {
            throw new IllegalStateException("Port names are not unique: " + allocated);
        }
        return allocated;
    }
}
